package com.whaleradar.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TradeClusterRepository extends MongoRepository<TradeCluster, String> {

    List<TradeCluster> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
