package com.whaleradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for seen_digests. Writes go through EventStore (insert-if-absent upsert).
 */
public interface SeenDigestRepository extends MongoRepository<SeenDigest, String> {
}
