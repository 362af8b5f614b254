package com.whaleradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for elevated_wallets. Loaded into the watchlist cache on first read.
 */
public interface ElevatedWalletRepository extends MongoRepository<ElevatedWallet, String> {
}
