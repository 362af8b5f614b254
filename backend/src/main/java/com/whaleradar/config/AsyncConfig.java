package com.whaleradar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: scan-executor runs address iterations of one cycle (bounded by address-workers,
 * 1 = sequential); ledger-fetch-executor runs the fills and transfers fetch of one address side by side.
 */
@Configuration
public class AsyncConfig {

    public static final String SCAN_EXECUTOR = "scan-executor";
    public static final String LEDGER_FETCH_EXECUTOR = "ledger-fetch-executor";

    @Bean(name = SCAN_EXECUTOR)
    public Executor scanExecutor(@Value("${whaleradar.scan.address-workers:1}") int addressWorkers) {
        int workers = Math.max(1, addressWorkers);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setThreadNamePrefix("scan-");
        e.initialize();
        return e;
    }

    /** Two calls per address in flight, times the number of concurrent address workers. */
    @Bean(name = LEDGER_FETCH_EXECUTOR)
    public Executor ledgerFetchExecutor(@Value("${whaleradar.scan.address-workers:1}") int addressWorkers) {
        int threads = Math.max(1, addressWorkers) * 2;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("ledger-fetch-");
        e.initialize();
        return e;
    }
}
