package com.whaleradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool (2 threads) for @Scheduled jobs: WatchlistScan, StatusReport, LargeTradeHousekeeping.
 * The scan job uses fixedDelay, so cycles never overlap even with a second thread available.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    /** Wall clock used for scan start times, cursors and detection windows. Replaced in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
