package com.wastewrangler.shared.config;

import com.wastewrangler.shared.store.FleetStore;
import com.wastewrangler.shared.store.InMemoryFleetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Central configuration shared by every WasteWrangler module.
 *
 * The JPA store registers itself when {@code wastewrangler.store.type} is
 * {@code jpa} (the default); the in-memory store is declared here.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${wastewrangler.scheduling.average-speed-kph:5}")
    private double averageSpeedKph;

    @Value("${wastewrangler.scheduling.buffer-minutes:30}")
    private long bufferMinutes;

    @Value("${wastewrangler.scheduling.workday-start:08:00}")
    private String workdayStart;

    @Value("${wastewrangler.scheduling.workday-end:16:00}")
    private String workdayEnd;

    @Value("${wastewrangler.maintenance.interval-days:90}")
    private int maintenanceIntervalDays;

    @Value("${wastewrangler.maintenance.lookahead-days:10}")
    private int maintenanceLookaheadDays;

    @Value("${wastewrangler.maintenance.check-truck-conflicts:true}")
    private boolean checkTruckConflicts;

    @Bean
    public SchedulingPolicy schedulingPolicy() {
        SchedulingPolicy policy = new SchedulingPolicy(
            averageSpeedKph,
            Duration.ofMinutes(bufferMinutes),
            LocalTime.parse(workdayStart),
            LocalTime.parse(workdayEnd),
            maintenanceIntervalDays,
            maintenanceLookaheadDays,
            checkTruckConflicts);
        log.info("Scheduling policy: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnProperty(name = "wastewrangler.store.type", havingValue = "memory")
    public FleetStore inMemoryFleetStore() {
        log.warn("Using the in-memory fleet store; data is lost on shutdown");
        return new InMemoryFleetStore();
    }
}
