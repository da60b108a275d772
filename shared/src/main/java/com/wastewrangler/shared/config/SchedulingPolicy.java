package com.wastewrangler.shared.config;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Tunable constants of the scheduling rules.
 *
 * @param averageSpeedKph             speed used to derive a trip's duration from its route length
 * @param buffer                      padding around every trip, and the gap between packed trips
 * @param workdayStart                earliest allowed trip start
 * @param workdayEnd                  latest allowed trip end
 * @param maintenanceIntervalDays     a truck whose last maintenance is older than this is due
 * @param maintenanceLookaheadDays    a due truck already booked within this many days is skipped
 * @param checkTruckConflicts         whether a maintenance day must also be free of the truck's own trips and services
 */
public record SchedulingPolicy(
    double averageSpeedKph,
    Duration buffer,
    LocalTime workdayStart,
    LocalTime workdayEnd,
    int maintenanceIntervalDays,
    int maintenanceLookaheadDays,
    boolean checkTruckConflicts
) {

    public static final double DEFAULT_SPEED_KPH = 5.0;

    public SchedulingPolicy {
        if (averageSpeedKph <= 0) {
            throw new IllegalArgumentException("averageSpeedKph must be positive");
        }
        if (buffer == null || buffer.isNegative()) {
            throw new IllegalArgumentException("buffer must be a non-negative duration");
        }
        if (workdayStart == null || workdayEnd == null || !workdayStart.isBefore(workdayEnd)) {
            throw new IllegalArgumentException("workday must start before it ends");
        }
    }

    public static SchedulingPolicy defaults() {
        return new SchedulingPolicy(DEFAULT_SPEED_KPH, Duration.ofMinutes(30),
            LocalTime.of(8, 0), LocalTime.of(16, 0), 90, 10, true);
    }

    public SchedulingPolicy withTruckConflictCheck(boolean enabled) {
        return new SchedulingPolicy(averageSpeedKph, buffer, workdayStart, workdayEnd,
            maintenanceIntervalDays, maintenanceLookaheadDays, enabled);
    }

    /**
     * Driving time for a route of the given length, rounded to the second.
     */
    public Duration travelTime(double lengthKm) {
        return Duration.ofSeconds(Math.round(lengthKm / averageSpeedKph * 3600.0));
    }

    public LocalDateTime workdayStart(LocalDate date) {
        return date.atTime(workdayStart);
    }

    public LocalDateTime workdayEnd(LocalDate date) {
        return date.atTime(workdayEnd);
    }
}
