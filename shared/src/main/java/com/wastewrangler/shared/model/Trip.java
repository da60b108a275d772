package com.wastewrangler.shared.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * A scheduled run of a route by one truck and a pair of drivers.
 *
 * The two drivers form an unordered pair stored as (max, min) so that the
 * same crew always produces the same row.
 */
@Entity
@Table(name = "trips", indexes = {
    @Index(name = "idx_trips_start_time", columnList = "start_time"),
    @Index(name = "idx_trips_facility", columnList = "facility_id")
})
public class Trip extends BaseEntity {

    @Column(name = "route_id", nullable = false)
    private Integer routeId;

    @Column(name = "truck_id", nullable = false)
    private Integer truckId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    // unknown until the truck weighs in
    @Column
    private Double volume;

    @Column(name = "driver_high", nullable = false)
    private Integer driverHigh;

    @Column(name = "driver_low", nullable = false)
    private Integer driverLow;

    @Column(name = "facility_id", nullable = false)
    private Integer facilityId;

    public Trip() {}

    public Trip(Integer routeId, Integer truckId, LocalDateTime startTime,
                int driverA, int driverB, Integer facilityId) {
        this.routeId = routeId;
        this.truckId = truckId;
        this.startTime = startTime;
        this.driverHigh = Math.max(driverA, driverB);
        this.driverLow = Math.min(driverA, driverB);
        this.facilityId = facilityId;
    }

    public Integer getRouteId() { return routeId; }
    public void setRouteId(Integer routeId) { this.routeId = routeId; }
    public Integer getTruckId() { return truckId; }
    public void setTruckId(Integer truckId) { this.truckId = truckId; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
    public Double getVolume() { return volume; }
    public void setVolume(Double volume) { this.volume = volume; }
    public Integer getDriverHigh() { return driverHigh; }
    public void setDriverHigh(Integer driverHigh) { this.driverHigh = driverHigh; }
    public Integer getDriverLow() { return driverLow; }
    public void setDriverLow(Integer driverLow) { this.driverLow = driverLow; }
    public Integer getFacilityId() { return facilityId; }
    public void setFacilityId(Integer facilityId) { this.facilityId = facilityId; }
}
