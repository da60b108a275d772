package com.wastewrangler.vehicles.service;

import com.wastewrangler.shared.config.SchedulingPolicy;
import com.wastewrangler.shared.model.MaintenanceRecord;
import com.wastewrangler.shared.model.Technician;
import com.wastewrangler.shared.model.Trip;
import com.wastewrangler.shared.model.Truck;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.FleetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Books overdue trucks in for maintenance.
 *
 * A truck is overdue when its latest maintenance is more than the configured
 * interval before the reference date and nothing is booked for it within the
 * lookahead window. Trucks with no maintenance history are never picked up.
 * Each overdue truck, in id order, gets the first day after the reference
 * date on which a qualified technician is free; the lowest-id free technician
 * takes it. Each booking is committed as it is made.
 */
@Service
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final FleetStore store;
    private final SchedulingPolicy policy;

    public MaintenanceScheduler(FleetStore store, SchedulingPolicy policy) {
        this.store = store;
        this.policy = policy;
    }

    public SchedulingResult<Integer> scheduleMaintenance(LocalDate date) {
        List<Truck> due = dueForMaintenance(date);
        if (due.isEmpty()) {
            log.debug("No trucks due for maintenance as of {}", date);
            return SchedulingResult.success(0);
        }

        int booked = 0;
        for (Truck truck : due) {
            SchedulingResult<MaintenanceRecord> outcome = bookTruck(truck, date);
            if (outcome.isSuccess()) {
                booked++;
            } else {
                log.warn("Truck {} left unscheduled: {}", truck.getId(), outcome.error());
            }
        }
        log.info("Booked maintenance for {} of {} due trucks as of {}", booked, due.size(), date);
        return SchedulingResult.success(booked);
    }

    /**
     * Overdue trucks as of {@code date}, ascending by id.
     */
    public List<Truck> dueForMaintenance(LocalDate date) {
        Map<Integer, LocalDate> latest = new TreeMap<>();
        for (MaintenanceRecord record : store.findAllMaintenance()) {
            latest.merge(record.getTruckId(), record.getMaintenanceDate(),
                (a, b) -> a.isAfter(b) ? a : b);
        }
        Set<Integer> alreadyBooked = store.findMaintenanceBetween(date, date.plusDays(policy.maintenanceLookaheadDays()))
            .stream()
            .map(MaintenanceRecord::getTruckId)
            .collect(Collectors.toSet());

        List<Truck> due = new ArrayList<>();
        latest.forEach((truckId, last) -> {
            if (ChronoUnit.DAYS.between(last, date) > policy.maintenanceIntervalDays()
                    && !alreadyBooked.contains(truckId)) {
                store.findTruck(truckId).ifPresentOrElse(due::add,
                    () -> log.warn("Maintenance history references unknown truck {}", truckId));
            }
        });
        return due;
    }

    SchedulingResult<MaintenanceRecord> bookTruck(Truck truck, LocalDate date) {
        List<Technician> qualified = store.findTechniciansByTruckType(truck.getTruckType());
        if (qualified.isEmpty()) {
            return SchedulingResult.failure(SchedulingError.NO_QUALIFIED_TECHNICIAN);
        }

        // Bookings and trips are finite, so some later day is always free.
        for (LocalDate day = date.plusDays(1); ; day = day.plusDays(1)) {
            List<MaintenanceRecord> sameDay = store.findMaintenanceBetween(day, day);
            if (policy.checkTruckConflicts() && truckBusy(truck.getId(), day, sameDay)) {
                continue;
            }
            Set<Integer> busyTechnicians = sameDay.stream()
                .map(MaintenanceRecord::getTechnicianId)
                .collect(Collectors.toSet());
            Optional<Technician> technician = qualified.stream()
                .filter(t -> !busyTechnicians.contains(t.getEmployeeId()))
                .findFirst();
            if (technician.isEmpty()) {
                continue;
            }
            try {
                MaintenanceRecord record = store.insertMaintenance(
                    new MaintenanceRecord(truck.getId(), technician.get().getEmployeeId(), day));
                log.info("Truck {} booked for maintenance on {} with technician {}",
                    truck.getId(), day, record.getTechnicianId());
                return SchedulingResult.success(record);
            } catch (RuntimeException e) {
                log.error("Failed to store maintenance for truck {} on {}", truck.getId(), day, e);
                return SchedulingResult.failure(SchedulingError.STORAGE_FAILURE);
            }
        }
    }

    private boolean truckBusy(int truckId, LocalDate day, List<MaintenanceRecord> sameDay) {
        if (sameDay.stream().anyMatch(m -> m.getTruckId() == truckId)) {
            return true;
        }
        List<Trip> trips = store.findTripsOn(day);
        return trips.stream().anyMatch(t -> t.getTruckId() == truckId);
    }
}
