package com.wastewrangler.gateway.controller;

import com.wastewrangler.compliance.model.QualificationRecord;
import com.wastewrangler.gateway.service.WasteWrangler;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/scheduling")
public class SchedulingController {

    private final WasteWrangler wasteWrangler;

    public SchedulingController(WasteWrangler wasteWrangler) {
        this.wasteWrangler = wasteWrangler;
    }

    @PostMapping("/routes/{routeId}/trips")
    public ResponseEntity<Map<String, Boolean>> scheduleTrip(
            @PathVariable int routeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime time) {
        return ResponseEntity.ok(Map.of("scheduled", wasteWrangler.scheduleTrip(routeId, time)));
    }

    @PostMapping("/trucks/{truckId}/trips")
    public ResponseEntity<Map<String, Integer>> scheduleTrips(
            @PathVariable int truckId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(Map.of("scheduled", wasteWrangler.scheduleTrips(truckId, date)));
    }

    @PostMapping("/maintenance")
    public ResponseEntity<Map<String, Integer>> scheduleMaintenance(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(Map.of("scheduled", wasteWrangler.scheduleMaintenance(date)));
    }

    @PostMapping("/facilities/{facilityId}/reroute")
    public ResponseEntity<Map<String, Integer>> rerouteWaste(
            @PathVariable int facilityId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(Map.of("rerouted", wasteWrangler.rerouteWaste(facilityId, date)));
    }

    @GetMapping("/drivers/{employeeId}/workmates")
    public ResponseEntity<Set<Integer>> workmateSphere(@PathVariable int employeeId) {
        return ResponseEntity.ok(wasteWrangler.workmateSphere(employeeId));
    }

    @PostMapping("/technicians")
    public ResponseEntity<Map<String, Integer>> updateTechnicians(@RequestBody List<QualificationRecord> records) {
        return ResponseEntity.ok(Map.of("applied", wasteWrangler.updateTechnicians(records)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "service", "wastewrangler"));
    }
}
