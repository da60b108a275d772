package com.wastewrangler.shared.model;

import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "maintenance_records", indexes = {
    @Index(name = "idx_maintenance_date", columnList = "maintenance_date"),
    @Index(name = "idx_maintenance_truck", columnList = "truck_id")
})
public class MaintenanceRecord extends BaseEntity {

    @Column(name = "truck_id", nullable = false)
    private Integer truckId;

    @Column(name = "technician_id", nullable = false)
    private Integer technicianId;

    @Column(name = "maintenance_date", nullable = false)
    private LocalDate maintenanceDate;

    public MaintenanceRecord() {}

    public MaintenanceRecord(Integer truckId, Integer technicianId, LocalDate maintenanceDate) {
        this.truckId = truckId;
        this.technicianId = technicianId;
        this.maintenanceDate = maintenanceDate;
    }

    public Integer getTruckId() { return truckId; }
    public void setTruckId(Integer truckId) { this.truckId = truckId; }
    public Integer getTechnicianId() { return technicianId; }
    public void setTechnicianId(Integer technicianId) { this.technicianId = technicianId; }
    public LocalDate getMaintenanceDate() { return maintenanceDate; }
    public void setMaintenanceDate(LocalDate maintenanceDate) { this.maintenanceDate = maintenanceDate; }
}
