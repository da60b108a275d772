package com.wastewrangler.shared.model;

import jakarta.persistence.*;

/**
 * Qualification of an employee to maintain a truck type.
 */
@Entity
@Table(name = "technicians", uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "truck_type"}))
public class Technician extends BaseEntity {

    @Column(name = "employee_id", nullable = false)
    private Integer employeeId;

    @Column(name = "truck_type", nullable = false, length = 20)
    private String truckType;

    public Technician() {}

    public Technician(Integer employeeId, String truckType) {
        this.employeeId = employeeId;
        this.truckType = truckType;
    }

    public Integer getEmployeeId() { return employeeId; }
    public void setEmployeeId(Integer employeeId) { this.employeeId = employeeId; }
    public String getTruckType() { return truckType; }
    public void setTruckType(String truckType) { this.truckType = truckType; }
}
