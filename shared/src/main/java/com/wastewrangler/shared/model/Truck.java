package com.wastewrangler.shared.model;

import jakarta.persistence.*;

@Entity
@Table(name = "trucks")
public class Truck {

    @Id
    private Integer id;

    @Column(name = "truck_type", nullable = false, length = 20)
    private String truckType;

    @Column(nullable = false)
    private double capacity;

    public Truck() {}

    public Truck(Integer id, String truckType, double capacity) {
        this.id = id;
        this.truckType = truckType;
        this.capacity = capacity;
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }
    public String getTruckType() { return truckType; }
    public void setTruckType(String truckType) { this.truckType = truckType; }
    public double getCapacity() { return capacity; }
    public void setCapacity(double capacity) { this.capacity = capacity; }
}
