package com.wastewrangler.shared.model;

import jakarta.persistence.*;

@Entity
@Table(name = "routes")
public class Route {

    @Id
    private Integer id;

    @Column(name = "waste_type", nullable = false, length = 100)
    private String wasteType;

    @Column(name = "length_km", nullable = false)
    private double lengthKm;

    public Route() {}

    public Route(Integer id, String wasteType, double lengthKm) {
        this.id = id;
        this.wasteType = wasteType;
        this.lengthKm = lengthKm;
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }
    public String getWasteType() { return wasteType; }
    public void setWasteType(String wasteType) { this.wasteType = wasteType; }
    public double getLengthKm() { return lengthKm; }
    public void setLengthKm(double lengthKm) { this.lengthKm = lengthKm; }
}
