package com.wastewrangler.shared.model;

import jakarta.persistence.*;

@Entity
@Table(name = "facilities")
public class Facility {

    @Id
    private Integer id;

    @Column(name = "waste_type", nullable = false, length = 100)
    private String wasteType;

    public Facility() {}

    public Facility(Integer id, String wasteType) {
        this.id = id;
        this.wasteType = wasteType;
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }
    public String getWasteType() { return wasteType; }
    public void setWasteType(String wasteType) { this.wasteType = wasteType; }
}
