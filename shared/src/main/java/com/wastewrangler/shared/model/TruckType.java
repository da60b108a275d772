package com.wastewrangler.shared.model;

import jakarta.persistence.*;

/**
 * A class of vehicle. Each truck type carries exactly one waste type.
 */
@Entity
@Table(name = "truck_types")
public class TruckType {

    @Id
    @Column(length = 20)
    private String code;

    @Column(name = "waste_type", nullable = false, length = 100)
    private String wasteType;

    public TruckType() {}

    public TruckType(String code, String wasteType) {
        this.code = code;
        this.wasteType = wasteType;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getWasteType() { return wasteType; }
    public void setWasteType(String wasteType) { this.wasteType = wasteType; }
}
