package com.wastewrangler.dispatch.model;

import java.time.LocalDate;
import java.util.Set;

/**
 * An employee eligible to crew a trip, with the truck types they may drive.
 */
public record DriverCandidate(int employeeId, LocalDate hireDate, Set<String> truckTypes) {

    public DriverCandidate {
        truckTypes = Set.copyOf(truckTypes);
    }

    public boolean canDrive(String truckType) {
        return truckTypes.contains(truckType);
    }
}
