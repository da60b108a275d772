package com.wastewrangler.compliance.model;

/**
 * A claim that the named employee may now maintain the given truck type.
 */
public record QualificationRecord(String firstName, String lastName, String truckTypeCode) {

    public String fullName() {
        return firstName + " " + lastName;
    }
}
