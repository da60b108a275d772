package com.wastewrangler.dispatch.model;

/**
 * Two crew members for one truck. {@code lead} is the more senior one.
 */
public record DriverPair(DriverCandidate lead, DriverCandidate partner) {

    public DriverPair {
        if (lead.employeeId() == partner.employeeId()) {
            throw new IllegalArgumentException("a crew needs two different employees: " + lead.employeeId());
        }
    }

    public int high() {
        return Math.max(lead.employeeId(), partner.employeeId());
    }

    public int low() {
        return Math.min(lead.employeeId(), partner.employeeId());
    }
}
