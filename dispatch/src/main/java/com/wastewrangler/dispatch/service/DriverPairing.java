package com.wastewrangler.dispatch.service;

import com.wastewrangler.dispatch.model.DriverCandidate;
import com.wastewrangler.dispatch.model.DriverPair;

import java.util.List;
import java.util.Optional;

/**
 * Crew selection: at least one of the two employees must be able to drive the
 * truck. Candidates are expected in priority order (most senior first).
 */
public final class DriverPairing {

    private DriverPairing() {
        // Utility class - prevent instantiation
    }

    /**
     * The first candidate always leads. If the lead can drive the truck type,
     * the next candidate in line joins regardless of qualification; otherwise
     * the first later candidate who can drive it joins.
     */
    public static Optional<DriverPair> pick(List<DriverCandidate> candidates, String truckType) {
        if (candidates.size() < 2) {
            return Optional.empty();
        }
        DriverCandidate lead = candidates.get(0);
        if (lead.canDrive(truckType)) {
            return Optional.of(new DriverPair(lead, candidates.get(1)));
        }
        return pickSecondDriver(candidates, lead.employeeId(), truckType)
            .map(partner -> new DriverPair(lead, partner));
    }

    /**
     * First candidate after the head of the list who is qualified for
     * {@code requiredType} and is not {@code excludeId}.
     */
    public static Optional<DriverCandidate> pickSecondDriver(List<DriverCandidate> candidates,
                                                             int excludeId, String requiredType) {
        for (int i = 1; i < candidates.size(); i++) {
            DriverCandidate candidate = candidates.get(i);
            if (candidate.employeeId() != excludeId && candidate.canDrive(requiredType)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
