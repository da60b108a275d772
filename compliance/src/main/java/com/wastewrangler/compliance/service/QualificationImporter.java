package com.wastewrangler.compliance.service;

import com.wastewrangler.compliance.model.QualificationRecord;
import com.wastewrangler.shared.model.Employee;
import com.wastewrangler.shared.model.Technician;
import com.wastewrangler.shared.schedule.SchedulingError;
import com.wastewrangler.shared.schedule.SchedulingResult;
import com.wastewrangler.shared.store.FleetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies technician qualification claims one at a time; invalid claims are
 * skipped and the rest still go through.
 */
@Service
public class QualificationImporter {

    private static final Logger log = LoggerFactory.getLogger(QualificationImporter.class);

    private final FleetStore store;

    public QualificationImporter(FleetStore store) {
        this.store = store;
    }

    public SchedulingResult<Integer> updateTechnicians(List<QualificationRecord> records) {
        int applied = 0;
        for (QualificationRecord record : records) {
            Optional<SchedulingError> problem = apply(record);
            if (problem.isEmpty()) {
                applied++;
            } else {
                log.warn("Rejected qualification {} for {}: {}",
                    record.truckTypeCode(), record.fullName(), problem.get());
            }
        }
        log.info("Applied {} of {} technician qualifications", applied, records.size());
        return SchedulingResult.success(applied);
    }

    private Optional<SchedulingError> apply(QualificationRecord record) {
        SchedulingResult<Integer> resolved = resolve(record);
        if (!resolved.isSuccess()) {
            return resolved.errorKind();
        }
        try {
            store.insertTechnician(new Technician(resolved.value(), record.truckTypeCode()));
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Failed to store qualification {} for employee {}",
                record.truckTypeCode(), resolved.value(), e);
            return Optional.of(SchedulingError.STORAGE_FAILURE);
        }
    }

    /**
     * Employee id the record applies to.
     */
    private SchedulingResult<Integer> resolve(QualificationRecord record) {
        if (store.findTruckType(record.truckTypeCode()).isEmpty()) {
            return SchedulingResult.failure(SchedulingError.INVALID_TRUCK_TYPE);
        }
        List<Employee> matches = store.findEmployeesByName(record.fullName());
        if (matches.size() != 1) {
            return SchedulingResult.failure(SchedulingError.INVALID_EMPLOYEE);
        }
        int employeeId = matches.get(0).getId();
        if (store.isDriver(employeeId)) {
            return SchedulingResult.failure(SchedulingError.EMPLOYEE_IS_DRIVER);
        }
        if (store.hasTechnicianQualification(employeeId, record.truckTypeCode())) {
            return SchedulingResult.failure(SchedulingError.DUPLICATE_QUALIFICATION);
        }
        return SchedulingResult.success(employeeId);
    }
}
