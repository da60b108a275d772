package com.wastewrangler.shared.schedule;

/**
 * Decision outcomes of the scheduling operations. These are returned inside a
 * {@link SchedulingResult}, never thrown.
 */
public enum SchedulingError {
    INVALID_ROUTE,
    INVALID_TRUCK,
    INVALID_DRIVER,
    INVALID_TRUCK_TYPE,
    INVALID_EMPLOYEE,
    NO_AVAILABLE_TRUCK,
    NO_AVAILABLE_DRIVER,
    NO_FACILITY,
    NO_ALTERNATE_FACILITY,
    NO_CANDIDATE_ROUTES,
    NO_TRIPS_TO_REROUTE,
    DUPLICATE_ROUTE_SAME_DAY,
    WORKING_HOURS_VIOLATION,
    NO_QUALIFIED_TECHNICIAN,
    EMPLOYEE_IS_DRIVER,
    DUPLICATE_QUALIFICATION,
    STORAGE_FAILURE;
}
