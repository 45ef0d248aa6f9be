package com.iimsoft.jobqueue.config;

/**
 * What the schedule builder does with a job no available machine can process.
 */
public enum UnassignablePolicy {
    /** Keep the job on the holding lane, mark it UNASSIGNED and report it. */
    FLAG_UNASSIGNABLE,
    /** Put the job on the first machine of the pool regardless of its constraints. */
    FALLBACK_TO_FIRST_MACHINE
}
