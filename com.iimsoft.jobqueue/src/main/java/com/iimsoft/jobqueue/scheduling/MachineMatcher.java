package com.iimsoft.jobqueue.scheduling;

import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.Machine;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds machines able to process a job: status available, material in the compatibility list
 * and thickness within the machine's range.
 */
public class MachineMatcher {

    /**
     * @return the first eligible machine in pool order, empty when none qualifies
     * @throws IllegalArgumentException when the pool is empty
     */
    public Optional<Machine> match(Job job, List<Machine> machines) {
        requireMachines(machines);
        return machines.stream().filter(m -> m.canProcess(job)).findFirst();
    }

    /**
     * @return all eligible machines, in pool order
     * @throws IllegalArgumentException when the pool is empty
     */
    public List<Machine> eligibleMachines(Job job, List<Machine> machines) {
        requireMachines(machines);
        return machines.stream().filter(m -> m.canProcess(job)).collect(Collectors.toList());
    }

    public static void requireMachines(List<Machine> machines) {
        if (machines == null || machines.isEmpty()) {
            throw new IllegalArgumentException("No machines available");
        }
    }
}
