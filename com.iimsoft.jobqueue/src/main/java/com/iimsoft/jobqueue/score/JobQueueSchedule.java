package com.iimsoft.jobqueue.score;

import com.iimsoft.jobqueue.domain.Machine;
import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.util.ArrayList;
import java.util.List;

@PlanningSolution
public class JobQueueSchedule {

    @ValueRangeProvider(id = "machineRange")
    @ProblemFactCollectionProperty
    private List<Machine> machineList = new ArrayList<>();

    @PlanningEntityCollectionProperty
    private List<JobAssignment> assignmentList = new ArrayList<>();

    @PlanningScore
    private HardSoftLongScore score;

    public JobQueueSchedule() {}

    public JobQueueSchedule(List<Machine> machineList, List<JobAssignment> assignmentList) {
        this.machineList = machineList;
        this.assignmentList = assignmentList;
    }

    public List<Machine> getMachineList() { return machineList; }
    public void setMachineList(List<Machine> machineList) { this.machineList = machineList; }
    public List<JobAssignment> getAssignmentList() { return assignmentList; }
    public void setAssignmentList(List<JobAssignment> assignmentList) { this.assignmentList = assignmentList; }
    public HardSoftLongScore getScore() { return score; }
    public void setScore(HardSoftLongScore score) { this.score = score; }
}
