package com.iimsoft.jobqueue.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shop-floor operating rules.
 * A null working-hours window means the shop runs around the clock.
 * A window whose end is not after its start crosses midnight (e.g. 22:00-06:00).
 */
@Data
@NoArgsConstructor
public class OperationalConstraints {
    private LocalTime workingHoursStart;
    private LocalTime workingHoursEnd;
    private Set<DayOfWeek> workingDays = EnumSet.allOf(DayOfWeek.class);
    private double maxOvertimeHours;        // per week
    private double minimumBreakTime;        // minutes between jobs
    private double maxContinuousRunTime;    // hours before a mandatory break
    private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();

    public boolean hasWorkingWindow() {
        return workingHoursStart != null && workingHoursEnd != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MaintenanceWindow {
        private LocalTime start;
        private LocalTime end;
        private String frequency;           // daily / weekly / monthly
    }
}
