package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.MachineStatus;
import com.iimsoft.jobqueue.domain.QualityRequirements;
import com.iimsoft.jobqueue.result.AlertsAndRecommendations;
import com.iimsoft.jobqueue.result.OptimizationInsights;
import com.iimsoft.jobqueue.result.RiskLevel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Rule list of {category, predicate, message}. Each rule fires when its predicate holds for the
 * computed metrics; rules of one category keep their declaration order.
 */
public class InsightEngine {

    enum Category {
        IMPROVEMENT_AREA,
        BOTTLENECK,
        CAPACITY,
        PROCESS,
        STRATEGY,
        URGENT_ACTION,
        CAPACITY_WARNING,
        QUALITY_ALERT,
        EFFICIENCY,
        SCHEDULING_TIP
    }

    static final class Rule {
        final Category category;
        final Predicate<InsightContext> when;
        final Function<InsightContext, String> message;

        Rule(Category category, Predicate<InsightContext> when, Function<InsightContext, String> message) {
            this.category = category;
            this.when = when;
            this.message = message;
        }
    }

    private static final List<Rule> RULES = List.of(
            // insights
            rule(Category.IMPROVEMENT_AREA, c -> c.getSetupShare() > 15,
                    c -> fmt("Reduce setup times through better planning (setup is %.0f%% of processing time)", c.getSetupShare())),
            rule(Category.IMPROVEMENT_AREA, c -> c.getUtilizationSpread() > 30,
                    c -> fmt("Improve machine utilization balance (spread %.0f points)", c.getUtilizationSpread())),
            rule(Category.IMPROVEMENT_AREA, c -> c.getMaterialChangeovers() > 0,
                    c -> fmt("Optimize job sequencing for material changes (%d changeovers)", c.getMaterialChangeovers())),
            rule(Category.IMPROVEMENT_AREA, c -> c.getMetrics().getOnTimeDeliveryRate() < 95,
                    c -> fmt("Improve on-time delivery (currently %.1f%%)", c.getMetrics().getOnTimeDeliveryRate())),

            rule(Category.BOTTLENECK, c -> !c.getBottleneckMachines().isEmpty(),
                    c -> "Machines at or above bottleneck utilization: " + String.join(", ", c.getBottleneckMachines())),
            rule(Category.BOTTLENECK, c -> c.getSetupShare() > 25,
                    c -> "Setup time is a major constraint"),
            rule(Category.BOTTLENECK, c -> c.countByStatus(AssignmentStatus.ASSIGNED) < c.getJobCount(),
                    c -> "Material or thickness capability gap: some jobs have no compatible machine"),

            rule(Category.CAPACITY, c -> c.countByStatus(AssignmentStatus.UNASSIGNED) > 0,
                    c -> fmt("Add capability for %d unassignable job(s)", c.countByStatus(AssignmentStatus.UNASSIGNED))),
            rule(Category.CAPACITY, c -> c.getRisk().getScheduleRisk().isAtLeast(RiskLevel.HIGH),
                    c -> "Consider additional machine capacity"),
            rule(Category.CAPACITY, c -> operators(c) < c.getProblem().getAvailableMachineCount(),
                    c -> "Cross-train operators for flexibility"),
            rule(Category.CAPACITY, c -> c.getMetrics().getOvertimeHours() > maxOvertime(c),
                    c -> fmt("Overtime of %.1f h exceeds the %.1f h allowance", c.getMetrics().getOvertimeHours(), maxOvertime(c))),

            rule(Category.PROCESS, c -> c.getSetupShare() > 15,
                    c -> "Standardize setup procedures and implement quick-change tooling"),
            rule(Category.PROCESS, c -> c.getProblem().getMachines().stream().anyMatch(m -> m.getStatus() == MachineStatus.MAINTENANCE),
                    c -> "Use predictive maintenance to reduce unplanned downtime"),
            rule(Category.PROCESS, c -> c.getProblem().getMachines().stream().anyMatch(m -> m.getSetupTimeMultiplier() > 1.2),
                    c -> "Review machines with high setup-time multipliers"),

            rule(Category.STRATEGY, c -> c.getMaterialChangeovers() > 0,
                    c -> "Group similar jobs to minimize setups"),
            rule(Category.STRATEGY, c -> c.getProblem().getUrgentJobCount() > 0,
                    c -> "Use dynamic scheduling for urgent jobs"),
            rule(Category.STRATEGY, c -> c.getProblem().getJobQueue().stream().anyMatch(InsightEngine::hasDependencies),
                    c -> "Release dependent jobs as soon as their predecessors finish"),
            rule(Category.STRATEGY, c -> c.getJobCount() > 5,
                    c -> "Implement real-time monitoring"),

            // alerts
            rule(Category.URGENT_ACTION, c -> c.getMetrics().getOnTimeDeliveryRate() < 90,
                    c -> "On-time delivery rate below target - review schedule"),
            rule(Category.URGENT_ACTION, c -> c.countByStatus(AssignmentStatus.UNASSIGNED) > 0,
                    c -> "Resolve jobs without a compatible machine"),
            rule(Category.URGENT_ACTION, c -> c.getMetrics().getLateJobCount() > 0,
                    c -> fmt("%d job(s) projected to miss their due date", c.getMetrics().getLateJobCount())),

            rule(Category.CAPACITY_WARNING, c -> c.getRisk().getScheduleRisk().isAtLeast(RiskLevel.HIGH),
                    c -> "High schedule risk - consider additional capacity"),
            rule(Category.CAPACITY_WARNING, c -> !c.getBottleneckMachines().isEmpty(),
                    c -> "Bottleneck machines leave little room for rush orders"),
            rule(Category.CAPACITY_WARNING, c -> operators(c) < c.getProblem().getAvailableMachineCount(),
                    c -> "Fewer operators than available machines"),

            rule(Category.QUALITY_ALERT, c -> qualityCheckHours(c) > c.getMetrics().getTotalMakespan() * 0.1,
                    c -> fmt("Quality checks add %.1f h, over 10%% of processing time", qualityCheckHours(c))),
            rule(Category.QUALITY_ALERT, c -> inspection(c).equals("full") || inspection(c).equals("critical_only"),
                    c -> "Reserve inspection capacity for " + inspection(c).replace('_', ' ') + " inspection"),
            rule(Category.QUALITY_ALERT, c -> quality(c) != null && quality(c).getAllowableRework() > 5,
                    c -> fmt("Allowable rework of %.1f%% may hide process issues", quality(c).getAllowableRework())),

            rule(Category.EFFICIENCY, c -> c.getMaterialChangeovers() > 0 || c.getSetupShare() > 15,
                    c -> "Group similar jobs to reduce setup time"),
            rule(Category.EFFICIENCY, c -> c.getMetrics().getAverageUtilization() < 50,
                    c -> fmt("Low average machine utilization (%.0f%%)", c.getMetrics().getAverageUtilization())),

            rule(Category.SCHEDULING_TIP, c -> c.getProblem().getJobQueue().stream().anyMatch(j -> j.getEstimatedDuration() > 120),
                    c -> "Split long jobs to keep machines available for urgent work"),
            rule(Category.SCHEDULING_TIP, c -> c.getJobCount() > 5,
                    c -> "Monitor real-time progress and adjust as needed"));

    public OptimizationInsights insights(InsightContext context) {
        Map<Category, List<String>> fired = evaluate(context);
        return OptimizationInsights.builder()
                .improvementAreas(fired.get(Category.IMPROVEMENT_AREA))
                .bottleneckIdentification(fired.get(Category.BOTTLENECK))
                .capacityRecommendations(fired.get(Category.CAPACITY))
                .processImprovements(fired.get(Category.PROCESS))
                .schedulingStrategies(fired.get(Category.STRATEGY))
                .build();
    }

    public AlertsAndRecommendations alerts(InsightContext context) {
        Map<Category, List<String>> fired = evaluate(context);
        return AlertsAndRecommendations.builder()
                .urgentActions(fired.get(Category.URGENT_ACTION))
                .capacityWarnings(fired.get(Category.CAPACITY_WARNING))
                .qualityAlerts(fired.get(Category.QUALITY_ALERT))
                .efficiencyImprovements(fired.get(Category.EFFICIENCY))
                .schedulingTips(fired.get(Category.SCHEDULING_TIP))
                .build();
    }

    public List<String> recommendations(InsightContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("Optimized schedule for " + context.getJobCount() + " jobs");
        lines.add(fmt("Total makespan: %.1f hours", context.getMetrics().getTotalMakespan()));
        lines.add(fmt("On-time delivery rate: %.1f%%", context.getMetrics().getOnTimeDeliveryRate()));
        if (context.getMetrics().getOnTimeDeliveryRate() < 95) {
            lines.add("Consider adding buffer time to improve delivery performance");
        }
        if (context.getJobCount() > 5) {
            lines.add("Implement real-time monitoring for dynamic adjustments");
        }
        return lines;
    }

    Map<Category, List<String>> evaluate(InsightContext context) {
        Map<Category, List<String>> fired = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            fired.put(category, new ArrayList<>());
        }
        for (Rule rule : RULES) {
            if (rule.when.test(context)) {
                fired.get(rule.category).add(rule.message.apply(context));
            }
        }
        return fired;
    }

    private static Rule rule(Category category, Predicate<InsightContext> when, Function<InsightContext, String> message) {
        return new Rule(category, when, message);
    }

    private static int operators(InsightContext c) {
        return c.getProblem().getResourceConstraints() == null ? 0 : c.getProblem().getResourceConstraints().getAvailableOperators();
    }

    private static double maxOvertime(InsightContext c) {
        return c.getProblem().getOperationalConstraints() == null ? 0 : c.getProblem().getOperationalConstraints().getMaxOvertimeHours();
    }

    private static QualityRequirements quality(InsightContext c) {
        return c.getProblem().getQualityRequirements();
    }

    private static String inspection(InsightContext c) {
        QualityRequirements quality = quality(c);
        return quality == null || quality.getInspectionRequirements() == null
                ? "" : quality.getInspectionRequirements().toLowerCase(Locale.ROOT);
    }

    private static double qualityCheckHours(InsightContext c) {
        QualityRequirements quality = quality(c);
        return quality == null ? 0 : quality.getQualityCheckTime() * c.getJobCount() / 60d;
    }

    private static boolean hasDependencies(Job job) {
        return job.getDependencies() != null && !job.getDependencies().isEmpty();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
