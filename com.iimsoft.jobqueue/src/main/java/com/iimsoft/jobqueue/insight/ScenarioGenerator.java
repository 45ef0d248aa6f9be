package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.analysis.CostModel;
import com.iimsoft.jobqueue.analysis.PerformanceAnalyzer;
import com.iimsoft.jobqueue.calendar.WorkCalendar;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.OptimizationGoals;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.Scenario;
import com.iimsoft.jobqueue.scheduling.ScheduleBuilder;
import com.iimsoft.jobqueue.score.ScheduleScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Alternative schedules: the same queue rebuilt under other goal weights.
 * "Balanced Approach" reuses the baseline built from the caller's own goals.
 * "Minimum Makespan" is efficiency-led and falls back to the baseline sequence when that one
 * finishes earlier, so it is never longer than the baseline.
 */
public class ScenarioGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScenarioGenerator.class);

    static final String MINIMUM_MAKESPAN = "Minimum Makespan";
    static final String MAXIMUM_PROFIT = "Maximum Profit";
    static final String BALANCED = "Balanced Approach";

    private static final double EPSILON = 1e-6;

    private final ScheduleBuilder scheduleBuilder;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final CostModel costModel;
    private final ScheduleScorer scheduleScorer;

    public ScenarioGenerator(ScheduleBuilder scheduleBuilder, PerformanceAnalyzer performanceAnalyzer,
                             CostModel costModel, ScheduleScorer scheduleScorer) {
        this.scheduleBuilder = scheduleBuilder;
        this.performanceAnalyzer = performanceAnalyzer;
        this.costModel = costModel;
        this.scheduleScorer = scheduleScorer;
    }

    public List<Scenario> generate(JobQueueProblem problem, WorkCalendar calendar, Baseline baseline) {
        OptimizationGoals goals = problem.getOptimizationGoals();
        List<Scenario> scenarios = new ArrayList<>(3);
        scenarios.add(shortest(rebuild(MINIMUM_MAKESPAN, "Optimized for fastest completion",
                goals.withWeights(0.1, 0.1, 0.7, 0.1), problem, calendar, baseline), baseline));
        scenarios.add(rebuild(MAXIMUM_PROFIT, "Optimized for profitability",
                goals.withWeights(0.2, 0.7, 0.0, 0.1), problem, calendar, baseline));
        scenarios.add(toScenario(BALANCED, "Balance of time, cost, and quality",
                baseline.getSchedule(), baseline.getMetrics(), baseline.getCost(), baseline.getScore(),
                List.of("Moderate performance across all metrics")));
        return scenarios;
    }

    private Scenario rebuild(String name, String description, OptimizationGoals goals,
                             JobQueueProblem problem, WorkCalendar calendar, Baseline baseline) {
        List<ScheduledJob> schedule = scheduleBuilder.build(problem.getJobQueue(), problem.getMachines(),
                goals, problem.getReferenceTime());
        PerformanceMetrics metrics = performanceAnalyzer.analyze(schedule, problem.getMachines(), calendar,
                problem.getReferenceTime());
        CostAnalysis cost = costModel.analyze(schedule);
        String score = scheduleScorer.score(schedule, problem.getMachines(), problem.getReferenceTime()).toString();
        LOGGER.debug("Scenario {}: makespan {} h, score {}", name, metrics.getElapsedMakespan(), score);
        return toScenario(name, description, schedule, metrics, cost, score, tradeoffs(schedule, metrics, cost, baseline));
    }

    private static Scenario shortest(Scenario candidate, Baseline baseline) {
        if (candidate.getMakespan() <= baseline.getMetrics().getElapsedMakespan() + EPSILON) {
            return candidate;
        }
        LOGGER.debug("{} rebuild finishes later than the baseline, keeping the baseline sequence",
                candidate.getScenarioName());
        return toScenario(candidate.getScenarioName(), candidate.getDescription(), baseline.getSchedule(),
                baseline.getMetrics(), baseline.getCost(), baseline.getScore(),
                List.of("Same job sequence as the balanced schedule"));
    }

    private static Scenario toScenario(String name, String description, List<ScheduledJob> schedule,
                                       PerformanceMetrics metrics, CostAnalysis cost, String score,
                                       List<String> tradeoffs) {
        return Scenario.builder()
                .scenarioName(name)
                .description(description)
                .makespan(metrics.getElapsedMakespan())
                .onTimeRate(metrics.getOnTimeDeliveryRate())
                .totalCost(cost.getTotalCost())
                .totalTardiness(metrics.getTotalTardiness())
                .score(score)
                .jobSequence(schedule.stream().map(j -> j.getJob().getId()).collect(Collectors.toList()))
                .tradeoffs(tradeoffs)
                .build();
    }

    static List<String> tradeoffs(List<ScheduledJob> schedule, PerformanceMetrics metrics, CostAnalysis cost,
                                  Baseline baseline) {
        PerformanceMetrics base = baseline.getMetrics();
        List<String> tradeoffs = new ArrayList<>();
        compare(tradeoffs, metrics.getElapsedMakespan(), base.getElapsedMakespan(),
                "Shorter completion time", "Longer completion time", "h");
        compare(tradeoffs, -metrics.getOnTimeDeliveryRate(), -base.getOnTimeDeliveryRate(),
                "Higher on-time delivery rate", "Lower on-time delivery rate", null);
        compare(tradeoffs, metrics.getTotalTardiness(), base.getTotalTardiness(),
                "Less tardiness", "More tardiness", "h");
        compare(tradeoffs, cost.getTotalCost(), baseline.getCost().getTotalCost(),
                "Lower cost", "Higher cost", null);
        List<String> sequence = schedule.stream().map(j -> j.getJob().getId()).collect(Collectors.toList());
        List<String> baseSequence = baseline.getSchedule().stream().map(j -> j.getJob().getId()).collect(Collectors.toList());
        if (sequence.equals(baseSequence)) {
            tradeoffs.add("Same job sequence as the balanced schedule");
        } else {
            tradeoffs.add("Different job sequence, less flexibility for rush orders");
        }
        return tradeoffs;
    }

    // lower value is better
    private static void compare(List<String> out, double value, double baseline,
                                String better, String worse, String unit) {
        double delta = value - baseline;
        if (Math.abs(delta) < EPSILON) return;
        String suffix = unit == null ? "" : String.format(Locale.ROOT, " (%+.1f %s)", delta, unit);
        out.add((delta < 0 ? better : worse) + suffix);
    }
}
