package com.iimsoft.jobqueue.engine;

import com.iimsoft.jobqueue.analysis.CostModel;
import com.iimsoft.jobqueue.analysis.CustomerImpactAnalyzer;
import com.iimsoft.jobqueue.analysis.PerformanceAnalyzer;
import com.iimsoft.jobqueue.analysis.ResourceUtilizationAnalyzer;
import com.iimsoft.jobqueue.analysis.RiskAssessor;
import com.iimsoft.jobqueue.calendar.WorkCalendar;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.insight.Baseline;
import com.iimsoft.jobqueue.insight.InsightContext;
import com.iimsoft.jobqueue.insight.InsightEngine;
import com.iimsoft.jobqueue.insight.ScenarioGenerator;
import com.iimsoft.jobqueue.insight.SensitivityAnalyzer;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.OptimizationResult;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.RealTimeAdjustments;
import com.iimsoft.jobqueue.result.ResourceUtilization;
import com.iimsoft.jobqueue.result.RiskAssessment;
import com.iimsoft.jobqueue.scheduling.MachineMatcher;
import com.iimsoft.jobqueue.scheduling.PriorityScorer;
import com.iimsoft.jobqueue.scheduling.ScheduleBuilder;
import com.iimsoft.jobqueue.score.ScheduleScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs one optimization: build the schedule, then analyze, score and explain it.
 * Stateless between calls; {@code problem.referenceTime} is the only notion of "now".
 */
public class JobQueueOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobQueueOptimizer.class);

    private final ScheduleBuilder scheduleBuilder;
    private final PerformanceAnalyzer performanceAnalyzer = new PerformanceAnalyzer();
    private final CostModel costModel;
    private final RiskAssessor riskAssessor = new RiskAssessor();
    private final ResourceUtilizationAnalyzer resourceAnalyzer;
    private final CustomerImpactAnalyzer customerImpactAnalyzer = new CustomerImpactAnalyzer();
    private final ScheduleScorer scheduleScorer = new ScheduleScorer();
    private final ScenarioGenerator scenarioGenerator;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final InsightEngine insightEngine = new InsightEngine();
    private final OptimizerSettings settings;

    public JobQueueOptimizer() {
        this(OptimizerSettings.load());
    }

    public JobQueueOptimizer(OptimizerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scheduleBuilder = new ScheduleBuilder(new PriorityScorer(), new MachineMatcher(), settings);
        this.costModel = new CostModel(settings);
        this.resourceAnalyzer = new ResourceUtilizationAnalyzer(settings.getBottleneckUtilization());
        this.scenarioGenerator = new ScenarioGenerator(scheduleBuilder, performanceAnalyzer, costModel, scheduleScorer);
        this.sensitivityAnalyzer = new SensitivityAnalyzer(scheduleBuilder, performanceAnalyzer);
    }

    public OptimizationResult optimize(JobQueueProblem problem) {
        Objects.requireNonNull(problem, "problem");
        Instant now = Objects.requireNonNull(problem.getReferenceTime(), "problem.referenceTime");
        long t0 = System.currentTimeMillis();

        WorkCalendar calendar = WorkCalendar.of(problem.getOperationalConstraints(), problem.getZone());
        List<ScheduledJob> schedule = scheduleBuilder.build(problem.getJobQueue(), problem.getMachines(),
                problem.getOptimizationGoals(), now);

        PerformanceMetrics metrics = performanceAnalyzer.analyze(schedule, problem.getMachines(), calendar, now);
        CostAnalysis cost = costModel.analyze(schedule);
        RiskAssessment risk = riskAssessor.assess(problem, schedule);
        ResourceUtilization resources = resourceAnalyzer.analyze(schedule, problem.getMachines(),
                problem.getResourceConstraints(), metrics, now);
        String score = scheduleScorer.score(schedule, problem.getMachines(), now).toString();

        InsightContext context = InsightContext.builder()
                .problem(problem)
                .schedule(schedule)
                .metrics(metrics)
                .cost(cost)
                .risk(risk)
                .resources(resources)
                .bottleneckUtilization(settings.getBottleneckUtilization())
                .build();

        List<ScheduledJob> unassignable = schedule.stream()
                .filter(j -> !j.isAssigned())
                .collect(Collectors.toList());

        OptimizationResult result = OptimizationResult.builder()
                .optimizedSchedule(schedule)
                .unassignableJobs(unassignable)
                .performanceMetrics(metrics)
                .resourceUtilization(resources)
                .costAnalysis(cost)
                .riskAssessment(risk)
                .optimizationInsights(insightEngine.insights(context))
                .alternativeSchedules(scenarioGenerator.generate(problem, calendar,
                        new Baseline(schedule, metrics, cost, score)))
                .sensitivityAnalysis(sensitivityAnalyzer.analyze(problem, calendar, metrics))
                .realTimeAdjustments(RealTimeAdjustments.standard())
                .customerImpact(customerImpactAnalyzer.analyze(schedule, now))
                .alertsAndRecommendations(insightEngine.alerts(context))
                .recommendations(insightEngine.recommendations(context))
                .keyMetrics(keyMetrics(schedule, metrics, cost, risk))
                .scheduleScore(score)
                .build();

        LOGGER.info("Optimized {} jobs on {} machines: makespan {} h, on-time {}%, risk {}, score {} ({} ms)",
                schedule.size(), problem.getMachines().size(),
                String.format(Locale.ROOT, "%.2f", metrics.getTotalMakespan()),
                String.format(Locale.ROOT, "%.1f", metrics.getOnTimeDeliveryRate()),
                risk.getScheduleRisk().getCode(), score, System.currentTimeMillis() - t0);
        if (!unassignable.isEmpty()) {
            LOGGER.warn("{} job(s) could not be assigned to a machine", unassignable.size());
        }
        return result;
    }

    private static Map<String, String> keyMetrics(List<ScheduledJob> schedule, PerformanceMetrics metrics,
                                                  CostAnalysis cost, RiskAssessment risk) {
        Map<String, String> key = new LinkedHashMap<>();
        key.put("Total Jobs", String.valueOf(schedule.size()));
        key.put("Makespan", String.format(Locale.ROOT, "%.1f hours", metrics.getTotalMakespan()));
        key.put("On-Time Rate", String.format(Locale.ROOT, "%.1f%%", metrics.getOnTimeDeliveryRate()));
        key.put("Utilization", String.format(Locale.ROOT, "%.1f%%", metrics.getAverageUtilization()));
        key.put("Total Cost", String.format(Locale.ROOT, "$%.0f", cost.getTotalCost()));
        key.put("Schedule Risk", risk.getScheduleRisk().getCode());
        return key;
    }
}
