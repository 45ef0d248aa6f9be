package com.iimsoft.jobqueue.service;

import com.iimsoft.jobqueue.api.dto.OptimizeRequest;
import com.iimsoft.jobqueue.api.dto.OptimizeResponse;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.*;
import com.iimsoft.jobqueue.engine.JobQueueOptimizer;
import com.iimsoft.jobqueue.result.OptimizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JSON-facing entry point: validate the request, map it to a {@link JobQueueProblem},
 * run the optimizer and map the result back.
 */
public class JobQueueOptimizationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobQueueOptimizationService.class);

    private final Clock clock;
    private final JobQueueOptimizer optimizer;

    public JobQueueOptimizationService() {
        this(Clock.systemUTC(), OptimizerSettings.load());
    }

    public JobQueueOptimizationService(Clock clock, OptimizerSettings settings) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.optimizer = new JobQueueOptimizer(settings);
    }

    public OptimizeResponse optimize(OptimizeRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);

        // 1) request -> domain
        JobQueueProblem problem = buildProblem(request);
        LOGGER.info("Optimizing {} jobs on {} machines, now = {}",
                problem.getJobQueue().size(), problem.getMachines().size(), problem.getReferenceTime());

        // 2) run
        OptimizationResult result = optimizer.optimize(problem);

        // 3) domain -> response
        return buildResponse(problem, result);
    }

    static void validateRequest(OptimizeRequest request) {
        if (request.jobQueue == null || request.jobQueue.isEmpty()) {
            throw new IllegalArgumentException("Job queue cannot be empty");
        }
        if (request.machineCapabilities == null || request.machineCapabilities.isEmpty()) {
            throw new IllegalArgumentException("At least one machine must be available");
        }
        if (request.resourceConstraints == null || request.resourceConstraints.availableOperators < 1) {
            throw new IllegalArgumentException("At least one operator must be available");
        }

        OptimizeRequest.OptimizationGoalsDto goals = request.optimizationGoals;
        if (goals != null) {
            requireWeight("customerSatisfactionWeight", goals.customerSatisfactionWeight);
            requireWeight("profitabilityWeight", goals.profitabilityWeight);
            requireWeight("efficiencyWeight", goals.efficiencyWeight);
            requireWeight("urgencyWeight", goals.urgencyWeight);
        }

        Set<String> jobIds = new HashSet<>();
        for (OptimizeRequest.JobDto job : request.jobQueue) {
            if (job == null || job.jobId == null || job.jobId.isBlank()) {
                throw new IllegalArgumentException("Every job needs a jobId");
            }
            if (!jobIds.add(job.jobId)) {
                throw new IllegalArgumentException("Duplicate job id: " + job.jobId);
            }
            if (job.estimatedDuration < 0) {
                throw new IllegalArgumentException("Job " + job.jobId + " has a negative estimatedDuration");
            }
            if (job.setupTime < 0) {
                throw new IllegalArgumentException("Job " + job.jobId + " has a negative setupTime");
            }
        }

        Set<String> machineIds = new HashSet<>();
        for (OptimizeRequest.MachineDto machine : request.machineCapabilities) {
            if (machine == null || machine.machineId == null || machine.machineId.isBlank()) {
                throw new IllegalArgumentException("Every machine needs a machineId");
            }
            if (!machineIds.add(machine.machineId)) {
                throw new IllegalArgumentException("Duplicate machine id: " + machine.machineId);
            }
        }

        requireAcyclic(request.jobQueue, jobIds);
    }

    private static void requireWeight(String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException("optimizationGoals." + name + " must be between 0 and 1");
        }
    }

    /**
     * Depth-first search over in-queue dependencies; unknown ids are left to the scheduler.
     */
    private static void requireAcyclic(List<OptimizeRequest.JobDto> jobs, Set<String> jobIds) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (OptimizeRequest.JobDto job : jobs) {
            List<String> deps = job.dependencies == null ? List.of()
                    : job.dependencies.stream().filter(jobIds::contains).collect(Collectors.toList());
            edges.put(job.jobId, deps);
        }
        Map<String, Integer> state = new HashMap<>();   // 1 = on stack, 2 = done
        for (String id : edges.keySet()) {
            Deque<String> path = new ArrayDeque<>();
            visit(id, edges, state, path);
        }
    }

    private static void visit(String id, Map<String, List<String>> edges, Map<String, Integer> state, Deque<String> path) {
        Integer s = state.get(id);
        if (s != null && s == 2) return;
        path.addLast(id);
        if (s != null && s == 1) {
            List<String> cycle = new ArrayList<>(path);
            cycle = cycle.subList(cycle.indexOf(id), cycle.size());
            throw new IllegalArgumentException("Circular job dependencies: " + String.join(" -> ", cycle));
        }
        state.put(id, 1);
        for (String dep : edges.get(id)) {
            visit(dep, edges, state, path);
        }
        state.put(id, 2);
        path.removeLast();
    }

    JobQueueProblem buildProblem(OptimizeRequest dto) {
        ZoneId zone = parse("timeZone", dto.timeZone, ZoneId::of, ZoneOffset.UTC);
        Instant now = dto.referenceTime == null || dto.referenceTime.isBlank()
                ? clock.instant()
                : parseInstant("referenceTime", dto.referenceTime, zone);

        JobQueueProblem problem = new JobQueueProblem();
        problem.setReferenceTime(now);
        problem.setZone(zone);

        // jobs
        List<Job> jobs = new ArrayList<>();
        for (OptimizeRequest.JobDto j : dto.jobQueue) {
            Job job = new Job(j.jobId, j.jobName);
            job.setPriority(enumOrDefault("priority", j.priority, PriorityTier::fromCode, null));
            job.setDueDate(j.dueDate == null || j.dueDate.isBlank() ? null : parseInstant("dueDate", j.dueDate, zone));
            job.setEstimatedDuration(j.estimatedDuration);
            job.setMaterialType(j.materialType);
            job.setThickness(j.thickness);
            job.setSetupTime(j.setupTime);
            job.setPartCount(j.partCount);
            job.setCustomerImportance(enumOrDefault("customerImportance", j.customerImportance,
                    CustomerImportance::fromCode, null));
            job.setProfitMargin(j.profitMargin);
            job.setDependencies(j.dependencies == null ? new ArrayList<>() : new ArrayList<>(j.dependencies));
            jobs.add(job);
        }
        problem.setJobQueue(jobs);

        // machines
        List<Machine> machines = new ArrayList<>();
        for (OptimizeRequest.MachineDto m : dto.machineCapabilities) {
            Machine machine = new Machine(m.machineId, m.machineName);
            machine.setMaxPower(m.maxPower);
            if (m.materialCompatibility != null) {
                machine.setMaterialCompatibility(new LinkedHashSet<>(m.materialCompatibility));
            }
            if (m.thicknessRange != null) {
                machine.setThicknessRange(new ThicknessRange(m.thicknessRange.min, m.thicknessRange.max));
            }
            machine.setStatus(enumOrDefault("currentStatus", m.currentStatus, MachineStatus::fromCode, MachineStatus.AVAILABLE));
            if (m.efficiency != null) machine.setEfficiency(m.efficiency);
            if (m.setupTimeMultiplier != null) machine.setSetupTimeMultiplier(m.setupTimeMultiplier);
            machine.setOperatorSkillLevel(enumOrDefault("operatorSkillLevel", m.operatorSkillLevel,
                    OperatorSkillLevel::fromCode, null));
            machines.add(machine);
        }
        problem.setMachines(machines);

        problem.setOperationalConstraints(buildOperationalConstraints(dto.operationalConstraints));
        problem.setOptimizationGoals(buildGoals(dto.optimizationGoals));
        problem.setResourceConstraints(buildResources(dto.resourceConstraints));
        if (dto.qualityRequirements != null) {
            OptimizeRequest.QualityRequirementsDto q = dto.qualityRequirements;
            problem.setQualityRequirements(new QualityRequirements(q.allowableRework, q.qualityCheckTime,
                    q.inspectionRequirements, q.qualityGateThreshold));
        }
        return problem;
    }

    private static OperationalConstraints buildOperationalConstraints(OptimizeRequest.OperationalConstraintsDto dto) {
        OperationalConstraints constraints = new OperationalConstraints();
        if (dto == null) {
            return constraints;
        }
        if (dto.workingHours != null && dto.workingHours.start != null && dto.workingHours.end != null) {
            constraints.setWorkingHoursStart(parseTime("workingHours.start", dto.workingHours.start));
            constraints.setWorkingHoursEnd(parseTime("workingHours.end", dto.workingHours.end));
        }
        if (dto.workingDays != null && !dto.workingDays.isEmpty()) {
            Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            for (String day : dto.workingDays) {
                try {
                    days.add(DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException | NullPointerException e) {
                    LOGGER.warn("Unknown working day '{}', ignoring", day);
                }
            }
            if (!days.isEmpty()) {
                constraints.setWorkingDays(days);
            }
        }
        constraints.setMaxOvertimeHours(dto.maxOvertimeHours);
        constraints.setMinimumBreakTime(dto.minimumBreakTime);
        constraints.setMaxContinuousRunTime(dto.maxContinuousRunTime);
        if (dto.maintenanceWindows != null) {
            for (OptimizeRequest.MaintenanceWindowDto w : dto.maintenanceWindows) {
                constraints.getMaintenanceWindows().add(new OperationalConstraints.MaintenanceWindow(
                        parseTime("maintenanceWindows.start", w.start),
                        parseTime("maintenanceWindows.end", w.end),
                        w.frequency));
            }
        }
        return constraints;
    }

    private static OptimizationGoals buildGoals(OptimizeRequest.OptimizationGoalsDto dto) {
        if (dto == null) {
            // no preference: weigh everything alike
            return new OptimizationGoals(0.25, 0.25, 0.25, 0.25);
        }
        OptimizationGoals goals = new OptimizationGoals(dto.customerSatisfactionWeight, dto.profitabilityWeight,
                dto.efficiencyWeight, dto.urgencyWeight);
        goals.setPrimaryObjective(enumOrDefault("primaryObjective", dto.primaryObjective,
                PrimaryObjective::fromCode, PrimaryObjective.BALANCE_WORKLOAD));
        if (dto.secondaryObjectives != null) {
            goals.setSecondaryObjectives(new ArrayList<>(dto.secondaryObjectives));
        }
        return goals;
    }

    private static ResourceConstraints buildResources(OptimizeRequest.ResourceConstraintsDto dto) {
        ResourceConstraints resources = new ResourceConstraints(dto.availableOperators);
        if (dto.operatorShifts != null) {
            for (OptimizeRequest.OperatorShiftDto s : dto.operatorShifts) {
                resources.getOperatorShifts().add(new ResourceConstraints.OperatorShift(s.shiftId,
                        parseTime("operatorShifts.startTime", s.startTime),
                        parseTime("operatorShifts.endTime", s.endTime),
                        s.operatorCount));
            }
        }
        if (dto.materialAvailability != null) {
            for (OptimizeRequest.MaterialAvailabilityDto m : dto.materialAvailability) {
                resources.getMaterialAvailability().add(new ResourceConstraints.MaterialStock(
                        m.materialType, m.availableQuantity, m.leadTime));
            }
        }
        if (dto.toolingAvailability != null) {
            for (OptimizeRequest.ToolingAvailabilityDto t : dto.toolingAvailability) {
                resources.getToolingAvailability().add(new ResourceConstraints.ToolingStock(
                        t.toolType, t.available, t.setupTime));
            }
        }
        return resources;
    }

    private static OptimizeResponse buildResponse(JobQueueProblem problem, OptimizationResult result) {
        OptimizeResponse response = new OptimizeResponse();
        response.referenceTime = problem.getReferenceTime().toString();
        response.optimizedSchedule = toDtos(result.getOptimizedSchedule());
        response.unassignableJobs = toDtos(result.getUnassignableJobs());
        response.performanceMetrics = result.getPerformanceMetrics();
        response.resourceUtilization = result.getResourceUtilization();
        response.costAnalysis = result.getCostAnalysis();
        response.riskAssessment = result.getRiskAssessment();
        response.optimizationInsights = result.getOptimizationInsights();
        response.alternativeSchedules = result.getAlternativeSchedules();
        response.sensitivityAnalysis = result.getSensitivityAnalysis();
        response.realTimeAdjustments = result.getRealTimeAdjustments();
        response.customerImpact = result.getCustomerImpact();
        response.alertsAndRecommendations = result.getAlertsAndRecommendations();
        response.recommendations = result.getRecommendations();
        response.keyMetrics = result.getKeyMetrics();
        response.scheduleScore = result.getScheduleScore();
        return response;
    }

    private static List<OptimizeResponse.ScheduledJobDto> toDtos(List<ScheduledJob> schedule) {
        List<OptimizeResponse.ScheduledJobDto> out = new ArrayList<>(schedule.size());
        for (ScheduledJob s : schedule) {
            OptimizeResponse.ScheduledJobDto dto = new OptimizeResponse.ScheduledJobDto();
            dto.jobId = s.getJob().getId();
            dto.jobName = s.getJob().getName();
            dto.assignedMachine = s.getAssignedMachineId();
            dto.assignmentStatus = s.getStatus().getCode();
            dto.scheduledStart = s.getScheduledStart().toString();
            dto.scheduledEnd = s.getScheduledEnd().toString();
            dto.estimatedDuration = s.getJob().getEstimatedDuration();
            dto.setupTime = s.getEffectiveSetupTime();
            dto.priority = s.getJob().getPriority() == null ? PriorityTier.NORMAL.getCode() : s.getJob().getPriority().getCode();
            dto.sequenceNumber = s.getSequenceNumber();
            dto.bufferTime = s.getBufferTime();
            dto.late = s.isLate();
            out.add(dto);
        }
        return out;
    }

    /**
     * Accepts an instant with offset, a local date-time or a plain date (start of day), the
     * latter two read in {@code zone}.
     */
    static Instant parseInstant(String field, String value, ZoneId zone) {
        String text = value.trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(zone).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid " + field + ": " + value, e);
        }
    }

    static LocalTime parseTime(String field, String value) {
        return parse(field, value, v -> LocalTime.parse(v.trim()), null);
    }

    private static <T> T parse(String field, String value, Function<String, T> parser, T fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid " + field + ": " + value, e);
        }
    }

    private static <E> E enumOrDefault(String field, String code, Function<String, E> lookup, E fallback) {
        if (code == null || code.isBlank()) {
            return fallback;
        }
        E value = lookup.apply(code);
        if (value == null) {
            LOGGER.warn("Unknown {} '{}', using {}", field, code, fallback == null ? "default" : fallback);
            return fallback;
        }
        return value;
    }
}
