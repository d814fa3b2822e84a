package io.swarmmesh.distribution;

import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.AvailabilityStatus;
import io.swarmmesh.model.EscalationAction;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class AssignmentOptimizer {
    static final int MAX_ALTERNATIVES = 3;
    static final long MAX_CHECK_INTERVAL_MS = 30_000L;
    static final String NO_PROGRESS_TRIGGER = "no_progress_15min";
    static final String LOW_QUALITY_TRIGGER = "quality_below_threshold";

    private final AssignmentScorer scorer;
    private final SuccessPredictor predictor;
    private final double minTrustScore;
    private final long noProgressEscalationMs;

    public AssignmentOptimizer(AssignmentScorer scorer, SuccessPredictor predictor, double minTrustScore,
                               long noProgressEscalationMs) {
        this.scorer = scorer;
        this.predictor = predictor;
        this.minTrustScore = minTrustScore;
        this.noProgressEscalationMs = noProgressEscalationMs;
    }

    public boolean isEligible(TaskDefinition task, AgentCapability agent) {
        TaskDefinition.Requirements req = task.requirements();
        return agent.capabilities().containsAll(req.capabilities())
                && agent.hasHeadroom()
                && !req.excludedAgents().contains(agent.agentId())
                && agent.trustScore() >= minTrustScore
                && agent.availability() == AvailabilityStatus.AVAILABLE
                && req.resources().cpu() <= 1.0
                && req.resources().memory() <= 1.0;
    }

    public List<AgentCapability> eligibleAgents(TaskDefinition task, Collection<AgentCapability> agents) {
        return agents.stream().filter(agent -> isEligible(task, agent)).toList();
    }

    public Optional<AgentCapability> selectAgent(TaskDefinition task, Collection<AgentCapability> agents) {
        AgentCapability best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (AgentCapability agent : agents) {
            if (!isEligible(task, agent)) {
                continue;
            }
            double score = scorer.score(task, agent);
            if (score > bestScore) {
                best = agent;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public TaskAssignment buildAssignment(TaskDefinition task, AgentCapability agent,
                                          Collection<AgentCapability> fleet, long nowMs) {
        double confidence = predictor.predict(task, agent);
        long expectedTime = expectedTimeMs(task, agent);
        List<String> reasoning = List.of(
                String.format(Locale.ROOT, "capability match %.2f", WeightedAssignmentScorer.capabilityMatch(task, agent)),
                String.format(Locale.ROOT, "performance %.2f", WeightedAssignmentScorer.performanceScore(task, agent)),
                "load " + agent.currentLoad() + "/" + agent.maxLoad(),
                String.format(Locale.ROOT, "trust %.2f", agent.trustScore())
        );
        TaskDefinition.Resources res = task.requirements().resources();
        TaskAssignment.ResourceAllocation allocation = new TaskAssignment.ResourceAllocation(
                Math.min(1.0, res.cpu()),
                Math.min(1.0, res.memory()),
                Math.min(1.0, res.network()),
                Math.min(1.0, res.storage()),
                task.priority().allocationWeight()
        );
        AgentCapability.PerformanceMetrics metrics = agent.performance().byTaskType()
                .getOrDefault(task.type(), agent.performance().overall());
        TaskAssignment.QualityExpectation quality = new TaskAssignment.QualityExpectation(
                metrics.qualityScore(),
                expectedTime,
                Math.max(0.0, 1.0 - confidence) / 2.0
        );
        TaskAssignment.Details details = new TaskAssignment.Details(
                confidence,
                reasoning,
                alternatives(task, agent, fleet),
                allocation,
                quality
        );
        return new TaskAssignment(task.id(), agent.agentId(), nowMs, nowMs + expectedTime, details, monitoringPlan(task));
    }

    TaskAssignment.Monitoring monitoringPlan(TaskDefinition task) {
        long estimate = task.estimatedDurationMs();
        long interval = estimate > 0L ? Math.max(1L, Math.min(estimate / 10L, MAX_CHECK_INTERVAL_MS)) : MAX_CHECK_INTERVAL_MS;
        return new TaskAssignment.Monitoring(
                interval,
                true,
                List.of(
                        new TaskAssignment.QualityCheck("progress", 60_000L, 0.1, EscalationAction.WARN),
                        new TaskAssignment.QualityCheck("performance", 120_000L, 0.5, EscalationAction.ESCALATE)
                ),
                List.of(
                        new TaskAssignment.EscalationTrigger(NO_PROGRESS_TRIGGER, noProgressEscalationMs, EscalationAction.REASSIGN),
                        new TaskAssignment.EscalationTrigger(LOW_QUALITY_TRIGGER, 0.3, EscalationAction.ADD_AGENTS)
                )
        );
    }

    private List<String> alternatives(TaskDefinition task, AgentCapability chosen, Collection<AgentCapability> fleet) {
        List<AgentCapability> others = new ArrayList<>();
        for (AgentCapability agent : fleet) {
            if (!agent.agentId().equals(chosen.agentId()) && isEligible(task, agent)) {
                others.add(agent);
            }
        }
        others.sort(Comparator.comparingDouble((AgentCapability a) -> scorer.score(task, a)).reversed());
        return others.stream().limit(MAX_ALTERNATIVES).map(AgentCapability::agentId).toList();
    }

    private static long expectedTimeMs(TaskDefinition task, AgentCapability agent) {
        if (task.estimatedDurationMs() > 0L) {
            return task.estimatedDurationMs();
        }
        long average = agent.performance().overall().averageTimeMs();
        return average > 0L ? average : PhasedTaskDecomposer.DEFAULT_ESTIMATE_MS;
    }
}
