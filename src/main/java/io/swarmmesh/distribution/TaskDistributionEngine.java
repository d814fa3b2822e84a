package io.swarmmesh.distribution;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.error.CapacityException;
import io.swarmmesh.error.SwarmTimeoutException;
import io.swarmmesh.error.ValidationException;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.event.SwarmEvents;
import io.swarmmesh.model.AgentCapability;
import io.swarmmesh.model.AvailabilityStatus;
import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.DecomposedTask;
import io.swarmmesh.model.EscalationAction;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskComplexity;
import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskStatus;
import io.swarmmesh.observability.StructuredLogger;
import io.swarmmesh.util.Ids;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

public final class TaskDistributionEngine {
    private static final StructuredLogger LOG = StructuredLogger.of(TaskDistributionEngine.class);
    private static final long THROUGHPUT_WINDOW_MS = 60_000L;

    private final String nodeId;
    private final SwarmSettings settings;
    private final TaskDecomposer decomposer;
    private final AssignmentOptimizer optimizer;
    private final WorkloadBalancer balancer;
    private final FailureHandler failureHandler;
    private final AssignmentNotifier notifier;
    private final SwarmEventBus bus;
    private final LongSupplier clock;

    private final TaskQueue queue = new TaskQueue();
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
    private final Map<String, DecomposedTask> decompositions = new LinkedHashMap<>();
    private final Map<String, AgentCapability> agents = new LinkedHashMap<>();
    private final Map<String, TaskAssignment> assignments = new LinkedHashMap<>();
    private final ArrayDeque<Long> recentCompletions = new ArrayDeque<>();
    private final RebalanceContext rebalanceContext = new EngineRebalanceContext();

    private long totalTasks;
    private long completedTasks;
    private long failedTasks;
    private long cancelledTasks;
    private long retriedAttempts;
    private long waitSamples;
    private long waitTotalMs;
    private long executionSamples;
    private long executionTotalMs;
    private DistributionMetrics lastMetrics;

    public TaskDistributionEngine(
            String nodeId,
            SwarmSettings settings,
            TaskDecomposer decomposer,
            AssignmentOptimizer optimizer,
            WorkloadBalancer balancer,
            FailurePolicy failurePolicy,
            AssignmentNotifier notifier,
            SwarmEventBus bus,
            LongSupplier clock
    ) {
        this.nodeId = nodeId;
        this.settings = settings;
        this.decomposer = decomposer;
        this.optimizer = optimizer;
        this.balancer = balancer;
        this.failureHandler = new FailureHandler(failurePolicy);
        this.notifier = notifier;
        this.bus = bus;
        this.clock = clock;
    }

    public String submitTask(TaskDefinition definition) {
        if (definition == null) {
            throw new ValidationException("task definition is required");
        }
        if (definition.constraints().maxRetries() < 0) {
            throw new ValidationException("maxRetries must be >= 0");
        }
        if (definition.estimatedDurationMs() < 0L) {
            throw new ValidationException("estimatedDurationMs must be >= 0");
        }
        long now = clock.getAsLong();
        String id = definition.id() == null || definition.id().isBlank() ? Ids.taskId(now) : definition.id();
        if (tasks.containsKey(id)) {
            throw new ValidationException("Task " + id + " already exists");
        }
        TaskDefinition task = definition.withId(id).withCreatedAtMs(definition.createdAtMs() > 0L ? definition.createdAtMs() : now);
        TaskRecord record = new TaskRecord(task, null, now);
        tasks.put(id, record);
        totalTasks++;

        List<String> subtaskIds = List.of();
        if (task.needsDecomposition()) {
            DecomposedTask decomposed = decomposer.decompose(task);
            decompositions.put(id, decomposed);
            List<String> ids = new ArrayList<>();
            for (DecomposedTask.SubTask subtask : decomposed.subtasks()) {
                TaskDefinition child = toTaskDefinition(task, subtask, now);
                if (tasks.containsKey(child.id())) {
                    throw new ValidationException("Subtask id " + child.id() + " collides with an existing task");
                }
                TaskRecord childRecord = new TaskRecord(child, id, now);
                childRecord.status = TaskStatus.QUEUED;
                tasks.put(child.id(), childRecord);
                queue.enqueue(child);
                totalTasks++;
                ids.add(child.id());
            }
            record.subtaskIds().addAll(ids);
            subtaskIds = List.copyOf(ids);
        } else {
            record.status = TaskStatus.QUEUED;
            queue.enqueue(task);
        }
        bus.publish(new SwarmEvents.TaskSubmitted(nodeId, id, task.priority(), task.complexity(), subtaskIds));
        LOG.info("Task submitted", StructuredLogger.fields(
                "taskId", id,
                "priority", task.priority().wire(),
                "complexity", task.complexity().wire(),
                "subtasks", subtaskIds.size()
        ));
        return id;
    }

    public void registerAgent(AgentCapability capability) {
        if (capability == null || capability.agentId() == null || capability.agentId().isBlank()) {
            throw new ValidationException("agent id is required");
        }
        if (capability.maxLoad() < 1) {
            throw new ValidationException("maxLoad must be >= 1 for agent " + capability.agentId());
        }
        if (capability.currentLoad() < 0 || capability.currentLoad() > capability.maxLoad()) {
            throw new ValidationException("currentLoad must be within [0, maxLoad] for agent " + capability.agentId());
        }
        agents.put(capability.agentId(), capability);
        bus.publish(new SwarmEvents.AgentRegistered(nodeId, capability.agentId(), capability.capabilities(),
                capability.maxLoad()));
        LOG.info("Agent registered", StructuredLogger.fields(
                "agentId", capability.agentId(),
                "capabilities", capability.capabilities(),
                "maxLoad", capability.maxLoad()
        ));
        if (LOG.debugEnabled()) {
            for (TaskDefinition pending : queue.peek(10)) {
                LOG.debug("Pending task candidate after agent registration", StructuredLogger.fields(
                        "taskId", pending.id(),
                        "eligible", optimizer.isEligible(pending, capability)
                ));
            }
        }
    }

    public boolean updateAgentPerformance(String agentId, AgentCapability.PerformanceProfile profile) {
        AgentCapability agent = agents.get(agentId);
        if (agent == null || profile == null) {
            return false;
        }
        agents.put(agentId, agent.withPerformance(profile));
        return true;
    }

    public boolean updateAgentCapabilities(String agentId, List<String> capabilities) {
        AgentCapability agent = agents.get(agentId);
        if (agent == null || capabilities == null) {
            return false;
        }
        agents.put(agentId, agent.withCapabilities(capabilities));
        return true;
    }

    public boolean setAgentAvailability(String agentId, AvailabilityStatus availability) {
        AgentCapability agent = agents.get(agentId);
        if (agent == null || availability == null) {
            return false;
        }
        agents.put(agentId, agent.withAvailability(availability));
        return true;
    }

    public List<String> markAgentUnavailable(String agentId) {
        AgentCapability agent = agents.get(agentId);
        if (agent == null) {
            return List.of();
        }
        agents.put(agentId, agent.withAvailability(AvailabilityStatus.OFFLINE));
        List<String> moved = new ArrayList<>();
        for (TaskAssignment assignment : List.copyOf(assignments.values())) {
            if (assignment.agentId().equals(agentId) && reassignTask(assignment.taskId(), CancellationReason.AGENT_UNAVAILABLE)) {
                moved.add(assignment.taskId());
            }
        }
        LOG.warn("Agent marked unavailable", StructuredLogger.fields(
                "agentId", agentId,
                "reassigned", moved
        ));
        return moved;
    }

    public boolean cancelTask(String taskId, CancellationReason reason) {
        TaskRecord record = tasks.get(taskId);
        if (record == null || record.status.terminal()) {
            return false;
        }
        CancellationReason why = reason == null ? CancellationReason.USER_REQUEST : reason;
        for (String subtaskId : record.subtaskIds()) {
            cancelSingle(subtaskId, why);
        }
        cancelSingle(taskId, why);
        cascadeFromSubtask(record);
        return true;
    }

    public boolean reassignTask(String taskId, CancellationReason reason) {
        TaskRecord record = tasks.get(taskId);
        TaskAssignment assignment = assignments.get(taskId);
        if (record == null || assignment == null) {
            return false;
        }
        endAssignment(assignment);
        notifier.revoked(taskId, assignment.agentId(), reason);
        record.status = TaskStatus.QUEUED;
        record.agentId = null;
        record.queuedAtMs = clock.getAsLong();
        queue.enqueue(record.definition());
        bus.publish(new SwarmEvents.TaskReassigned(nodeId, taskId, assignment.agentId(), reason));
        LOG.warn("Task reassigned", StructuredLogger.fields(
                "taskId", taskId,
                "previousAgent", assignment.agentId(),
                "reason", reason == null ? null : reason.wire()
        ));
        return true;
    }

    public boolean reportProgress(String taskId, double progress, String note) {
        TaskRecord record = tasks.get(taskId);
        TaskAssignment assignment = assignments.get(taskId);
        if (record == null || assignment == null) {
            return false;
        }
        record.progress = Math.max(0.0, Math.min(1.0, progress));
        record.lastProgressMs = clock.getAsLong();
        bus.publish(new SwarmEvents.TaskProgress(nodeId, taskId, assignment.agentId(), record.progress, note));
        return true;
    }

    public boolean completeTask(String taskId, JsonNode result) {
        TaskRecord record = tasks.get(taskId);
        TaskAssignment assignment = assignments.get(taskId);
        if (record == null || assignment == null) {
            LOG.debug("Ignoring completion for task that is not running", StructuredLogger.fields("taskId", taskId));
            return false;
        }
        long now = clock.getAsLong();
        endAssignment(assignment);
        executionSamples++;
        executionTotalMs += Math.max(0L, now - assignment.assignedAtMs());
        record.status = TaskStatus.COMPLETED;
        record.progress = 1.0;
        completedTasks++;
        recentCompletions.addLast(now);
        bus.publish(new SwarmEvents.TaskCompleted(nodeId, taskId, assignment.agentId(), result));
        LOG.info("Task completed", StructuredLogger.fields(
                "taskId", taskId,
                "agentId", assignment.agentId(),
                "durationMs", now - assignment.assignedAtMs()
        ));
        cascadeFromSubtask(record);
        return true;
    }

    public boolean failTask(String taskId, String error) {
        TaskRecord record = tasks.get(taskId);
        TaskAssignment assignment = assignments.get(taskId);
        if (record == null || assignment == null) {
            LOG.debug("Ignoring failure for task that is not running", StructuredLogger.fields("taskId", taskId));
            return false;
        }
        endAssignment(assignment);
        handleFailure(record, assignment.agentId(), error == null ? "unknown error" : error);
        return true;
    }

    public void tick(long nowMs) {
        processQueue(nowMs);
        healthCheck(nowMs);
        if (settings.enableDynamicRebalancing()) {
            balancer.rebalanceIfNeeded(agents.values(), rebalanceContext);
        }
        lastMetrics = computeMetrics(nowMs);
        bus.publish(new SwarmEvents.MetricsUpdated(nodeId, lastMetrics));
    }

    public int processQueue(long nowMs) {
        cancelBrokenDependents();
        int capacity = settings.maxConcurrentTasks() - assignments.size();
        long openAgents = agents.values().stream()
                .filter(a -> a.availability() == AvailabilityStatus.AVAILABLE && a.hasHeadroom())
                .count();
        if (capacity <= 0 || openAgents == 0 || queue.size() == 0) {
            return 0;
        }
        long budget = Math.min(capacity, openAgents);
        int scanLimit = queue.size();
        int scanned = 0;
        int assigned = 0;
        // Entries nobody can take are set aside so the scan reaches the tasks behind them.
        List<TaskQueue.QueuedTask> skipped = new ArrayList<>();
        while (assigned < budget && scanned < scanLimit) {
            List<TaskQueue.QueuedTask> next = queue.take(1, this::isReady);
            if (next.isEmpty()) {
                break;
            }
            scanned++;
            TaskQueue.QueuedTask entry = next.get(0);
            TaskRecord record = tasks.get(entry.task().id());
            if (record == null || record.status.terminal()) {
                continue;
            }
            try {
                assign(record, nowMs);
                assigned++;
            } catch (CapacityException e) {
                LOG.debug("No eligible agent, task stays queued", StructuredLogger.fields(
                        "taskId", e.taskId(),
                        "reason", e.getMessage()
                ));
                skipped.add(entry);
            } catch (RuntimeException e) {
                LOG.error("Task assignment failed", StructuredLogger.fields("taskId", record.id()), e);
                handleFailure(record, null, "assignment failed: " + e.getMessage());
            }
        }
        skipped.forEach(queue::restore);
        return assigned;
    }

    public void healthCheck(long nowMs) {
        for (TaskAssignment assignment : List.copyOf(assignments.values())) {
            TaskRecord record = tasks.get(assignment.taskId());
            if (record == null) {
                continue;
            }
            long runtime = nowMs - assignment.assignedAtMs();
            long timeout = record.definition().constraints().timeoutMs();
            long estimate = record.definition().estimatedDurationMs();
            if (timeout > 0L && runtime > timeout) {
                SwarmTimeoutException overdue = new SwarmTimeoutException("Task " + record.id() + " exceeded timeout of "
                        + timeout + " ms");
                endAssignment(assignment);
                notifier.revoked(record.id(), assignment.agentId(), CancellationReason.TIMEOUT);
                handleFailure(record, assignment.agentId(), overdue.getMessage());
            } else if (estimate > 0L && runtime > estimate * settings.stuckTaskMultiplier()) {
                LOG.warn("Task appears stuck", StructuredLogger.fields(
                        "taskId", record.id(),
                        "runtimeMs", runtime,
                        "estimateMs", estimate
                ));
                reassignTask(record.id(), CancellationReason.TASK_STUCK);
            } else if (nowMs - record.lastProgressMs > noProgressThreshold(assignment)) {
                reassignTask(record.id(), CancellationReason.NO_PROGRESS);
            }
        }
    }

    public QueueStatus getQueueStatus() {
        int available = 0;
        int busy = 0;
        int offline = 0;
        for (AgentCapability agent : agents.values()) {
            if (agent.availability() == AvailabilityStatus.OFFLINE) {
                offline++;
            } else if (agent.availability() == AvailabilityStatus.AVAILABLE && agent.hasHeadroom()) {
                available++;
            } else {
                busy++;
            }
        }
        Map<String, String> running = new LinkedHashMap<>();
        assignments.forEach((taskId, assignment) -> running.put(taskId, assignment.agentId()));
        return new QueueStatus(
                queue.taskIds(),
                assignments.size(),
                running,
                new QueueStatus.AgentSummary(available, busy, offline, resourceEfficiency())
        );
    }

    public Optional<TaskStatus> getTaskStatus(String taskId) {
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.status);
    }

    public Optional<TaskView> task(String taskId) {
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.toView());
    }

    public List<TaskView> tasks() {
        return tasks.values().stream().map(TaskRecord::toView).toList();
    }

    public Optional<AgentCapability> agent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<AgentCapability> agents() {
        return List.copyOf(agents.values());
    }

    public Optional<TaskAssignment> assignment(String taskId) {
        return Optional.ofNullable(assignments.get(taskId));
    }

    public Optional<DecomposedTask> decomposition(String taskId) {
        return Optional.ofNullable(decompositions.get(taskId));
    }

    public DistributionMetrics metrics() {
        return lastMetrics != null ? lastMetrics : computeMetrics(clock.getAsLong());
    }

    private void assign(TaskRecord record, long nowMs) {
        TaskDefinition task = record.definition();
        AgentCapability agent = optimizer.selectAgent(task, agents.values())
                .orElseThrow(() -> new CapacityException(task.id(), "no eligible agent for task " + task.id()));
        TaskAssignment assignment = optimizer.buildAssignment(task, agent, agents.values(), nowMs);
        agents.put(agent.agentId(), agent.withCurrentLoad(agent.currentLoad() + 1));
        assignments.put(task.id(), assignment);
        waitSamples++;
        waitTotalMs += Math.max(0L, nowMs - record.queuedAtMs);
        record.status = TaskStatus.ASSIGNED;
        record.agentId = agent.agentId();
        record.attempts++;
        record.assignedAtMs = nowMs;
        record.lastProgressMs = nowMs;
        record.progress = 0.0;
        try {
            notifier.assigned(assignment, task);
        } catch (RuntimeException e) {
            LOG.warn("Assignment notification failed", StructuredLogger.fields(
                    "taskId", task.id(),
                    "agentId", agent.agentId(),
                    "error", e.getMessage()
            ));
        }
        bus.publish(new SwarmEvents.TaskAssigned(nodeId, task.id(), agent.agentId(), assignment));
        LOG.info("Task assigned", StructuredLogger.fields(
                "taskId", task.id(),
                "agentId", agent.agentId(),
                "confidence", assignment.details().confidence(),
                "alternatives", assignment.details().alternativeAgents()
        ));
    }

    private void endAssignment(TaskAssignment assignment) {
        assignments.remove(assignment.taskId());
        AgentCapability agent = agents.get(assignment.agentId());
        if (agent != null) {
            agents.put(agent.agentId(), agent.withCurrentLoad(Math.max(0, agent.currentLoad() - 1)));
        }
    }

    private void handleFailure(TaskRecord record, String agentId, String error) {
        record.lastError = error;
        record.agentId = null;
        FailurePolicy.Decision decision = failureHandler.handle(record, error);
        if (decision.retry()) {
            record.retriesLeft = decision.retriesLeft();
            record.status = TaskStatus.QUEUED;
            record.queuedAtMs = clock.getAsLong();
            retriedAttempts++;
            queue.enqueue(record.definition());
            bus.publish(new SwarmEvents.TaskFailed(nodeId, record.id(), agentId, error, false, record.retriesLeft));
            return;
        }
        record.retriesLeft = 0;
        record.status = TaskStatus.FAILED;
        failedTasks++;
        bus.publish(new SwarmEvents.TaskFailed(nodeId, record.id(), agentId, error, true, 0));
        cascadeFromSubtask(record);
    }

    private void cancelSingle(String taskId, CancellationReason reason) {
        TaskRecord record = tasks.get(taskId);
        if (record == null || record.status.terminal()) {
            return;
        }
        TaskAssignment assignment = assignments.get(taskId);
        if (assignment != null) {
            endAssignment(assignment);
            notifier.revoked(taskId, assignment.agentId(), reason);
        }
        queue.remove(taskId);
        record.status = TaskStatus.CANCELLED;
        record.agentId = null;
        cancelledTasks++;
        bus.publish(new SwarmEvents.TaskCancelled(nodeId, taskId, reason));
        LOG.info("Task cancelled", StructuredLogger.fields(
                "taskId", taskId,
                "reason", reason.wire()
        ));
    }

    private void cascadeFromSubtask(TaskRecord child) {
        if (child.parentId() == null) {
            return;
        }
        TaskRecord parent = tasks.get(child.parentId());
        if (parent == null || parent.status.terminal()) {
            return;
        }
        if (child.status == TaskStatus.COMPLETED) {
            boolean allDone = parent.subtaskIds().stream()
                    .map(tasks::get)
                    .allMatch(sub -> sub != null && sub.status == TaskStatus.COMPLETED);
            if (allDone) {
                parent.status = TaskStatus.COMPLETED;
                parent.progress = 1.0;
                completedTasks++;
                recentCompletions.addLast(clock.getAsLong());
                bus.publish(new SwarmEvents.TaskCompleted(nodeId, parent.id(), null, null));
                LOG.info("Decomposed task completed", StructuredLogger.fields(
                        "taskId", parent.id(),
                        "subtasks", parent.subtaskIds().size()
                ));
            }
            return;
        }
        if (child.status == TaskStatus.FAILED || child.status == TaskStatus.CANCELLED) {
            for (String siblingId : parent.subtaskIds()) {
                cancelSingle(siblingId, CancellationReason.DEPENDENCY_FAILURE);
            }
            parent.status = TaskStatus.FAILED;
            parent.lastError = "subtask " + child.id() + " " + child.status.wire();
            failedTasks++;
            bus.publish(new SwarmEvents.TaskFailed(nodeId, parent.id(), null, parent.lastError, true, 0));
        }
    }

    private boolean isReady(TaskDefinition task) {
        for (TaskDefinition.Dependency dependency : task.blockingDependencies()) {
            TaskRecord upstream = tasks.get(dependency.taskId());
            // Dependencies on tasks this engine never saw are treated as external and satisfied.
            if (upstream != null && upstream.status != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private void cancelBrokenDependents() {
        for (TaskDefinition queued : queue.peek(queue.size())) {
            for (TaskDefinition.Dependency dependency : queued.blockingDependencies()) {
                TaskRecord upstream = tasks.get(dependency.taskId());
                if (upstream != null && (upstream.status == TaskStatus.FAILED || upstream.status == TaskStatus.CANCELLED)) {
                    TaskRecord record = tasks.get(queued.id());
                    cancelSingle(queued.id(), CancellationReason.DEPENDENCY_FAILURE);
                    if (record != null) {
                        cascadeFromSubtask(record);
                    }
                    break;
                }
            }
        }
    }

    private long noProgressThreshold(TaskAssignment assignment) {
        for (TaskAssignment.EscalationTrigger trigger : assignment.monitoring().escalationTriggers()) {
            if (trigger.action() == EscalationAction.REASSIGN && trigger.condition().startsWith("no_progress")) {
                return (long) trigger.threshold();
            }
        }
        return settings.noProgressEscalationMs();
    }

    private TaskDefinition toTaskDefinition(TaskDefinition parent, DecomposedTask.SubTask subtask, long nowMs) {
        TaskDefinition.Requirements parentReq = parent.requirements();
        TaskDefinition.Requirements requirements = new TaskDefinition.Requirements(
                subtask.requiredCapabilities(),
                1,
                1,
                parentReq.preferredAgents(),
                parentReq.excludedAgents(),
                parentReq.resources(),
                parentReq.quality()
        );
        TaskDefinition.Constraints constraints = new TaskDefinition.Constraints(
                parent.constraints().maxRetries(),
                // no hard timeout; overruns are handled by stuck detection
                0L,
                parent.constraints().isolationLevel(),
                parent.constraints().securityLevel()
        );
        List<TaskDefinition.Dependency> dependencies = subtask.dependsOn().stream()
                .map(TaskDefinition.Dependency::blocking)
                .toList();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("parentId", parent.id());
        metadata.put("order", subtask.order());
        return new TaskDefinition(
                subtask.id(),
                subtask.name(),
                subtask.description(),
                parent.type(),
                parent.priority(),
                TaskComplexity.SIMPLE,
                requirements,
                constraints,
                dependencies,
                subtask.estimatedDurationMs(),
                metadata,
                nowMs,
                parent.submittedBy()
        );
    }

    private double resourceEfficiency() {
        long capacity = agents.values().stream().mapToLong(AgentCapability::maxLoad).sum();
        if (capacity == 0L) {
            return 0.0;
        }
        long used = agents.values().stream().mapToLong(AgentCapability::currentLoad).sum();
        return (double) used / capacity;
    }

    private DistributionMetrics computeMetrics(long nowMs) {
        while (!recentCompletions.isEmpty() && nowMs - recentCompletions.peekFirst() > THROUGHPUT_WINDOW_MS) {
            recentCompletions.pollFirst();
        }
        Map<String, Double> utilization = new LinkedHashMap<>();
        agents.forEach((id, agent) -> utilization.put(id, agent.utilization()));
        long finished = completedTasks + failedTasks;
        return new DistributionMetrics(
                totalTasks,
                queue.size(),
                assignments.size(),
                completedTasks,
                failedTasks,
                cancelledTasks,
                retriedAttempts,
                waitSamples == 0L ? 0.0 : (double) waitTotalMs / waitSamples,
                executionSamples == 0L ? 0.0 : (double) executionTotalMs / executionSamples,
                recentCompletions.size(),
                finished == 0L ? 1.0 : (double) completedTasks / finished,
                WorkloadBalancer.loadBalanceScore(agents.values()),
                resourceEfficiency(),
                utilization
        );
    }

    private final class EngineRebalanceContext implements RebalanceContext {
        @Override
        public List<TaskAssignment> assignmentsOf(String agentId) {
            return assignments.values().stream().filter(a -> a.agentId().equals(agentId)).toList();
        }

        @Override
        public boolean reassign(String taskId, CancellationReason reason) {
            return reassignTask(taskId, reason);
        }
    }
}
