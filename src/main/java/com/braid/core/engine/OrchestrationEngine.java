package com.braid.core.engine;

import com.braid.agent.AgentSpawner;
import com.braid.agent.SpawnRequest;
import com.braid.agent.TaskPromptBuilder;
import com.braid.config.BraidProperties;
import com.braid.core.events.BraidEvent;
import com.braid.core.events.EventBus;
import com.braid.core.logging.MdcContext;
import com.braid.core.metrics.BraidMetrics;
import com.braid.core.model.ExecutionMode;
import com.braid.core.model.ReviewedAgentRecord;
import com.braid.core.model.SpawnedAgentRecord;
import com.braid.core.model.Task;
import com.braid.core.model.TaskStatus;
import com.braid.core.model.Worktree;
import com.braid.core.scheduler.TaskGraphResolver;
import com.braid.core.spi.SpawnPermission;
import com.braid.core.spi.SpawnResult;
import com.braid.core.spi.TaskNotFoundException;
import com.braid.core.spi.TaskStore;
import com.braid.core.spi.WorktreeStore;
import com.braid.core.state.OrchestrationState;
import com.braid.core.state.OrchestrationStateStore;
import com.braid.workspace.ProvisionRequest;
import com.braid.workspace.ProvisionResult;
import com.braid.workspace.StaleCleanupResult;
import com.braid.workspace.WorktreeProvisioner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point the hosting workflow layer calls to drive a task tree through
 * its agents.
 *
 * <p>Each call is one pass; the engine has no scheduler of its own:
 * <ol>
 *   <li>{@link #orchestrateReadyTasks}: provision a worktree and spawn an agent per ready task</li>
 *   <li>{@link #pollAgentStatus}: classify spawned agents as running, completed or failed</li>
 *   <li>{@link #markReviewed}: record the host's approval of a completed agent</li>
 *   <li>{@link #cleanupReviewedWorktrees}: merge approved branches and remove their worktrees</li>
 * </ol>
 */
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);

    static final String NO_RUNNER = "Agent runner not configured. Cannot orchestrate.";
    static final String NO_SESSION = "parent_session_id is required for orchestration";
    static final String LIMIT_REACHED = "max_concurrent limit reached";
    static final String ALREADY_ORCHESTRATING = "Task already being orchestrated";

    private final BraidProperties properties;
    private final TaskStore taskStore;
    private final WorktreeStore worktreeStore;
    private final TaskGraphResolver resolver;
    private final WorktreeProvisioner provisioner;
    private final AgentSpawner spawner;
    private final OrchestrationStateStore stateStore;
    private final StatusReconciler reconciler;
    private final MergeCoordinator mergeCoordinator;
    private final WaitCoordinator waitCoordinator;
    private final EventBus eventBus;
    private final BraidMetrics metrics;
    private final Clock clock;

    private final ExecutorService spawnExecutor;
    /** Tasks some pass is currently provisioning or spawning, across sessions. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    /** Capacity held by running passes per session, not yet visible in {@code spawned}. */
    private final ConcurrentHashMap<String, Integer> reservedSlots = new ConcurrentHashMap<>();

    public OrchestrationEngine(BraidProperties properties, TaskStore taskStore, WorktreeStore worktreeStore,
                               TaskGraphResolver resolver, WorktreeProvisioner provisioner, AgentSpawner spawner,
                               OrchestrationStateStore stateStore, StatusReconciler reconciler,
                               MergeCoordinator mergeCoordinator, WaitCoordinator waitCoordinator,
                               EventBus eventBus, BraidMetrics metrics, Clock clock) {
        this.properties = properties;
        this.taskStore = taskStore;
        this.worktreeStore = worktreeStore;
        this.resolver = resolver;
        this.provisioner = provisioner;
        this.spawner = spawner;
        this.stateStore = stateStore;
        this.reconciler = reconciler;
        this.mergeCoordinator = mergeCoordinator;
        this.waitCoordinator = waitCoordinator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;

        var threadCount = new AtomicInteger();
        int poolSize = Math.max(1, properties.getOrchestration().getSpawnParallelism());
        this.spawnExecutor = Executors.newFixedThreadPool(poolSize, r -> {
            var thread = new Thread(r, "braid-spawn-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        spawnExecutor.shutdownNow();
    }

    // ── Orchestrate ──────────────────────────────────────────────────────

    /**
     * Spawns agents for the ready subtasks of {@code parentTaskId}, up to the free
     * capacity of the session. Every ready task ends up spawned, skipped or, on a
     * dry run, planned.
     *
     * @throws OrchestrationConfigurationException when no runner is configured, the
     *         session id is missing or the mode is unsupported
     * @throws TaskNotFoundException when the parent task does not exist
     */
    public OrchestrationResult orchestrateReadyTasks(OrchestrationRequest request) {
        long started = System.currentTimeMillis();
        if (!spawner.isConfigured()) {
            throw new OrchestrationConfigurationException(NO_RUNNER);
        }
        String sessionId = request.parentSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            throw new OrchestrationConfigurationException(NO_SESSION);
        }
        String modeValue = orDefault(request.mode(), properties.getOrchestration().getMode());
        ExecutionMode mode = ExecutionMode.parse(modeValue).orElseThrow(() ->
                new OrchestrationConfigurationException("Invalid mode '" + modeValue
                        + "'. Must be one of: " + ExecutionMode.supportedValues()));

        List<Task> ready = resolver.resolveReady(request.parentTaskId());

        MdcContext.setSession(sessionId);
        try {
            if (ready.isEmpty()) {
                return new OrchestrationResult(request.parentTaskId(), List.of(), List.of(), List.of(),
                        request.dryRun(), "No ready tasks found");
            }

            int maxConcurrent = request.maxConcurrent() != null
                    ? request.maxConcurrent()
                    : properties.getOrchestration().getMaxConcurrent();
            SlotReservation reservation = reserveSlots(sessionId, maxConcurrent, ready.size(), !request.dryRun());
            int capacity = reservation.capacity();

            try {
                List<Task> toSpawn = ready.subList(0, Math.min(capacity, ready.size()));
                var skipped = new ArrayList<SkippedTask>();
                for (Task task : ready.subList(toSpawn.size(), ready.size())) {
                    skipped.add(skip(sessionId, task, LIMIT_REACHED));
                }

                var spawnRequest = resolveSpawnRequest(request, mode, reservation.state());

                if (request.dryRun()) {
                    var planned = toSpawn.stream()
                            .map(task -> new PlannedTask(task.id(), task.title(), task.category(),
                                    TaskPromptBuilder.build(task), spawnRequest.provider(), spawnRequest.model(),
                                    mode.value(), spawnRequest.workflow()))
                            .toList();
                    return new OrchestrationResult(request.parentTaskId(), List.of(), skipped, planned, true,
                            "Dry run: would spawn " + planned.size() + " agent(s)");
                }

                var provisionRequest = new ProvisionRequest(sessionId, request.projectId(), request.baseBranch(),
                        spawnRequest.provider());
                var spawned = new ArrayList<SpawnedAgentRecord>();
                for (TaskOutcome outcome : spawnAll(toSpawn, provisionRequest, spawnRequest, reservation)) {
                    if (outcome.spawned() != null) {
                        spawned.add(outcome.spawned());
                    } else {
                        skipped.add(outcome.skipped());
                    }
                }

                metrics.recordPassDuration("orchestrate", System.currentTimeMillis() - started);
                log.info("Orchestration pass for {}: spawned {}, skipped {} (capacity {}/{})",
                        request.parentTaskId(), spawned.size(), skipped.size(), capacity, maxConcurrent);
                return new OrchestrationResult(request.parentTaskId(), spawned, skipped, List.of(), false,
                        "Spawned " + spawned.size() + " agent(s), skipped " + skipped.size());
            } finally {
                reservation.releaseAll();
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Computes the session's free capacity and, unless {@code hold} is false, holds
     * it for this pass. Agents already recorded and slots held by other passes both
     * count against {@code maxConcurrent}.
     */
    private SlotReservation reserveSlots(String sessionId, int maxConcurrent, int wanted, boolean hold) {
        return stateStore.locks().withLock(sessionId, () -> {
            OrchestrationState state = stateStore.load(sessionId);
            int held = reservedSlots.getOrDefault(sessionId, 0);
            int capacity = Math.max(0, maxConcurrent - state.spawned().size() - held);
            int slots = hold ? Math.min(capacity, wanted) : 0;
            if (slots > 0) {
                reservedSlots.merge(sessionId, slots, Integer::sum);
                log.debug("Reserved {} slot(s) for session {} ({} already held by other passes)",
                        slots, sessionId, held);
            }
            return new SlotReservation(sessionId, state, capacity, slots);
        });
    }

    private void releaseSlots(String sessionId, int count) {
        reservedSlots.computeIfPresent(sessionId, (id, held) -> held > count ? held - count : null);
    }

    /**
     * Slots one pass holds. Each task gives its slot back once it is either
     * recorded in {@code spawned} or skipped; the pass returns whatever is left.
     */
    private final class SlotReservation {

        private final String sessionId;
        private final OrchestrationState state;
        private final int capacity;
        private final AtomicInteger held;

        SlotReservation(String sessionId, OrchestrationState state, int capacity, int slots) {
            this.sessionId = sessionId;
            this.state = state;
            this.capacity = capacity;
            this.held = new AtomicInteger(slots);
        }

        OrchestrationState state() {
            return state;
        }

        int capacity() {
            return capacity;
        }

        void releaseOne() {
            if (held.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                releaseSlots(sessionId, 1);
            }
        }

        void releaseAll() {
            int remaining = held.getAndSet(0);
            if (remaining > 0) {
                releaseSlots(sessionId, remaining);
            }
        }
    }

    private List<TaskOutcome> spawnAll(List<Task> tasks, ProvisionRequest provisionRequest, SpawnRequest spawnRequest,
                                       SlotReservation reservation) {
        var semaphore = new Semaphore(Math.max(1, properties.getOrchestration().getSpawnParallelism()));
        var futures = new ArrayList<CompletableFuture<TaskOutcome>>();

        for (Task task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setTask(spawnRequest.parentSessionId(), task.id());
                try {
                    semaphore.acquire();
                    try {
                        return orchestrateTask(task, provisionRequest, spawnRequest, reservation);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return TaskOutcome.skipped(skip(spawnRequest.parentSessionId(), task, "Interrupted"));
                } finally {
                    MdcContext.clear();
                }
            }, spawnExecutor));
        }

        var outcomes = new ArrayList<TaskOutcome>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.error("Unexpected error collecting spawn result for {}", tasks.get(i).id(), e);
                outcomes.add(TaskOutcome.skipped(skip(spawnRequest.parentSessionId(), tasks.get(i),
                        "Unexpected error: " + e.getCause().getMessage())));
            }
        }
        return outcomes;
    }

    private TaskOutcome orchestrateTask(Task task, ProvisionRequest provisionRequest, SpawnRequest spawnRequest,
                                        SlotReservation reservation) {
        String sessionId = spawnRequest.parentSessionId();
        if (!inFlight.add(task.id())) {
            reservation.releaseOne();
            return TaskOutcome.skipped(skip(sessionId, task, ALREADY_ORCHESTRATING));
        }
        boolean recorded = false;
        try {
            SpawnPermission permission = spawner.checkPermission(sessionId);
            if (!permission.allowed()) {
                return TaskOutcome.skipped(skip(sessionId, task, permission.reason()));
            }

            ProvisionResult provisioned = provisioner.provision(task, provisionRequest);
            if (!provisioned.success()) {
                return TaskOutcome.skipped(skip(sessionId, task, provisioned.reason()));
            }
            Worktree worktree = provisioned.worktree();
            MdcContext.setWorktree(sessionId, task.id(), worktree.id());

            SpawnResult result = spawner.spawn(worktree, task, spawnRequest);
            if (!result.success()) {
                provisioner.release(worktree.id());
                if (provisioned.newlyCreated()) {
                    provisioner.destroy(worktree, true, true);
                }
                return TaskOutcome.skipped(skip(sessionId, task, "Spawn failed: " + result.error()));
            }

            var record = new SpawnedAgentRecord(result.sessionId(), task.id(), worktree.id(), result.runId(),
                    worktree.branchName(), worktree.worktreePath(), task.title(), result.pid(), clock.instant());
            try {
                stateStore.locks().withLock(sessionId, () -> {
                    stateStore.update(sessionId, state -> state.appendSpawned(record));
                    reservation.releaseOne();
                    claimWorktree(worktree, result.sessionId());
                });
                recorded = true;
            } catch (RuntimeException e) {
                log.error("Agent {} started for task {} but could not be recorded; releasing worktree {}",
                        result.sessionId(), task.id(), worktree.id(), e);
                releaseWorktree(worktree);
                return TaskOutcome.skipped(skip(sessionId, task, "Failed to record spawned agent: " + e.getMessage()));
            }

            markInProgress(task);
            eventBus.publish(BraidEvent.of(BraidEvent.AGENT_SPAWNED, sessionId, task.id(), Map.of(
                    "agentSessionId", result.sessionId(),
                    "worktreeId", worktree.id(),
                    "branch", worktree.branchName())));
            return TaskOutcome.spawned(record);
        } catch (RuntimeException e) {
            log.error("Unexpected error orchestrating task {}", task.id(), e);
            return TaskOutcome.skipped(skip(sessionId, task, "Unexpected error: " + e.getMessage()));
        } finally {
            if (!recorded) {
                reservation.releaseOne();
            }
            inFlight.remove(task.id());
        }
    }

    /**
     * The agent is already recorded when this runs; a failed claim leaves the
     * worktree unowned, which reconciliation reports if the agent exits early.
     */
    private void claimWorktree(Worktree worktree, String agentSessionId) {
        try {
            provisioner.claim(worktree.id(), agentSessionId);
        } catch (RuntimeException e) {
            log.error("Could not assign worktree {} to agent {}", worktree.id(), agentSessionId, e);
        }
    }

    private void releaseWorktree(Worktree worktree) {
        try {
            provisioner.release(worktree.id());
        } catch (RuntimeException e) {
            log.error("Could not release worktree {}", worktree.id(), e);
        }
    }

    private void markInProgress(Task task) {
        try {
            taskStore.updateStatus(task.id(), TaskStatus.IN_PROGRESS);
        } catch (RuntimeException e) {
            log.warn("Could not move task {} to in_progress: {}", task.id(), e.getMessage());
        }
    }

    private SkippedTask skip(String sessionId, Task task, String reason) {
        log.info("Skipping task {}: {}", task.id(), reason);
        metrics.recordSkip(skipCategory(reason));
        eventBus.publish(BraidEvent.of(BraidEvent.AGENT_SKIPPED, sessionId, task.id(), Map.of("reason", reason)));
        return new SkippedTask(task.id(), task.title(), reason);
    }

    private static String skipCategory(String reason) {
        if (reason == null) return "other";
        if (reason.equals(LIMIT_REACHED)) return "capacity";
        if (reason.contains("worktree") || reason.contains("has active agent")) return "worktree";
        if (reason.startsWith("Spawn failed")) return "spawn";
        return "other";
    }

    /**
     * Provider, model and terminal: explicit override, then the session's workflow
     * variables, then the request or configured default.
     */
    SpawnRequest resolveSpawnRequest(OrchestrationRequest request, ExecutionMode mode, OrchestrationState state) {
        String provider = firstNonBlank(request.codingProvider(),
                state.variable("coding_provider").orElse(null),
                request.provider(),
                properties.getOrchestration().getProvider());
        String model = firstNonBlank(request.codingModel(),
                state.variable("coding_model").orElse(null),
                request.model());
        String terminal = request.terminal() != null && !"auto".equals(request.terminal())
                ? request.terminal()
                : state.variable("terminal").orElse("auto");
        String workflow = orDefault(request.workflow(), properties.getOrchestration().getWorkflow());
        return new SpawnRequest(request.parentSessionId(), request.projectId(), provider, model, mode, terminal, workflow);
    }

    // ── Poll ─────────────────────────────────────────────────────────────

    /**
     * Classifies every spawned agent of the session and moves finished ones to
     * completed or failed. Writes the state at most once.
     */
    public PollResult pollAgentStatus(String parentSessionId) {
        if (!spawner.isConfigured()) {
            throw new OrchestrationConfigurationException("Agent runner not configured. Cannot poll agent status.");
        }
        if (parentSessionId == null || parentSessionId.isBlank()) {
            throw new OrchestrationConfigurationException(NO_SESSION);
        }
        long started = System.currentTimeMillis();
        MdcContext.setSession(parentSessionId);
        try {
            var holder = new Reconciliation[1];
            OrchestrationState saved = stateStore.update(parentSessionId, state -> {
                holder[0] = reconciler.reconcile(state);
                return holder[0].changed() ? holder[0].state() : state;
            });
            Reconciliation reconciliation = holder[0];

            reconciliation.newlyCompleted().forEach(agent -> {
                metrics.recordReconciliation("completed");
                eventBus.publish(BraidEvent.of(BraidEvent.AGENT_COMPLETED, parentSessionId, agent.taskId(),
                        payload("agentSessionId", agent.sessionId(), "commitSha", agent.commitSha())));
            });
            reconciliation.newlyFailed().forEach(agent -> {
                metrics.recordReconciliation("failed");
                eventBus.publish(BraidEvent.of(BraidEvent.AGENT_FAILED, parentSessionId, agent.taskId(),
                        payload("agentSessionId", agent.sessionId(), "reason", agent.failureReason())));
            });
            metrics.recordRunningAgents(saved.spawned().size());
            metrics.recordPassDuration("poll", System.currentTimeMillis() - started);

            var summary = new PollResult.Summary(saved.spawned().size(), saved.completed().size(), saved.failed().size());
            log.info("Poll for session {}: {} completed, {} failed, {} still running",
                    parentSessionId, reconciliation.newlyCompleted().size(), reconciliation.newlyFailed().size(),
                    saved.spawned().size());
            return new PollResult(reconciliation.newlyCompleted(), reconciliation.newlyFailed(),
                    saved.spawned(), saved.spawned().isEmpty(), summary);
        } finally {
            MdcContext.clear();
        }
    }

    // ── Review & cleanup ─────────────────────────────────────────────────

    /**
     * Moves a completed agent to reviewed. Returns false when the session has no
     * completed agent with that session id.
     */
    public boolean markReviewed(String parentSessionId, ReviewedAgentRecord reviewed) {
        var moved = new boolean[1];
        stateStore.update(parentSessionId, state -> {
            var completed = new ArrayList<>(state.completed());
            boolean removed = completed.removeIf(agent -> agent.sessionId() != null
                    && agent.sessionId().equals(reviewed.sessionId()));
            if (!removed) {
                return state;
            }
            moved[0] = true;
            var reviewedList = new ArrayList<>(state.reviewed());
            reviewedList.add(reviewed);
            return state.withCompleted(completed).withReviewed(reviewedList);
        });
        if (!moved[0]) {
            log.warn("No completed agent {} in session {} to mark reviewed", reviewed.sessionId(), parentSessionId);
        }
        return moved[0];
    }

    public CleanupResult cleanupReviewedWorktrees(String parentSessionId) {
        return cleanupReviewedWorktrees(parentSessionId, CleanupOptions.defaults()
                .withDeleteBranches(properties.getMerge().isDeleteBranches())
                .withPush(properties.getMerge().isPush()));
    }

    public CleanupResult cleanupReviewedWorktrees(String parentSessionId, CleanupOptions options) {
        if (parentSessionId == null || parentSessionId.isBlank()) {
            throw new OrchestrationConfigurationException(NO_SESSION);
        }
        long started = System.currentTimeMillis();
        MdcContext.setSession(parentSessionId);
        try {
            CleanupResult result = mergeCoordinator.cleanup(parentSessionId, options);
            metrics.recordPassDuration("cleanup", System.currentTimeMillis() - started);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public StaleCleanupResult cleanupStaleWorktrees(String projectId, int olderThanHours, boolean force) {
        return provisioner.cleanupStale(projectId, Duration.ofHours(olderThanHours), force);
    }

    // ── Wait & status ────────────────────────────────────────────────────

    public WaitResult waitForTask(String taskId, Duration timeout, Duration pollInterval) {
        return waitCoordinator.waitForTask(taskId, timeout, pollInterval);
    }

    public WaitResult waitForTask(String taskId) {
        return waitForTask(taskId,
                Duration.ofSeconds(properties.getWait().getDefaultTimeoutSeconds()),
                Duration.ofSeconds(properties.getWait().getDefaultPollIntervalSeconds()));
    }

    /**
     * The latest spawn, skip, completion, failure and merge events of the session,
     * oldest first.
     */
    public List<BraidEvent> recentEvents(String parentSessionId) {
        return eventBus.recentEvents(parentSessionId);
    }

    /**
     * Direct subtasks of the parent grouped by status. Failed subtasks are grouped
     * with closed ones.
     */
    public OrchestrationStatus getOrchestrationStatus(String parentTaskId) {
        Task parent = (parentTaskId == null ? Optional.<Task>empty() : taskStore.get(parentTaskId))
                .orElseThrow(() -> new TaskNotFoundException(parentTaskId));

        var open = new ArrayList<OrchestrationStatus.Subtask>();
        var inProgress = new ArrayList<OrchestrationStatus.Subtask>();
        var closed = new ArrayList<OrchestrationStatus.Subtask>();

        var children = new ArrayList<>(taskStore.listChildren(parent.id()));
        children.sort(TaskGraphResolver.SIBLING_ORDER);
        for (Task child : children) {
            Optional<Worktree> worktree = worktreeStore.getByTask(child.id());
            var subtask = new OrchestrationStatus.Subtask(child.id(), child.title(), child.status(),
                    worktree.map(Worktree::id).orElse(null),
                    worktree.map(Worktree::status).orElse(null),
                    worktree.map(Worktree::isActivelyOwned).orElse(false));
            switch (child.status()) {
                case OPEN -> open.add(subtask);
                case IN_PROGRESS -> inProgress.add(subtask);
                case CLOSED, FAILED -> closed.add(subtask);
            }
        }
        return new OrchestrationStatus(parent.id(), parent.status(), open, inProgress, closed,
                parent.status() == TaskStatus.CLOSED);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static Map<String, Object> payload(String k1, Object v1, String k2, Object v2) {
        var map = new HashMap<String, Object>();
        map.put(k1, v1);
        if (v2 != null) {
            map.put(k2, v2);
        }
        return map;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    record TaskOutcome(SpawnedAgentRecord spawned, SkippedTask skipped) {

        static TaskOutcome spawned(SpawnedAgentRecord record) {
            return new TaskOutcome(record, null);
        }

        static TaskOutcome skipped(SkippedTask skipped) {
            return new TaskOutcome(null, skipped);
        }
    }
}
