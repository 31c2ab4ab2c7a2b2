package org.neuralchilli.hive.core;

import org.neuralchilli.hive.domain.*;
import org.neuralchilli.hive.suggest.DependencySuggester;
import org.neuralchilli.hive.suggest.SuggestedDependency;
import org.neuralchilli.hive.worker.TaskRunner;
import org.neuralchilli.hive.worker.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs a dynamically growing dependency graph on a bounded pool of workers.
 * <p>
 * One control thread owns the running, blocked and ready bookkeeping: it promotes ready
 * tasks, dispatches them while capacity allows and handles the {@link TaskOutcome} each
 * worker hands back. A task that waits on another is parked without holding a worker and
 * dispatched again once the dependency completes.
 * <p>
 * Lifecycle: build, {@link #run()} or {@link #start()}, {@link #stop()}, {@link #close()}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final DependencyGraph graph;
    private final int maxWorkers;
    private final Duration tick;
    private final Duration defaultTimeout;
    private final String workerId;
    private final DependencySuggester suggester;
    private final List<TaskLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService workers;
    private final CompletionService<TaskOutcome> completions;

    // Owned by the thread running the loop
    private final Map<String, Future<TaskOutcome>> running = new LinkedHashMap<>();
    private final Map<Future<TaskOutcome>, String> owners = new HashMap<>();
    private final Map<String, Task> blocked = new LinkedHashMap<>();
    private final Deque<String> readyQueue = new ArrayDeque<>();

    private final AtomicBoolean looping = new AtomicBoolean(false);
    private volatile boolean stopRequested = false;
    private volatile boolean closed = false;

    private ExecutorService controlThread;
    private Future<RunReport> controlRun;

    private Scheduler(Builder builder) {
        this.graph = new DependencyGraph(builder.failurePolicy);
        this.maxWorkers = builder.maxWorkers;
        this.tick = builder.tick;
        this.defaultTimeout = builder.timeout;
        this.workerId = builder.workerId;
        this.suggester = builder.suggester;
        this.listeners.addAll(builder.listeners);
        this.workers = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory(workerId));
        this.completions = new ExecutorCompletionService<>(workers);

        log.info("Scheduler {} created: maxWorkers={}, tick={}ms, failurePolicy={}, suggester={}",
                workerId, maxWorkers, tick.toMillis(), builder.failurePolicy,
                suggester != null ? suggester.getClass().getSimpleName() : "none");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------- task submission

    public String addTask(String description, TaskExecutor executor) {
        return addTask(description, executor, List.of());
    }

    public String addTask(String description, TaskExecutor executor, Collection<String> dependencies) {
        return addTask(newTaskId(), description, executor, dependencies);
    }

    public String addTask(String id, String description, TaskExecutor executor, Collection<String> dependencies) {
        return addTask(Task.builder(id)
                .description(description)
                .executor(executor)
                .dependsOn(dependencies)
                .build());
    }

    /**
     * Register a fully built task, typically carrying priority and metadata.
     * Runs the configured suggester on the new task. Under {@link FailurePolicy#CASCADE} a task
     * declaring a dependency that already failed is registered as FAILED; listeners hear of it
     * on the next tick of the loop.
     *
     * @throws UnknownDependencyException if a declared dependency is not in the graph
     * @throws IllegalArgumentException   if the id is taken
     */
    public String addTask(Task task) {
        ensureOpen();
        Task registered = graph.addTask(task);
        log.debug("Added task {}: {}", registered.id(), registered.description());
        if (suggester != null) {
            suggestDependencies(registered.id());
        }
        return registered.id();
    }

    /**
     * Subtasks skip suggestion: an inferred edge back to the running parent would deadlock it.
     */
    String addSubtask(String parentId, String description, TaskExecutor executor) {
        ensureOpen();
        Task subtask = graph.addTask(Task.builder(newTaskId())
                .description(description)
                .executor(executor)
                .parentId(parentId)
                .build());
        log.debug("Task {} spawned subtask {}: {}", parentId, subtask.id(), description);
        return subtask.id();
    }

    public boolean addDependency(String taskId, String dependencyId) {
        return graph.addDependency(taskId, dependencyId);
    }

    public boolean removeDependency(String taskId, String dependencyId) {
        return graph.removeDependency(taskId, dependencyId);
    }

    /**
     * Ask the suggester for edges involving {@code taskId} and apply the acceptable ones.
     * Suggestions that are circular, reference unknown tasks or target tasks no longer
     * waiting are skipped.
     *
     * @return the edges actually added
     */
    public List<SuggestedDependency> suggestDependencies(String taskId) {
        if (suggester == null) {
            return List.of();
        }
        Task task = graph.getTask(taskId)
                .orElseThrow(() -> new NoSuchElementException("Task not found: " + taskId));

        List<SuggestedDependency> applied = new ArrayList<>();
        for (SuggestedDependency suggestion : suggester.suggest(taskId, task.description(), graph.getTasks())) {
            Optional<Task> dependent = graph.getTask(suggestion.taskId());
            if (dependent.isEmpty() || !dependent.get().status().isWaiting()) {
                log.debug("Skipping suggestion {} -> {}: dependent is not waiting",
                        suggestion.taskId(), suggestion.dependencyId());
                continue;
            }
            try {
                if (graph.addDependency(suggestion.taskId(), suggestion.dependencyId())) {
                    applied.add(suggestion);
                    log.info("Applied suggested dependency {} -> {} ({}, confidence {})",
                            suggestion.taskId(), suggestion.dependencyId(), suggestion.reason(),
                            String.format("%.2f", suggestion.confidence()));
                }
            } catch (CircularDependencyException | UnknownDependencyException | IllegalStateException e) {
                log.warn("Skipping suggested dependency {} -> {}: {}",
                        suggestion.taskId(), suggestion.dependencyId(), e.getMessage());
            }
        }
        return applied;
    }

    public void addListener(TaskLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------------------------------------------------------------- run loop

    /**
     * Run until every task finished, using the configured timeout if any.
     *
     * @throws DeadlockException if unfinished tasks can no longer make progress
     */
    public RunReport run() {
        stopRequested = false;
        return loop(defaultTimeout, true);
    }

    /**
     * Run until every task finished or {@code timeout} elapsed.
     */
    public RunReport run(Duration timeout) {
        stopRequested = false;
        return loop(Objects.requireNonNull(timeout, "timeout"), true);
    }

    /**
     * {@code true} runs to termination; {@code false} performs a single tick and returns.
     */
    public RunReport run(boolean block) {
        stopRequested = false;
        return loop(defaultTimeout, block);
    }

    /**
     * Run the loop on a dedicated control thread.
     */
    public synchronized void start() {
        ensureOpen();
        if (controlRun != null && !controlRun.isDone()) {
            throw new IllegalStateException("Scheduler " + workerId + " is already started");
        }
        if (controlThread == null) {
            controlThread = Executors.newSingleThreadExecutor(r -> new Thread(r, workerId + "-control"));
        }
        stopRequested = false;
        controlRun = controlThread.submit(() -> loop(defaultTimeout, true));
        log.info("Scheduler {} started in background", workerId);
    }

    /**
     * Wait for a loop started with {@link #start()}.
     * A failure of the loop, such as a deadlock, is rethrown here.
     */
    public RunReport awaitTermination(Duration timeout) throws InterruptedException, TimeoutException {
        Future<RunReport> current;
        synchronized (this) {
            current = controlRun;
        }
        if (current == null) {
            throw new IllegalStateException("Scheduler " + workerId + " was not started");
        }
        try {
            return current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SchedulerException("Scheduler loop failed", e.getCause());
        }
    }

    /**
     * Ask the loop to finish: in-flight executions are drained, nothing new is dispatched.
     */
    public void stop() {
        stopRequested = true;
        log.info("Stop requested for scheduler {}", workerId);
    }

    public boolean isRunning() {
        return looping.get();
    }

    private RunReport loop(Duration timeout, boolean block) {
        ensureOpen();
        if (!looping.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler " + workerId + " loop is already running");
        }
        Instant started = Instant.now();
        Instant deadline = timeout != null ? started.plus(timeout) : null;

        log.info("Scheduler {} loop starting: {} tasks, timeout={}",
                workerId, graph.size(), timeout != null ? timeout.toMillis() + "ms" : "none");
        try {
            while (true) {
                if (stopRequested) {
                    drainInFlight(deadline);
                    return report(started, false, true);
                }
                if (deadline != null && !Instant.now().isBefore(deadline)) {
                    log.warn("Scheduler {} timed out after {}ms", workerId, timeout.toMillis());
                    return report(started, true, false);
                }
                if (step(waitMillis(deadline)) || !block) {
                    return report(started, false, false);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler {} loop interrupted", workerId);
            return report(started, false, true);
        } finally {
            looping.set(false);
        }
    }

    /**
     * One tick: promote, dispatch, detect deadlock, then wait for outcomes.
     *
     * @return true when every task is finished
     */
    private boolean step(long waitMillis) throws InterruptedException {
        for (String taskId : graph.drainLateFailures()) {
            dropFailed(taskId);
        }
        if (!graph.hasUnfinishedTasks()) {
            return true;
        }

        int fresh = enqueueReady();
        dispatchReady();

        if (running.isEmpty() && readyQueue.isEmpty() && fresh == 0) {
            if (!graph.hasUnfinishedTasks()) {
                return true;
            }
            Map<String, Set<String>> stuck = graph.unfinishedTasks();
            log.error("Scheduler {} deadlocked: {}", workerId, stuck);
            throw new DeadlockException(stuck);
        }

        awaitOutcomes(waitMillis);
        return false;
    }

    private int enqueueReady() {
        List<Task> ready = graph.getReadyTasks();
        for (Task task : ready) {
            readyQueue.add(task.id());
        }
        return ready.size();
    }

    private void dispatchReady() {
        while (running.size() < maxWorkers && !readyQueue.isEmpty()) {
            String taskId = readyQueue.poll();
            Optional<Task> started = graph.markRunning(taskId);
            if (started.isEmpty()) {
                continue;
            }
            Task task = started.get();
            if (task.executor() == null) {
                fail(taskId, "no executor bound to task " + taskId);
                continue;
            }

            TaskContext context = new TaskContext(this, graph, task);
            Future<TaskOutcome> future = completions.submit(new TaskRunner(task, context));
            running.put(taskId, future);
            owners.put(future, taskId);
            log.debug("Dispatched task {} (attempt {}), {}/{} workers busy",
                    taskId, task.attempts(), running.size(), maxWorkers);
            fire(l -> l.onTaskStart(task));
        }
    }

    private void awaitOutcomes(long waitMillis) throws InterruptedException {
        if (running.isEmpty()) {
            return;
        }
        Future<TaskOutcome> done = completions.poll(waitMillis, TimeUnit.MILLISECONDS);
        while (done != null) {
            handle(done);
            done = completions.poll();
        }
    }

    private void drainInFlight(Instant deadline) throws InterruptedException {
        if (!running.isEmpty()) {
            log.info("Scheduler {} draining {} in-flight tasks", workerId, running.size());
        }
        while (!running.isEmpty()) {
            if (deadline != null && !Instant.now().isBefore(deadline)) {
                log.warn("Scheduler {} stopped with {} tasks still in flight", workerId, running.size());
                return;
            }
            awaitOutcomes(waitMillis(deadline));
        }
    }

    private void handle(Future<TaskOutcome> future) {
        String taskId = owners.remove(future);
        if (taskId == null) {
            return;
        }
        running.remove(taskId);

        TaskOutcome outcome;
        try {
            outcome = future.get();
        } catch (ExecutionException e) {
            outcome = TaskOutcome.failed(e.getCause());
        } catch (CancellationException e) {
            outcome = TaskOutcome.failed("cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = TaskOutcome.failed("interrupted");
        }

        Optional<Task> current = graph.getTask(taskId);
        if (current.isEmpty() || current.get().isFinished()) {
            log.debug("Ignoring outcome of task {}, already finished", taskId);
            return;
        }

        if (outcome instanceof TaskOutcome.Completed completed) {
            complete(taskId, completed.result());
        } else if (outcome instanceof TaskOutcome.Blocked suspended) {
            park(taskId, suspended.dependencyId());
        } else if (outcome instanceof TaskOutcome.Failed failed) {
            fail(taskId, failed.message());
        }
    }

    private void complete(String taskId, Object result) {
        List<String> unblocked = graph.markCompleted(taskId, result);
        Task task = graph.getTask(taskId).orElseThrow();
        log.info("Task {} completed in {}ms", taskId, task.duration().toMillis());
        fire(l -> l.onTaskComplete(task));

        for (String dependentId : unblocked) {
            if (graph.getTask(dependentId).map(t -> t.status() == TaskStatus.BLOCKED).orElse(false)) {
                blocked.remove(dependentId);
                graph.resume(dependentId);
                log.debug("Task {} resumed after {} completed", dependentId, taskId);
            }
        }
    }

    private void park(String taskId, String dependencyId) {
        Task task = graph.markBlocked(taskId);
        blocked.put(taskId, task);
        log.debug("Task {} blocked on {}", taskId, dependencyId);
        fire(l -> l.onTaskBlocked(task, dependencyId));

        // The dependency may have completed while the worker was unwinding
        if (graph.isReady(taskId)) {
            blocked.remove(taskId);
            graph.resume(taskId);
            log.debug("Task {} resumed immediately, {} already completed", taskId, dependencyId);
        }
    }

    private void fail(String taskId, String error) {
        List<String> cascaded = graph.markFailed(taskId, error);
        blocked.remove(taskId);
        Task task = graph.getTask(taskId).orElseThrow();
        log.warn("Task {} failed: {}", taskId, error);
        fire(l -> l.onTaskFailed(task, error));

        for (String dependentId : cascaded) {
            dropFailed(dependentId);
        }
    }

    /**
     * Forget a task the graph failed on its own and tell the listeners.
     */
    private void dropFailed(String taskId) {
        blocked.remove(taskId);
        readyQueue.remove(taskId);
        Task task = graph.getTask(taskId).orElseThrow();
        log.warn("Task {} failed: {}", taskId, task.error());
        fire(l -> l.onTaskFailed(task, task.error()));
    }

    private void fire(Consumer<TaskLifecycleListener> hook) {
        for (TaskLifecycleListener listener : listeners) {
            try {
                hook.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private long waitMillis(Instant deadline) {
        long wait = tick.toMillis();
        if (deadline != null) {
            wait = Math.min(wait, Math.max(0, Duration.between(Instant.now(), deadline).toMillis()));
        }
        return wait;
    }

    private RunReport report(Instant started, boolean timedOut, boolean stopped) {
        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Task task : graph.getTasks()) {
            if (task.status() == TaskStatus.COMPLETED) {
                completed.add(task.id());
            } else if (task.status() == TaskStatus.FAILED) {
                failed.add(task.id());
            }
        }
        RunReport report = new RunReport(completed, failed, graph.unfinishedTasks(),
                timedOut, stopped, Duration.between(started, Instant.now()));
        log.info("Scheduler {} loop finished: {}", workerId, report);
        return report;
    }

    // ---------------------------------------------------------------- inspection

    /**
     * Task counts per lifecycle bucket, taken from the graph under its lock
     */
    public SchedulerStatus status() {
        return SchedulerStatus.of(graph.countByStatus());
    }

    public DependencyGraph graph() {
        return graph;
    }

    public Optional<Task> getTask(String taskId) {
        return graph.getTask(taskId);
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public String workerId() {
        return workerId;
    }

    public FailurePolicy failurePolicy() {
        return graph.failurePolicy();
    }

    /**
     * Timing and result of every task, in insertion order
     */
    public List<TaskSnapshot> history() {
        return graph.getTasks().stream().map(TaskSnapshot::of).toList();
    }

    /**
     * Human readable overview of counts and outstanding dependencies
     */
    public String progressReport() {
        SchedulerStatus status = status();
        StringBuilder report = new StringBuilder();
        report.append(String.format("Scheduler %s: %d tasks (running=%d, blocked=%d, pending=%d, completed=%d, failed=%d)%n",
                workerId, status.total(), status.running(), status.blocked(), status.pending(),
                status.completed(), status.failed()));

        for (Task task : graph.getTasks()) {
            report.append(String.format("  [%-9s] %s %s (%d%%)", task.status(), task.id(),
                    GraphView.Node.of(task).label(), Math.round(task.progress() * 100)));
            if (!task.dependencies().isEmpty()) {
                report.append(" waiting on ").append(task.dependencies());
            }
            if (task.error() != null) {
                report.append(" error: ").append(task.error());
            }
            report.append(System.lineSeparator());
        }
        return report.toString();
    }

    // ---------------------------------------------------------------- persistence boundary

    public SchedulerSnapshot exportState() {
        List<TaskSnapshot> tasks = history();
        log.info("Exported {} tasks from scheduler {}", tasks.size(), workerId);
        return new SchedulerSnapshot(maxWorkers, Instant.now(), tasks);
    }

    /**
     * Restore tasks exported by {@link #exportState()}.
     * Unfinished tasks come back as PENDING; finished ones keep their state.
     *
     * @param executors resolves the executor for each task id; may return null for finished tasks
     * @throws UnknownDependencyException if a dependency is neither in the snapshot nor the graph
     * @throws IllegalArgumentException   if a task id is already registered
     */
    public void importState(SchedulerSnapshot snapshot, Function<String, TaskExecutor> executors) {
        ensureOpen();
        Map<String, TaskSnapshot> byId = new LinkedHashMap<>();
        for (TaskSnapshot task : snapshot.tasks()) {
            if (graph.contains(task.id()) || byId.put(task.id(), task) != null) {
                throw new IllegalArgumentException("Task '" + task.id() + "' already exists in the graph");
            }
        }
        for (TaskSnapshot task : byId.values()) {
            for (String dependencyId : task.dependencies()) {
                if (!byId.containsKey(dependencyId) && !graph.contains(dependencyId)) {
                    throw new UnknownDependencyException(task.id(), dependencyId);
                }
            }
        }

        for (String id : importOrder(byId)) {
            TaskSnapshot task = byId.get(id);
            TaskExecutor executor = task.status().isTerminal() ? null : executors.apply(id);
            graph.addTask(task.restore(executor));
        }
        log.info("Imported {} tasks into scheduler {}", byId.size(), workerId);
    }

    private static List<String> importOrder(Map<String, TaskSnapshot> byId) {
        List<String> order = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String id : byId.keySet()) {
            place(id, byId, placed, visiting, order);
        }
        return order;
    }

    private static void place(String id, Map<String, TaskSnapshot> byId, Set<String> placed,
                              Set<String> visiting, List<String> order) {
        if (placed.contains(id) || !byId.containsKey(id)) {
            return;
        }
        if (!visiting.add(id)) {
            throw new CircularDependencyException("Snapshot contains a dependency cycle through task " + id);
        }
        for (String dependencyId : byId.get(id).dependencies()) {
            place(dependencyId, byId, placed, visiting, order);
        }
        visiting.remove(id);
        placed.add(id);
        order.add(id);
    }

    // ---------------------------------------------------------------- shutdown

    /**
     * Stop the loop and shut the worker pool down.
     * Workers get a short grace period before being interrupted.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stop();
        log.info("Closing scheduler {}", workerId);

        shutdown(workers);
        synchronized (this) {
            if (controlThread != null) {
                shutdown(controlThread);
            }
        }
        log.info("Scheduler {} closed", workerId);
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor did not terminate gracefully, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Scheduler " + workerId + " is closed");
        }
    }

    private static String newTaskId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public static class Builder {
        private int maxWorkers = 4;
        private Duration tick = Duration.ofMillis(50);
        private Duration timeout;
        private FailurePolicy failurePolicy = FailurePolicy.BLOCK;
        private DependencySuggester suggester;
        private String workerId = "hive-worker";
        private final List<TaskLifecycleListener> listeners = new ArrayList<>();

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("Max workers must be >= 1, got: " + maxWorkers);
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder tick(Duration tick) {
            if (tick == null || tick.isNegative() || tick.isZero()) {
                throw new IllegalArgumentException("Tick must be positive");
            }
            this.tick = tick;
            return this;
        }

        /**
         * Default wall-clock timeout for {@link Scheduler#run()}; null means none
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
            return this;
        }

        public Builder suggester(DependencySuggester suggester) {
            this.suggester = suggester;
            return this;
        }

        public Builder workerId(String workerId) {
            if (workerId == null || workerId.isBlank()) {
                throw new IllegalArgumentException("Worker id cannot be null or empty");
            }
            this.workerId = workerId;
            return this;
        }

        public Builder listener(TaskLifecycleListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Scheduler build() {
            return new Scheduler(this);
        }
    }
}
