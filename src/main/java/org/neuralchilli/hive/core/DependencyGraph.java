package org.neuralchilli.hive.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.hive.domain.DagStatistics;
import org.neuralchilli.hive.domain.GraphView;
import org.neuralchilli.hive.domain.Task;
import org.neuralchilli.hive.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Authoritative store of tasks and the dependency edges between them.
 * <p>
 * Tasks are kept in insertion order. Outstanding edges are mirrored in a JGraphT
 * {@link DirectedAcyclicGraph} pointing from dependency to dependent; an edge is removed
 * once its dependency completes, so the mirror always describes remaining work.
 * <p>
 * Every operation runs under a single lock scoped to the whole graph. Tasks handed out
 * are immutable snapshots.
 */
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
    private final FailurePolicy failurePolicy;
    // Tasks failed by an edge onto an already failed dependency, drained by the scheduler
    private final Queue<String> lateFailures = new ConcurrentLinkedQueue<>();

    public DependencyGraph() {
        this(FailurePolicy.BLOCK);
    }

    public DependencyGraph(FailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    /**
     * Register a task together with its declared dependencies.
     * Dependencies that already completed are satisfied and not recorded as edges.
     * Under {@link FailurePolicy#CASCADE} a task declaring a dependency that already failed
     * is registered as FAILED and queued for {@link #drainLateFailures()}.
     *
     * @throws IllegalArgumentException   if the id is already registered
     * @throws UnknownDependencyException if a dependency is not in the graph
     */
    public Task addTask(Task task) {
        lock.lock();
        try {
            if (tasks.containsKey(task.id())) {
                throw new IllegalArgumentException("Task '" + task.id() + "' already exists in the graph");
            }
            for (String dependencyId : task.dependencies()) {
                if (!tasks.containsKey(dependencyId)) {
                    throw new UnknownDependencyException(task.id(), dependencyId);
                }
            }

            Set<String> outstanding = task.dependencies().stream()
                    .filter(dependencyId -> tasks.get(dependencyId).status() != TaskStatus.COMPLETED)
                    .collect(Collectors.toCollection(LinkedHashSet::new));

            Task registered = task.withDependencies(outstanding).withDependents(Set.of());
            tasks.put(registered.id(), registered);
            dag.addVertex(registered.id());

            for (String dependencyId : outstanding) {
                update(dependencyId, dep -> dep.withDependents(plus(dep.dependents(), registered.id())));
                dag.addEdge(dependencyId, registered.id());
                log.trace("Added edge: {} -> {}", dependencyId, registered.id());
            }

            log.debug("Registered task {} ({}) with {} dependencies",
                    registered.id(), registered.status(), outstanding.size());

            if (failurePolicy == FailurePolicy.CASCADE && !registered.isFinished()) {
                Optional<Task> failedDependency = outstanding.stream()
                        .map(tasks::get)
                        .filter(dep -> dep.status() == TaskStatus.FAILED)
                        .findFirst();
                if (failedDependency.isPresent()) {
                    failLate(registered.id(), failedDependency.get());
                    return tasks.get(registered.id());
                }
            }
            return registered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make {@code taskId} depend on {@code dependencyId}.
     * Under {@link FailurePolicy#CASCADE} an edge onto a failed dependency fails {@code taskId}
     * and its unfinished dependents; they are queued for {@link #drainLateFailures()}.
     *
     * @return true if a new edge was inserted, false if it already existed or the dependency is completed
     * @throws UnknownDependencyException  if either id is not in the graph
     * @throws IllegalStateException       if {@code taskId} is already finished
     * @throws CircularDependencyException if the edge would close a cycle; the graph is left unchanged
     */
    public boolean addDependency(String taskId, String dependencyId) {
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null) {
                throw new UnknownDependencyException(taskId, taskId);
            }
            Task dependency = tasks.get(dependencyId);
            if (dependency == null) {
                throw new UnknownDependencyException(taskId, dependencyId);
            }
            if (task.isFinished()) {
                throw new IllegalStateException(
                        "Cannot add dependency to task '" + taskId + "' in terminal status " + task.status());
            }
            if (task.dependencies().contains(dependencyId)) {
                return false;
            }
            if (dependency.status() == TaskStatus.COMPLETED) {
                log.trace("Dependency {} of {} already completed, no edge recorded", dependencyId, taskId);
                return false;
            }
            if (reaches(dependencyId, taskId)) {
                throw new CircularDependencyException(taskId, dependencyId);
            }

            try {
                dag.addEdge(dependencyId, taskId);
            } catch (IllegalArgumentException e) {
                // JGraphT rejects edges that would create a cycle
                throw new CircularDependencyException(taskId, dependencyId);
            }

            update(taskId, t -> t.withDependencies(plus(t.dependencies(), dependencyId)));
            update(dependencyId, d -> d.withDependents(plus(d.dependents(), taskId)));
            log.trace("Added edge: {} -> {}", dependencyId, taskId);

            if (failurePolicy == FailurePolicy.CASCADE && dependency.status() == TaskStatus.FAILED) {
                failLate(taskId, dependency);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the edge between two tasks on both sides.
     *
     * @return false if either id is unknown or the edge does not exist
     */
    public boolean removeDependency(String taskId, String dependencyId) {
        lock.lock();
        try {
            Task task = tasks.get(taskId);
            if (task == null || !tasks.containsKey(dependencyId) || !task.dependencies().contains(dependencyId)) {
                return false;
            }
            unlink(taskId, dependencyId);
            log.trace("Removed edge: {} -> {}", dependencyId, taskId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True iff every dependency of the task is COMPLETED.
     */
    public boolean isReady(String taskId) {
        lock.lock();
        try {
            return allDependenciesCompleted(require(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move every PENDING task whose dependencies are all completed to READY.
     *
     * @return the newly ready tasks, highest priority first, insertion order within a priority
     */
    public List<Task> getReadyTasks() {
        lock.lock();
        try {
            List<Task> ready = new ArrayList<>();
            for (Task task : List.copyOf(tasks.values())) {
                if (task.status() == TaskStatus.PENDING && allDependenciesCompleted(task)) {
                    Task promoted = task.ready();
                    tasks.put(promoted.id(), promoted);
                    ready.add(promoted);
                }
            }
            // List.sort is stable, so insertion order survives within a priority
            ready.sort(Comparator.comparingInt(Task::priority).reversed());
            if (!ready.isEmpty()) {
                log.debug("Found {} ready tasks", ready.size());
            }
            return ready;
        } finally {
            lock.unlock();
        }
    }

    /**
     * PENDING or BLOCKED tasks with at least one unmet dependency.
     */
    public List<Task> getBlockedTasks() {
        lock.lock();
        try {
            return tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.PENDING || t.status() == TaskStatus.BLOCKED)
                    .filter(t -> !allDependenciesCompleted(t))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * READY to RUNNING.
     * A READY task that gained an unmet dependency since it was promoted falls back to PENDING.
     *
     * @return the running task, or empty if the task is no longer dispatchable
     */
    public Optional<Task> markRunning(String taskId) {
        lock.lock();
        try {
            Task task = require(taskId);
            if (task.status() != TaskStatus.READY) {
                log.debug("Task {} is {} and cannot be dispatched", taskId, task.status());
                return Optional.empty();
            }
            if (!allDependenciesCompleted(task)) {
                tasks.put(taskId, task.withStatus(TaskStatus.PENDING));
                log.debug("Task {} gained unmet dependencies, back to PENDING", taskId);
                return Optional.empty();
            }
            Task running = task.start();
            tasks.put(taskId, running);
            return Optional.of(running);
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING to BLOCKED.
     */
    public Task markBlocked(String taskId) {
        return update(taskId, Task::block);
    }

    /**
     * BLOCKED to PENDING.
     */
    public Task resume(String taskId) {
        return update(taskId, Task::resume);
    }

    /**
     * Mark a task COMPLETED and drop the edges it satisfied.
     *
     * @return exactly the dependents whose dependency set became empty
     */
    public List<String> markCompleted(String taskId, Object result) {
        lock.lock();
        try {
            Task completed = require(taskId).complete(result);
            tasks.put(taskId, completed);

            List<String> unblocked = new ArrayList<>();
            for (String dependentId : completed.dependents()) {
                unlink(dependentId, taskId);
                if (tasks.get(dependentId).dependencies().isEmpty()) {
                    unblocked.add(dependentId);
                }
            }
            log.debug("Task {} completed, {} dependents unblocked", taskId, unblocked.size());
            return unblocked;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark a task FAILED.
     * Under {@link FailurePolicy#CASCADE} every unfinished transitive dependent fails too.
     *
     * @return ids of the dependents failed by the cascade, in breadth-first order
     */
    public List<String> markFailed(String taskId, String error) {
        lock.lock();
        try {
            Task failed = require(taskId).fail(error);
            tasks.put(taskId, failed);
            log.debug("Task {} failed: {}", taskId, error);

            if (failurePolicy != FailurePolicy.CASCADE) {
                return List.of();
            }

            List<String> cascaded = cascadeFrom(failed);
            if (!cascaded.isEmpty()) {
                log.debug("Failure of {} cascaded to {}", taskId, cascaded);
            }
            return cascaded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of tasks failed because they gained a dependency on a task that had already
     * failed, including their own cascaded dependents, in failure order. Clears the backlog.
     */
    public List<String> drainLateFailures() {
        List<String> drained = new ArrayList<>();
        String taskId;
        while ((taskId = lateFailures.poll()) != null) {
            drained.add(taskId);
        }
        return drained;
    }

    private void failLate(String taskId, Task dependency) {
        Task failed = require(taskId).fail("dependency " + dependency.id() + " failed: " + dependency.error());
        tasks.put(taskId, failed);
        lateFailures.add(taskId);
        List<String> cascaded = cascadeFrom(failed);
        lateFailures.addAll(cascaded);
        log.debug("Task {} failed on arrival, dependency {} had already failed; cascaded to {}",
                taskId, dependency.id(), cascaded);
    }

    private List<String> cascadeFrom(Task failed) {
        List<String> cascaded = new ArrayList<>();
        Deque<Task> queue = new ArrayDeque<>();
        queue.add(failed);
        while (!queue.isEmpty()) {
            Task source = queue.poll();
            for (String dependentId : source.dependents()) {
                Task dependent = tasks.get(dependentId);
                if (dependent.isFinished()) {
                    continue;
                }
                Task dependentFailed = dependent.fail(
                        "dependency " + source.id() + " failed: " + source.error());
                tasks.put(dependentId, dependentFailed);
                cascaded.add(dependentId);
                queue.add(dependentFailed);
            }
        }
        return cascaded;
    }

    public Task updateProgress(String taskId, double fraction) {
        return update(taskId, t -> t.withProgress(fraction));
    }

    public Task saveCheckpoint(String taskId, Map<String, Object> state) {
        return update(taskId, t -> t.withCheckpoint(state));
    }

    /**
     * Kahn's algorithm over a point-in-time copy of the edges.
     * Ties are broken by insertion order.
     *
     * @throws CircularDependencyException if the copy contains a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        lock.lock();
        try {
            for (Task task : tasks.values()) {
                dependencies.put(task.id(), new LinkedHashSet<>(task.dependencies()));
                dependents.put(task.id(), task.dependents());
            }
        } finally {
            lock.unlock();
        }

        Map<String, Integer> position = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            position.put(entry.getKey(), position.size());
            inDegree.put(entry.getKey(), entry.getValue().size());
        }

        PriorityQueue<String> queue = new PriorityQueue<>(Comparator.comparingInt(position::get));
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                queue.add(id);
            }
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (String dependentId : dependents.get(id)) {
                if (inDegree.merge(dependentId, -1, Integer::sum) == 0) {
                    queue.add(dependentId);
                }
            }
        }

        if (order.size() != dependencies.size()) {
            Set<String> cyclic = new LinkedHashSet<>(dependencies.keySet());
            order.forEach(cyclic::remove);
            throw new CircularDependencyException("Dependency cycle detected among tasks: " + cyclic);
        }
        return order;
    }

    public Optional<Task> getTask(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * All tasks in insertion order
     */
    public List<Task> getTasks() {
        lock.lock();
        try {
            return List.copyOf(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Outstanding dependencies of a task
     */
    public Set<String> getDependencies(String taskId) {
        lock.lock();
        try {
            return require(taskId).dependencies();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tasks still waiting on this one
     */
    public Set<String> getDependents(String taskId) {
        lock.lock();
        try {
            return require(taskId).dependents();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of the tasks spawned by {@code parentId}, in spawn order
     */
    public List<String> getSubtasks(String parentId) {
        lock.lock();
        try {
            return tasks.values().stream()
                    .filter(t -> parentId.equals(t.parentId()))
                    .map(Task::id)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return tasks.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True while at least one task has not reached COMPLETED or FAILED
     */
    public boolean hasUnfinishedTasks() {
        lock.lock();
        try {
            return tasks.values().stream().anyMatch(t -> !t.isFinished());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unfinished tasks mapped to the dependency ids they still await
     */
    public Map<String, Set<String>> unfinishedTasks() {
        lock.lock();
        try {
            Map<String, Set<String>> unfinished = new LinkedHashMap<>();
            for (Task task : tasks.values()) {
                if (!task.isFinished()) {
                    unfinished.put(task.id(), unmetDependencies(task));
                }
            }
            return unfinished;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Caller-controlled cleanup of a finished task that nothing waits on.
     *
     * @throws IllegalStateException if the task is unfinished or still has dependents
     */
    public Task removeTask(String taskId) {
        lock.lock();
        try {
            Task task = require(taskId);
            if (!task.isFinished()) {
                throw new IllegalStateException("Cannot remove task '" + taskId + "' in status " + task.status());
            }
            if (!task.dependents().isEmpty()) {
                throw new IllegalStateException(
                        "Cannot remove task '" + taskId + "', still required by " + task.dependents());
            }
            for (String dependencyId : task.dependencies()) {
                update(dependencyId, d -> d.withDependents(minus(d.dependents(), taskId)));
            }
            dag.removeVertex(taskId);
            tasks.remove(taskId);
            log.debug("Removed task {}", taskId);
            return task;
        } finally {
            lock.unlock();
        }
    }

    public Map<TaskStatus, Integer> countByStatus() {
        lock.lock();
        try {
            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            for (Task task : tasks.values()) {
                counts.merge(task.status(), 1, Integer::sum);
            }
            return counts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nodes, edges and per-status counts for visualization
     */
    public GraphView snapshot() {
        lock.lock();
        try {
            List<GraphView.Node> nodes = tasks.values().stream().map(GraphView.Node::of).toList();
            List<GraphView.Edge> edges = new ArrayList<>();
            for (Task task : tasks.values()) {
                for (String dependencyId : task.dependencies()) {
                    edges.add(new GraphView.Edge(dependencyId, task.id()));
                }
            }
            return new GraphView(nodes, edges, countByStatus());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shape of the outstanding graph.
     */
    public DagStatistics statistics() {
        lock.lock();
        try {
            if (tasks.isEmpty()) {
                return DagStatistics.empty();
            }
            List<Set<String>> levels = executionLevels();
            return new DagStatistics(
                    dag.vertexSet().size(),
                    dag.edgeSet().size(),
                    rootTasks().size(),
                    leafTasks().size(),
                    levels.size(),
                    levels.stream().mapToInt(Set::size).max().orElse(0)
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Groups of tasks that could run in parallel, in dependency order.
     */
    public List<Set<String>> executionLevels() {
        lock.lock();
        try {
            List<Set<String>> levels = new ArrayList<>();
            Set<String> processed = new HashSet<>();
            Set<String> remaining = new LinkedHashSet<>(tasks.keySet());

            while (!remaining.isEmpty()) {
                Set<String> currentLevel = new LinkedHashSet<>();
                for (String id : remaining) {
                    Set<String> dependencies = dag.incomingEdgesOf(id).stream()
                            .map(dag::getEdgeSource)
                            .collect(Collectors.toSet());
                    if (processed.containsAll(dependencies)) {
                        currentLevel.add(id);
                    }
                }
                if (currentLevel.isEmpty()) {
                    throw new IllegalStateException(
                            "Could not determine execution levels - possible cycle or invalid state");
                }
                levels.add(currentLevel);
                processed.addAll(currentLevel);
                remaining.removeAll(currentLevel);
            }
            return levels;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tasks with no outstanding dependencies
     */
    public Set<String> rootTasks() {
        lock.lock();
        try {
            return dag.vertexSet().stream()
                    .filter(id -> dag.incomingEdgesOf(id).isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tasks nothing waits on
     */
    public Set<String> leafTasks() {
        lock.lock();
        try {
            return dag.vertexSet().stream()
                    .filter(id -> dag.outgoingEdgesOf(id).isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } finally {
            lock.unlock();
        }
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new NoSuchElementException("Task not found: " + taskId);
        }
        return task;
    }

    private Task update(String taskId, UnaryOperator<Task> change) {
        lock.lock();
        try {
            Task updated = change.apply(require(taskId));
            tasks.put(taskId, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private void unlink(String taskId, String dependencyId) {
        update(taskId, t -> t.withDependencies(minus(t.dependencies(), dependencyId)));
        update(dependencyId, d -> d.withDependents(minus(d.dependents(), taskId)));
        dag.removeEdge(dependencyId, taskId);
    }

    private boolean allDependenciesCompleted(Task task) {
        for (String dependencyId : task.dependencies()) {
            Task dependency = tasks.get(dependencyId);
            if (dependency == null || dependency.status() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private Set<String> unmetDependencies(Task task) {
        return task.dependencies().stream()
                .filter(id -> !tasks.containsKey(id) || tasks.get(id).status() != TaskStatus.COMPLETED)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Depth-first search along dependency edges from {@code start} looking for {@code target}.
     */
    private boolean reaches(String start, String target) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            Task task = tasks.get(current);
            if (task != null) {
                task.dependencies().forEach(stack::push);
            }
        }
        return false;
    }

    private static Set<String> plus(Set<String> ids, String id) {
        Set<String> copy = new LinkedHashSet<>(ids);
        copy.add(id);
        return copy;
    }

    private static Set<String> minus(Set<String> ids, String id) {
        Set<String> copy = new LinkedHashSet<>(ids);
        copy.remove(id);
        return copy;
    }
}
