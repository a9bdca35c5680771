package com.taskweave.core.scheduler;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes which tasks of a dependency graph can be dispatched next and whether
 * the graph has a cycle.
 * <p>
 * A dependency is satisfied once it settled, whatever its terminal status.
 */
@Service
public class DagScheduler {

    private static final Logger log = LoggerFactory.getLogger(DagScheduler.class);

    /**
     * Compute the tasks eligible for dispatch.
     *
     * @param tasks    all tasks in the plan, in plan order
     * @param settled  terminal status of every task settled so far (any status satisfies dependents)
     * @param inFlight ids of tasks dispatched but not yet settled
     * @return ready tasks in plan order; empty if nothing can start right now
     */
    public List<Task> readyTasks(List<Task> tasks, Map<String, TaskStatus> settled, Set<String> inFlight) {
        var ready = new ArrayList<Task>();
        for (var task : tasks) {
            if (settled.containsKey(task.id()) || inFlight.contains(task.id())) {
                continue;
            }
            if (settled.keySet().containsAll(task.dependencies())) {
                log.debug("Task {} ready (deps: {})", task.id(), task.dependencies());
                ready.add(task);
            }
        }
        return ready;
    }

    /**
     * Dependency ids that name no task in {@code tasks}, as "taskId -> dependencyId" pairs.
     */
    public List<String> unknownDependencies(Collection<Task> tasks) {
        var ids = new HashMap<String, Task>();
        tasks.forEach(t -> ids.put(t.id(), t));
        var unknown = new ArrayList<String>();
        for (var task : tasks) {
            for (var dep : task.dependencies()) {
                if (!ids.containsKey(dep)) {
                    unknown.add(task.id() + " -> " + dep);
                }
            }
        }
        return unknown;
    }

    /**
     * Finds one dependency cycle, if any.
     *
     * @return the ids along the cycle, first id repeated at the end (e.g. [A, B, A])
     */
    public Optional<List<String>> findCycle(List<Task> tasks) {
        var byId = new HashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));

        // 0 = unvisited, 1 = on the current path, 2 = done
        var state = new HashMap<String, Integer>();
        for (var task : tasks) {
            if (state.getOrDefault(task.id(), 0) == 0) {
                var cycle = visit(task.id(), byId, state, new ArrayDeque<>());
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String id, Map<String, Task> byId, Map<String, Integer> state,
                                         Deque<String> path) {
        state.put(id, 1);
        path.addLast(id);
        var task = byId.get(id);
        if (task != null) {
            for (var dep : task.dependencies()) {
                int depState = state.getOrDefault(dep, 0);
                if (depState == 1) {
                    var cycle = new ArrayList<String>();
                    boolean inCycle = false;
                    for (var onPath : path) {
                        if (onPath.equals(dep)) {
                            inCycle = true;
                        }
                        if (inCycle) {
                            cycle.add(onPath);
                        }
                    }
                    cycle.add(dep);
                    return Optional.of(cycle);
                }
                if (depState == 0 && byId.containsKey(dep)) {
                    var cycle = visit(dep, byId, state, path);
                    if (cycle.isPresent()) {
                        return cycle;
                    }
                }
            }
        }
        path.removeLast();
        state.put(id, 2);
        return Optional.empty();
    }
}
