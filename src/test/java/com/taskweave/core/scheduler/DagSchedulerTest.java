package com.taskweave.core.scheduler;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DagSchedulerTest {

    private DagScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new DagScheduler();
    }

    private Task task(String id, String... deps) {
        return Task.builder(id).execute((input, ctx) -> id).dependsOn(deps).build();
    }

    private List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    @DisplayName("3 independent tasks are all ready")
    void threeIndependentTasks() {
        var tasks = List.of(task("A"), task("B"), task("C"));
        assertEquals(List.of("A", "B", "C"), ids(scheduler.readyTasks(tasks, Map.of(), Set.of())));
    }

    @Test
    @DisplayName("Linear chain A->B->C becomes ready one task at a time")
    void linearChain() {
        var tasks = List.of(task("A"), task("B", "A"), task("C", "B"));

        assertEquals(List.of("A"), ids(scheduler.readyTasks(tasks, Map.of(), Set.of())));
        assertEquals(List.of("B"),
                ids(scheduler.readyTasks(tasks, Map.of("A", TaskStatus.COMPLETED), Set.of())));
        assertEquals(List.of("C"), ids(scheduler.readyTasks(tasks,
                Map.of("A", TaskStatus.COMPLETED, "B", TaskStatus.COMPLETED), Set.of())));
    }

    @Test
    @DisplayName("Diamond A->{B,C}->D -> [A], [B,C], [D]")
    void diamondDependency() {
        var tasks = List.of(task("A"), task("B", "A"), task("C", "A"), task("D", "B", "C"));

        assertEquals(List.of("B", "C"),
                ids(scheduler.readyTasks(tasks, Map.of("A", TaskStatus.COMPLETED), Set.of())));
        assertEquals(List.of(), ids(scheduler.readyTasks(tasks,
                Map.of("A", TaskStatus.COMPLETED, "B", TaskStatus.COMPLETED), Set.of("C"))));
        assertEquals(List.of("D"), ids(scheduler.readyTasks(tasks,
                Map.of("A", TaskStatus.COMPLETED, "B", TaskStatus.COMPLETED, "C", TaskStatus.COMPLETED),
                Set.of())));
    }

    @Test
    @DisplayName("In-flight tasks are not offered again")
    void inFlightTasksExcluded() {
        var tasks = List.of(task("A"), task("B"));
        assertEquals(List.of("B"), ids(scheduler.readyTasks(tasks, Map.of(), Set.of("A"))));
    }

    @Test
    @DisplayName("A failed or timed-out dependency still releases its dependents")
    void unsuccessfulDependencySatisfies() {
        var tasks = List.of(task("A"), task("B"), task("C", "A", "B"));

        assertEquals(List.of("C"), ids(scheduler.readyTasks(tasks,
                Map.of("A", TaskStatus.FAILED, "B", TaskStatus.TIMEOUT), Set.of())));
    }

    @Test
    @DisplayName("A dependency still in flight holds its dependents back")
    void inFlightDependencyNotSatisfied() {
        var tasks = List.of(task("A"), task("B", "A"));
        assertTrue(scheduler.readyTasks(tasks, Map.of(), Set.of("A")).isEmpty());
    }

    @Test
    @DisplayName("unknownDependencies lists task -> missing id pairs")
    void unknownDependencies() {
        var tasks = List.of(task("A"), task("B", "A", "Z"));
        assertEquals(List.of("B -> Z"), scheduler.unknownDependencies(tasks));
    }

    @Test
    @DisplayName("findCycle returns the cycle path with the first id repeated")
    void findsCycle() {
        var tasks = List.of(task("A", "B"), task("B", "A"));
        var cycle = scheduler.findCycle(tasks);
        assertTrue(cycle.isPresent());
        assertEquals(List.of("A", "B", "A"), cycle.get());
    }

    @Test
    @DisplayName("findCycle detects a self dependency")
    void findsSelfCycle() {
        var cycle = scheduler.findCycle(List.of(task("A"), task("B", "B")));
        assertEquals(List.of("B", "B"), cycle.orElseThrow());
    }

    @Test
    @DisplayName("findCycle is empty for an acyclic graph")
    void noCycle() {
        var tasks = List.of(task("A"), task("B", "A"), task("C", "A"), task("D", "B", "C"));
        assertTrue(scheduler.findCycle(tasks).isEmpty());
    }
}
