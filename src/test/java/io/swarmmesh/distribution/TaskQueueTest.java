package io.swarmmesh.distribution;

import io.swarmmesh.model.TaskDefinition;
import io.swarmmesh.model.TaskPriority;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TaskQueueTest {

    @Test
    void ordersByPriorityThenSubmission() {
        TaskQueue queue = new TaskQueue();
        queue.enqueue(task("low-1", TaskPriority.LOW));
        queue.enqueue(task("normal-1", TaskPriority.NORMAL));
        queue.enqueue(task("critical-1", TaskPriority.CRITICAL));
        queue.enqueue(task("normal-2", TaskPriority.NORMAL));
        queue.enqueue(task("urgent-1", TaskPriority.URGENT));

        Assertions.assertEquals(List.of("critical-1", "urgent-1", "normal-1", "normal-2", "low-1"), queue.taskIds());
        Assertions.assertEquals(List.of("critical-1", "urgent-1"),
                queue.getNext(2).stream().map(TaskDefinition::id).toList());
        Assertions.assertEquals(3, queue.size());
    }

    @Test
    void takeSkipsEntriesThatAreNotReady() {
        TaskQueue queue = new TaskQueue();
        queue.enqueue(task("a", TaskPriority.HIGH));
        queue.enqueue(task("b", TaskPriority.HIGH));
        queue.enqueue(task("c", TaskPriority.HIGH));

        List<TaskQueue.QueuedTask> taken = queue.take(2, t -> !t.id().equals("a"));

        Assertions.assertEquals(List.of("b", "c"), taken.stream().map(q -> q.task().id()).toList());
        Assertions.assertEquals(List.of("a"), queue.taskIds());
    }

    @Test
    void restoredEntryKeepsItsPlace() {
        TaskQueue queue = new TaskQueue();
        queue.enqueue(task("first", TaskPriority.NORMAL));
        queue.enqueue(task("second", TaskPriority.NORMAL));
        TaskQueue.QueuedTask head = queue.take(1, t -> true).get(0);
        queue.enqueue(task("third", TaskPriority.NORMAL));

        queue.restore(head);

        Assertions.assertEquals(List.of("first", "second", "third"), queue.taskIds());
        Assertions.assertTrue(queue.remove("second"));
        Assertions.assertFalse(queue.contains("second"));
        Assertions.assertFalse(queue.remove("missing"));
    }

    private static TaskDefinition task(String id, TaskPriority priority) {
        return TaskDefinition.simple(id, "general", priority, List.of()).withId(id);
    }
}
