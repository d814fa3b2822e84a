package io.swarmmesh.distribution;

import io.swarmmesh.model.TaskDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

public final class TaskQueue {
    private static final Comparator<QueuedTask> ORDER = Comparator
            .comparingInt((QueuedTask q) -> -q.task().priority().queueWeight())
            .thenComparingLong(QueuedTask::sequence);

    private final List<QueuedTask> entries = new ArrayList<>();
    private long nextSequence;

    public void enqueue(TaskDefinition task) {
        insert(new QueuedTask(task, nextSequence++));
    }

    public void restore(QueuedTask entry) {
        insert(entry);
    }

    public List<TaskDefinition> getNext(int count) {
        return getNext(count, task -> true);
    }

    public List<TaskDefinition> getNext(int count, Predicate<TaskDefinition> ready) {
        return take(count, ready).stream().map(QueuedTask::task).toList();
    }

    public List<QueuedTask> take(int count, Predicate<TaskDefinition> ready) {
        List<QueuedTask> out = new ArrayList<>();
        Iterator<QueuedTask> it = entries.iterator();
        while (it.hasNext() && out.size() < count) {
            QueuedTask entry = it.next();
            if (ready.test(entry.task())) {
                it.remove();
                out.add(entry);
            }
        }
        return out;
    }

    public List<TaskDefinition> peek(int count) {
        return entries.stream().limit(Math.max(0, count)).map(QueuedTask::task).toList();
    }

    public boolean remove(String taskId) {
        return entries.removeIf(entry -> entry.task().id().equals(taskId));
    }

    public boolean contains(String taskId) {
        return entries.stream().anyMatch(entry -> entry.task().id().equals(taskId));
    }

    public List<String> taskIds() {
        return entries.stream().map(entry -> entry.task().id()).toList();
    }

    public int size() {
        return entries.size();
    }

    private void insert(QueuedTask entry) {
        int lo = 0;
        int hi = entries.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ORDER.compare(entries.get(mid), entry) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        entries.add(lo, entry);
    }

    public record QueuedTask(TaskDefinition task, long sequence) {
    }
}
