package io.rthub.service.processing;

import io.rthub.util.Ids;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Queued unit of work for one event. The task id doubles as the retry handle.
 * A task either starts or is cancelled, never both.
 */
public final class ProcessingTask implements Delayed {

    public enum Kind { PROCESS, RETRY }

    private enum State { QUEUED, STARTED, CANCELLED }

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String taskId;
    private final String eventId;
    private final Kind kind;
    private final Instant dueAt;
    private final long sequence;
    private final Clock clock;
    private final boolean poison;
    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);

    private ProcessingTask(String eventId, Kind kind, Instant dueAt, Clock clock, boolean poison) {
        this.taskId = Ids.newId();
        this.eventId = eventId;
        this.kind = kind;
        this.dueAt = dueAt;
        this.sequence = SEQUENCE.incrementAndGet();
        this.clock = clock;
        this.poison = poison;
    }

    static ProcessingTask of(String eventId, Kind kind, Instant dueAt, Clock clock) {
        return new ProcessingTask(eventId, kind, dueAt, clock, false);
    }

    // Due immediately; a worker that takes it exits.
    static ProcessingTask poisonPill(Clock clock) {
        return new ProcessingTask(null, Kind.PROCESS, Instant.EPOCH, clock, true);
    }

    public String taskId() {
        return taskId;
    }

    public String eventId() {
        return eventId;
    }

    public Kind kind() {
        return kind;
    }

    public Instant dueAt() {
        return dueAt;
    }

    boolean isPoison() {
        return poison;
    }

    boolean tryStart() {
        return state.compareAndSet(State.QUEUED, State.STARTED);
    }

    boolean tryCancel() {
        return state.compareAndSet(State.QUEUED, State.CANCELLED);
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        Duration remaining = Duration.between(clock.instant(), dueAt);
        return unit.convert(remaining.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other == this) {
            return 0;
        }
        if (other instanceof ProcessingTask task) {
            int byDue = dueAt.compareTo(task.dueAt);
            return byDue != 0 ? byDue : Long.compare(sequence, task.sequence);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }

    @Override
    public String toString() {
        return "ProcessingTask{" + taskId + ", event=" + eventId + ", " + kind + ", due=" + dueAt + "}";
    }
}
