package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reporter keeping every event in the order of the calls
 */
class RecordingReporter implements IAlarmReporter {

    enum Kind { RECEIVED, ROUTED, WORKER_RECEIVED, COUNTDOWN_TICK, EXPIRED }

    @Getter
    @ToString
    @AllArgsConstructor
    static class Event {
        private final Kind kind;
        private final Instant instant;
        private final RoutingClass routingClass;
        private final long secondsLeft;
        private final AlarmRequest request;
    }

    private final List<Event> events = new ArrayList<>();

    @Override
    public void received(Instant instant, AlarmRequest request) {
        record(new Event(Kind.RECEIVED, instant, null, -1, request));
    }

    @Override
    public void routed(Instant instant, RoutingClass routingClass, AlarmRequest request) {
        record(new Event(Kind.ROUTED, instant, routingClass, -1, request));
    }

    @Override
    public void workerReceived(Instant instant, RoutingClass routingClass, AlarmRequest request) {
        record(new Event(Kind.WORKER_RECEIVED, instant, routingClass, -1, request));
    }

    @Override
    public void countdownTick(Instant instant, RoutingClass routingClass, long secondsLeft, AlarmRequest request) {
        record(new Event(Kind.COUNTDOWN_TICK, instant, routingClass, secondsLeft, request));
    }

    @Override
    public void expired(Instant instant, RoutingClass routingClass, AlarmRequest request) {
        record(new Event(Kind.EXPIRED, instant, routingClass, -1, request));
    }

    List<Event> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    List<Event> events(Kind kind) {
        return events().stream().filter(event -> event.getKind() == kind).collect(Collectors.toList());
    }

    /**
     * Wait until the recorded events satisfy the condition
     * @return true if the condition is satisfied before the timeout
     */
    boolean await(Predicate<List<Event>> condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (events) {
            while (!condition.test(events)) {
                long waitNanos = deadline - System.nanoTime();
                if (waitNanos <= 0) {
                    return false;
                }
                events.wait(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
            }
            return true;
        }
    }

    boolean awaitExpired(int count, Duration timeout) throws InterruptedException {
        return await(Kind.EXPIRED, count, timeout);
    }

    boolean await(Kind kind, int count, Duration timeout) throws InterruptedException {
        return await(list -> list.stream().filter(event -> event.getKind() == kind).count() >= count, timeout);
    }

    protected void record(Event event) {
        synchronized (events) {
            events.add(event);
            events.notifyAll();
        }
    }

}
