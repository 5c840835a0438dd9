/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.IAlarmQueue;
import com.github.sftwnd.crayfish.countdown.queue.IWorkerMailbox;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Drains the earliest alarm from the queue and routes it to the mailbox of the worker chosen by the parity of
 * the expiry instant. Sleeps for the poll interval only when the queue is empty, the queue lock is never held
 * while sleeping.
 */
@Slf4j
public class Dispatcher implements Runnable {

    private final IAlarmQueue alarmQueue;
    private final Map<RoutingClass, IWorkerMailbox> mailboxes;
    private final IAlarmReporter reporter;
    private final Clock clock;
    private final long pollIntervalNanos;

    /**
     * @param alarmQueue queue of pending alarms
     * @param mailboxes mailbox for every routing class
     * @param reporter alarm event sink
     * @param clock source of the current instant
     * @param pollInterval pause on the empty queue
     */
    public Dispatcher(
            @NonNull IAlarmQueue alarmQueue,
            @NonNull Map<RoutingClass, ? extends IWorkerMailbox> mailboxes,
            @NonNull IAlarmReporter reporter,
            @NonNull Clock clock,
            @NonNull Duration pollInterval
    ) {
        this.alarmQueue = Objects.requireNonNull(alarmQueue, "Dispatcher::new - alarmQueue is null");
        Objects.requireNonNull(mailboxes, "Dispatcher::new - mailboxes is null");
        this.mailboxes = new EnumMap<>(RoutingClass.class);
        for (RoutingClass routingClass : RoutingClass.values()) {
            this.mailboxes.put(routingClass, Objects.requireNonNull(mailboxes.get(routingClass), "Dispatcher::new - mailbox for class " + routingClass + " is absent"));
        }
        this.reporter = Objects.requireNonNull(reporter, "Dispatcher::new - reporter is null");
        this.clock = Objects.requireNonNull(clock, "Dispatcher::new - clock is null");
        this.pollIntervalNanos = Objects.requireNonNull(pollInterval, "Dispatcher::new - pollInterval is null").toNanos();
    }

    /**
     * Route the earliest pending alarm if there is one
     * @return true if an alarm has been routed
     */
    public boolean dispatchNext() {
        Optional<AlarmRequest> next = alarmQueue.takeEarliest();
        next.ifPresent(this::route);
        return next.isPresent();
    }

    @Override
    public void run() {
        logger.info("Dispatcher is started");
        try {
            while (!Thread.currentThread().isInterrupted()) {
                if (!dispatchNext()) {
                    TimeUnit.NANOSECONDS.sleep(pollIntervalNanos);
                }
            }
        } catch (InterruptedException itrex) {
            logger.warn("Dispatcher is terminated by cause: {}", Optional.ofNullable(itrex.getLocalizedMessage()).orElseGet(() -> String.valueOf(itrex)));
            Thread.currentThread().interrupt();
        }
    }

    private void route(AlarmRequest request) {
        RoutingClass routingClass = request.getRoutingClass();
        mailboxes.get(routingClass).put(request);
        reporter.routed(clock.instant(), routingClass, request);
    }

}
