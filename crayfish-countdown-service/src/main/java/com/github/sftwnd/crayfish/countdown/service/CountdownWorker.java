/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.IWorkerMailbox;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Display worker of a single routing class. Takes one alarm at a time from its own mailbox and reports
 * the seconds left every report interval until the alarm expires.
 */
@Slf4j
public class CountdownWorker implements Runnable {

    @Getter private final RoutingClass routingClass;
    private final IWorkerMailbox mailbox;
    private final IAlarmReporter reporter;
    private final Clock clock;
    private final Duration reportInterval;

    public CountdownWorker(
            @NonNull RoutingClass routingClass,
            @NonNull IWorkerMailbox mailbox,
            @NonNull IAlarmReporter reporter,
            @NonNull Clock clock,
            @NonNull Duration reportInterval
    ) {
        this.routingClass = Objects.requireNonNull(routingClass, "CountdownWorker::new - routingClass is null");
        this.mailbox = Objects.requireNonNull(mailbox, "CountdownWorker::new - mailbox is null");
        this.reporter = Objects.requireNonNull(reporter, "CountdownWorker::new - reporter is null");
        this.clock = Objects.requireNonNull(clock, "CountdownWorker::new - clock is null");
        this.reportInterval = Objects.requireNonNull(reportInterval, "CountdownWorker::new - reportInterval is null");
    }

    @Override
    public void run() {
        logger.info("Countdown worker {} is started", routingClass.getWorkerNumber());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                countdown(mailbox.take());
            }
        } catch (InterruptedException itrex) {
            logger.warn("Countdown worker {} is terminated by cause: {}", routingClass.getWorkerNumber(),
                    Optional.ofNullable(itrex.getLocalizedMessage()).orElseGet(() -> String.valueOf(itrex)));
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Count the alarm down up to its expiry on the calling thread
     * @param request alarm owned by the worker
     * @throws InterruptedException if the worker has been interrupted between two reports
     */
    public void countdown(@NonNull AlarmRequest request) throws InterruptedException {
        Objects.requireNonNull(request, "CountdownWorker::countdown - request is null");
        Instant now = clock.instant();
        reporter.workerReceived(now, routingClass, request);
        while (!request.isExpired(now)) {
            reporter.countdownTick(now, routingClass, request.secondsLeft(now), request);
            Duration remaining = request.remaining(now);
            TimeUnit.NANOSECONDS.sleep((remaining.compareTo(reportInterval) < 0 ? remaining : reportInterval).toNanos());
            now = clock.instant();
        }
        reporter.expired(now, routingClass, request);
    }

}
