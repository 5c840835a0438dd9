/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmQueue;
import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.IAlarmQueue;
import com.github.sftwnd.crayfish.countdown.queue.IWorkerMailbox;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import com.github.sftwnd.crayfish.countdown.queue.WorkerMailbox;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The service accepts alarm requests, keeps them ordered by expiry and lets one of two countdown workers
 * report each alarm up to its expiry. The worker is chosen by the parity of the expiry second.
 * <p>
 * The queue, the mailboxes, the dispatcher and both workers are created once per service and shared only through
 * the queue and the mailboxes. No component ever holds two locks at once.
 * </p>
 */
@Slf4j
public class AlarmCountdownService implements AutoCloseable {

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(1);

    @Getter private final IAlarmQueue alarmQueue;
    private final Map<RoutingClass, IWorkerMailbox> mailboxes = new EnumMap<>(RoutingClass.class);
    @Getter private final Submitter submitter;
    @Getter private final Dispatcher dispatcher;
    private final Map<RoutingClass, CountdownWorker> workers = new EnumMap<>(RoutingClass.class);
    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;
    private final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean startFlag = new AtomicBoolean(false);

    /**
     * Construct the service on the system UTC clock
     * @param config intervals of the dispatcher and the workers
     * @param reporter alarm event sink
     */
    public AlarmCountdownService(@NonNull ICountdownConfig config, @NonNull IAlarmReporter reporter) {
        this(config, reporter, Clock.systemUTC(), null);
    }

    /**
     * Construct the service
     * @param config intervals of the dispatcher and the workers
     * @param reporter alarm event sink
     * @param clock source of the current instant
     * @param uncaughtExceptionHandler handler of the unexpected death of a background thread, logs the cause if null
     */
    public AlarmCountdownService(
            @NonNull  ICountdownConfig config,
            @NonNull  IAlarmReporter reporter,
            @NonNull  Clock clock,
            @Nullable Thread.UncaughtExceptionHandler uncaughtExceptionHandler
    ) {
        ICountdownConfig countdownConfig = Objects.requireNonNull(config, "AlarmCountdownService::new - config is null").immutable();
        Objects.requireNonNull(reporter, "AlarmCountdownService::new - reporter is null");
        Objects.requireNonNull(clock, "AlarmCountdownService::new - clock is null");
        this.uncaughtExceptionHandler = Optional.ofNullable(uncaughtExceptionHandler).orElse(AlarmCountdownService::logUncaught);
        this.alarmQueue = new AlarmQueue();
        for (RoutingClass routingClass : RoutingClass.values()) {
            IWorkerMailbox mailbox = new WorkerMailbox(routingClass);
            this.mailboxes.put(routingClass, mailbox);
            this.workers.put(routingClass, new CountdownWorker(routingClass, mailbox, reporter, clock, countdownConfig.getReportInterval()));
        }
        this.submitter = new Submitter(this.alarmQueue, reporter, clock);
        this.dispatcher = new Dispatcher(this.alarmQueue, this.mailboxes, reporter, clock, countdownConfig.getPollInterval());
    }

    /**
     * Start the dispatcher and both workers on background daemon threads
     */
    public void start() {
        if (!startFlag.compareAndSet(false, true)) {
            throw new IllegalStateException("AlarmCountdownService already started");
        }
        startThread("alarm-dispatcher", dispatcher);
        workers.values().forEach(worker -> startThread("countdown-worker-" + worker.getRoutingClass().getWorkerNumber(), worker));
        logger.info("AlarmCountdownService is started");
    }

    /**
     * Register the alarm
     * @param duration duration in seconds
     * @param message alarm message
     * @return registered alarm
     */
    public @NonNull AlarmRequest submit(int duration, @NonNull String message) {
        return submitter.submit(duration, message);
    }

    /**
     * Feed the service from the source on the calling thread until the source is exhausted
     * @param source source of the alarm commands
     * @return number of registered alarms
     */
    public long process(@NonNull IRequestSource source) {
        return submitter.submitAll(source);
    }

    /**
     * Mailbox of the worker serving the class
     * @param routingClass routing class
     * @return worker mailbox
     */
    public @NonNull IWorkerMailbox getMailbox(@NonNull RoutingClass routingClass) {
        return mailboxes.get(Objects.requireNonNull(routingClass, "AlarmCountdownService::getMailbox - routingClass is null"));
    }

    /**
     * Stop the background threads. Alarms still pending or counted down are abandoned.
     */
    @Override
    public void close() {
        List<Thread> started;
        synchronized (threads) {
            started = new ArrayList<>(threads);
            threads.clear();
        }
        started.forEach(Thread::interrupt);
        for (Thread thread : started) {
            try {
                thread.join(JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException itrex) {
                logger.warn("AlarmCountdownService::close is interrupted while joining {}", thread.getName());
                Thread.currentThread().interrupt();
                return;
            }
        }
        logger.info("AlarmCountdownService is stopped");
    }

    private void startThread(String name, Runnable runnable) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
        threads.add(thread);
        thread.start();
    }

    private static void logUncaught(Thread thread, Throwable throwable) {
        logger.error("Thread {} is terminated by unexpected cause", thread.getName(), throwable);
    }

}
