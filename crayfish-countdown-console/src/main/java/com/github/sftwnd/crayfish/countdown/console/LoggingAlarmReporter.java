/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import com.github.sftwnd.crayfish.countdown.service.IAlarmReporter;
import edu.umd.cs.findbugs.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Writes every alarm event as an INFO line. Instants are rendered as seconds since the epoch, the worker is named
 * by the display number of its routing class.
 */
public class LoggingAlarmReporter implements IAlarmReporter {

    private final Logger logger;

    public LoggingAlarmReporter() {
        this(LoggerFactory.getLogger(LoggingAlarmReporter.class));
    }

    LoggingAlarmReporter(@NonNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "LoggingAlarmReporter::new - logger is null");
    }

    @Override
    public void received(@NonNull Instant instant, @NonNull AlarmRequest request) {
        logger.info("Main Thread Received Alarm Request at {}: {} {}",
                instant.getEpochSecond(), request.getDuration(), request.getMessage());
    }

    @Override
    public void routed(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request) {
        logger.info("Alarm Thread Passed on Alarm Request to Display Thread {} at {}: {} {}",
                routingClass.getWorkerNumber(), instant.getEpochSecond(), request.getDuration(), request.getMessage());
    }

    @Override
    public void workerReceived(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request) {
        logger.info("Display Thread {}: Received Alarm Request at {}: {} {}, ExpiryTime is {}",
                routingClass.getWorkerNumber(), instant.getEpochSecond(), request.getDuration(), request.getMessage(),
                request.getExpiryInstant().getEpochSecond());
    }

    @Override
    public void countdownTick(@NonNull Instant instant, @NonNull RoutingClass routingClass, long secondsLeft, @NonNull AlarmRequest request) {
        logger.info("Display Thread {}: Number of Seconds Left {}: Time: {}: {} {}",
                routingClass.getWorkerNumber(), secondsLeft, instant.getEpochSecond(), request.getDuration(), request.getMessage());
    }

    @Override
    public void expired(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request) {
        logger.info("Display Thread {}: Alarm Expired at {}: {} {}",
                routingClass.getWorkerNumber(), instant.getEpochSecond(), request.getDuration(), request.getMessage());
    }

}
