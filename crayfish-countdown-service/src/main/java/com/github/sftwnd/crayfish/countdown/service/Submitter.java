/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.IAlarmQueue;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of the accepted alarm commands: computes the expiry instant and puts the alarm into the queue
 */
@Slf4j
public class Submitter {

    private final IAlarmQueue alarmQueue;
    private final IAlarmReporter reporter;
    private final Clock clock;

    public Submitter(@NonNull IAlarmQueue alarmQueue, @NonNull IAlarmReporter reporter, @NonNull Clock clock) {
        this.alarmQueue = Objects.requireNonNull(alarmQueue, "Submitter::new - alarmQueue is null");
        this.reporter = Objects.requireNonNull(reporter, "Submitter::new - reporter is null");
        this.clock = Objects.requireNonNull(clock, "Submitter::new - clock is null");
    }

    /**
     * Register the alarm expiring duration seconds after the current second
     * @param duration duration in seconds
     * @param message alarm message
     * @return registered alarm
     */
    public @NonNull AlarmRequest submit(int duration, @NonNull String message) {
        return submit(new AlarmCommand(duration, message));
    }

    /**
     * Register the alarm for the command
     * @param command parsed alarm command
     * @return registered alarm
     */
    public @NonNull AlarmRequest submit(@NonNull AlarmCommand command) {
        Objects.requireNonNull(command, "Submitter::submit - command is null");
        Instant now = clock.instant();
        AlarmRequest request = command.toAlarmRequest(now);
        alarmQueue.insert(request);
        reporter.received(now, request);
        if (logger.isDebugEnabled()) {
            logger.debug("[list: {}]", alarmQueue.snapshot().stream()
                    .map(alarm -> String.format("%d(%d)[\"%s\"]",
                            alarm.getExpiryInstant().getEpochSecond(), alarm.secondsLeft(now), alarm.getMessage()))
                    .collect(Collectors.joining(" ")));
        }
        return request;
    }

    /**
     * Register every command of the source on the calling thread until the source is exhausted
     * @param source source of the alarm commands
     * @return number of registered alarms
     */
    public long submitAll(@NonNull IRequestSource source) {
        Objects.requireNonNull(source, "Submitter::submitAll - source is null");
        long count = 0;
        for (Optional<AlarmCommand> command = source.nextCommand(); command.isPresent(); command = source.nextCommand()) {
            submit(command.get());
            count++;
        }
        logger.info("Request source is exhausted, {} alarm(s) submitted", count);
        return count;
    }

}
