/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.queue.RoutingClass;
import edu.umd.cs.findbugs.annotations.NonNull;

import java.time.Instant;

/**
 * Sink of the alarm status events. Every call is fire-and-forget, the instant is the moment of the event.
 */
public interface IAlarmReporter {

    /**
     * The submitter has accepted the alarm
     * @param instant moment of the event
     * @param request accepted alarm
     */
    void received(@NonNull Instant instant, @NonNull AlarmRequest request);

    /**
     * The dispatcher has passed the alarm to the worker mailbox
     * @param instant moment of the event
     * @param routingClass class of the destination worker
     * @param request routed alarm
     */
    void routed(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request);

    /**
     * The worker has taken the alarm from its mailbox
     * @param instant moment of the event
     * @param routingClass class of the worker
     * @param request alarm with its expiry instant
     */
    void workerReceived(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request);

    /**
     * Periodical countdown report
     * @param instant moment of the event
     * @param routingClass class of the worker
     * @param secondsLeft seconds left up to the expiry
     * @param request alarm being counted down
     */
    void countdownTick(@NonNull Instant instant, @NonNull RoutingClass routingClass, long secondsLeft, @NonNull AlarmRequest request);

    /**
     * The alarm has expired, the worker releases it
     * @param instant moment of the event
     * @param routingClass class of the worker
     * @param request expired alarm
     */
    void expired(@NonNull Instant instant, @NonNull RoutingClass routingClass, @NonNull AlarmRequest request);

}
