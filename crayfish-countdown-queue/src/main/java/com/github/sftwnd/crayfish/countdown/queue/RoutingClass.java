/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import lombok.Getter;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * Routing category of an alarm. Alarms with an odd expiry second go to the worker of class A,
 * with an even one to the worker of class B.
 */
public enum RoutingClass {

    A(1),
    B(2);

    /**
     * Number of the display worker serving the class
     */
    @Getter private final int workerNumber;

    RoutingClass(int workerNumber) {
        this.workerNumber = workerNumber;
    }

    /**
     * Classify the expiry instant
     * @param expiryInstant alarm expiry instant
     * @return A for an odd epoch second, B for an even one
     */
    public static @Nonnull RoutingClass of(@Nonnull Instant expiryInstant) {
        Objects.requireNonNull(expiryInstant, "RoutingClass::of - expiryInstant is null");
        return Math.floorMod(expiryInstant.getEpochSecond(), 2L) == 1L ? A : B;
    }

}
