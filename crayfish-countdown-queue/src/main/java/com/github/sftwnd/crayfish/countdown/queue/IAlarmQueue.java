/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Pending alarms ordered by the expiry instant
 */
public interface IAlarmQueue {

    /**
     * Put the alarm into the queue keeping the order by expiry instant.
     * Alarms with the same expiry instant stay in the order of insertion.
     * @param request alarm to register
     */
    void insert(@Nonnull AlarmRequest request);

    /**
     * Remove the earliest alarm from the queue
     * @return the earliest alarm or Optional.empty() for the empty queue
     */
    @Nonnull Optional<AlarmRequest> takeEarliest();

    /**
     * Copy of the pending alarms in the queue order
     * @return ordered list of alarms
     */
    @Nonnull List<AlarmRequest> snapshot();

    /**
     * Number of pending alarms
     * @return queue size
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

}
