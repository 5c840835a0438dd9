/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-ordered queue of pending alarms shared by the submitter and the dispatcher.
 * Every access goes through the monitor of the internal list, no operation blocks longer than its own scan.
 */
public class AlarmQueue implements IAlarmQueue {

    // Sorted ascending by expiryInstant, equal instants in insertion order
    // LinkedList is used for the splice in the middle of the sequence
    private final LinkedList<AlarmRequest> alarms = new LinkedList<>();

    /**
     * Walks the sequence up to the first alarm expiring strictly later than the new one and splices the new alarm
     * before it. If there is no such alarm the new one is appended.
     * @param request alarm to register
     */
    @Override
    public void insert(@Nonnull AlarmRequest request) {
        Objects.requireNonNull(request, "AlarmQueue::insert - request is null");
        synchronized (this.alarms) {
            ListIterator<AlarmRequest> iterator = this.alarms.listIterator();
            while (iterator.hasNext()) {
                if (iterator.next().getExpiryInstant().isAfter(request.getExpiryInstant())) {
                    iterator.previous();
                    break;
                }
            }
            iterator.add(request);
        }
    }

    @Override
    public @Nonnull Optional<AlarmRequest> takeEarliest() {
        synchronized (this.alarms) {
            return Optional.ofNullable(this.alarms.pollFirst());
        }
    }

    @Override
    public @Nonnull List<AlarmRequest> snapshot() {
        synchronized (this.alarms) {
            return new ArrayList<>(this.alarms);
        }
    }

    @Override
    public int size() {
        synchronized (this.alarms) {
            return this.alarms.size();
        }
    }

    @Override
    public String toString() {
        return "[list: " + snapshot() + "]";
    }

}
