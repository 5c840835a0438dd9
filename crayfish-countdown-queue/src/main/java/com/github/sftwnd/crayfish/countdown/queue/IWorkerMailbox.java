/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import javax.annotation.Nonnull;

/**
 * FIFO handoff of alarms from the dispatcher to a single countdown worker
 */
public interface IWorkerMailbox {

    /**
     * Enqueue the alarm and wake up the waiting worker. Never waits for the worker.
     * @param request routed alarm
     */
    void put(@Nonnull AlarmRequest request);

    /**
     * Wait until the mailbox is not empty and dequeue the oldest alarm
     * @return the oldest routed alarm
     * @throws InterruptedException if the waiting thread has been interrupted
     */
    @Nonnull AlarmRequest take() throws InterruptedException;

    /**
     * Number of alarms waiting for the worker
     * @return mailbox size
     */
    int size();

}
