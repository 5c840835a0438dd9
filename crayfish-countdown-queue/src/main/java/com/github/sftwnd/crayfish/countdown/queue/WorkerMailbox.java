/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import lombok.Getter;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Unbounded mailbox of a countdown worker.
 * The signal is tied to the queue state, so an alarm put while the worker is busy is found on its next take
 * and nothing put before the worker starts to wait is lost.
 */
public class WorkerMailbox implements IWorkerMailbox {

    @Getter @Nonnull private final RoutingClass routingClass;
    private final ArrayDeque<AlarmRequest> requests = new ArrayDeque<>();

    public WorkerMailbox(@Nonnull RoutingClass routingClass) {
        this.routingClass = Objects.requireNonNull(routingClass, "WorkerMailbox::new - routingClass is null");
    }

    @Override
    public void put(@Nonnull AlarmRequest request) {
        Objects.requireNonNull(request, "WorkerMailbox::put - request is null");
        synchronized (this.requests) {
            this.requests.addLast(request);
            this.requests.notifyAll();
        }
    }

    @Override
    public @Nonnull AlarmRequest take() throws InterruptedException {
        synchronized (this.requests) {
            while (this.requests.isEmpty()) {
                this.requests.wait();
            }
            return this.requests.pollFirst();
        }
    }

    @Override
    public int size() {
        synchronized (this.requests) {
            return this.requests.size();
        }
    }

}
