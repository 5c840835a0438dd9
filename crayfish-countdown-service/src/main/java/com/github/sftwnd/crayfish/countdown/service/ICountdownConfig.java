/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import javax.annotation.Nonnull;
import java.time.Duration;

public interface ICountdownConfig {

    /**
     * Pause of the dispatcher on the empty alarm queue.
     * Bounds the latency between a submission and its pickup.
     * @return dispatcher poll interval
     */
    @Nonnull Duration getPollInterval();

    /**
     * Pause of a worker between two countdown reports
     * @return worker report interval
     */
    @Nonnull Duration getReportInterval();

    default @Nonnull ICountdownConfig immutable() {
        return ImmutableCountdownConfig.fromConfig(this);
    }

}
