/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.annotation.Nonnull;
import java.time.Duration;

import static java.util.Optional.ofNullable;

@NoArgsConstructor
@AllArgsConstructor
public class CountdownConfig implements ICountdownConfig {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofSeconds(2);

    // Dispatcher sleeps only on the empty queue
    @Setter private Duration pollInterval;
    // Coarse ticker of the worker, the countdown may drift up to this value
    @Setter private Duration reportInterval;

    @Override public @Nonnull Duration getPollInterval() { return ofNullable(pollInterval).orElse(DEFAULT_POLL_INTERVAL); }
    @Override public @Nonnull Duration getReportInterval() { return ofNullable(reportInterval).orElse(DEFAULT_REPORT_INTERVAL); }

}
