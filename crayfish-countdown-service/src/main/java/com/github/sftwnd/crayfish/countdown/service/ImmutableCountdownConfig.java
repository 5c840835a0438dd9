/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import lombok.Getter;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

final class ImmutableCountdownConfig implements ICountdownConfig {

    @Getter private final Duration pollInterval;
    @Getter private final Duration reportInterval;

    private ImmutableCountdownConfig(@Nonnull Duration pollInterval, @Nonnull Duration reportInterval) {
        this.pollInterval = positive(pollInterval, "pollInterval");
        this.reportInterval = positive(reportInterval, "reportInterval");
    }

    @Override
    public @Nonnull ICountdownConfig immutable() {
        return this;
    }

    static ICountdownConfig fromConfig(@Nonnull ICountdownConfig config) {
        return Objects.requireNonNull(config, "ImmutableCountdownConfig::new - config is null") instanceof ImmutableCountdownConfig ? config
             : new ImmutableCountdownConfig(config.getPollInterval(), config.getReportInterval());
    }

    private static Duration positive(Duration duration, String name) {
        Objects.requireNonNull(duration, "ImmutableCountdownConfig::new - " + name + " is null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("ImmutableCountdownConfig::new - " + name + " has to be positive: " + duration);
        }
        return duration;
    }

}
