/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.service.CountdownConfig;
import com.typesafe.config.Config;
import lombok.Setter;

import javax.annotation.Nonnull;
import java.util.Objects;

import static java.util.Optional.ofNullable;

/**
 * Countdown configuration of the console with the prompt of the input line
 */
public class CountdownConsoleConfiguration extends CountdownConfig {

    public static final String CONFIG_PATH = "crayfish.countdown";
    public static final String DEFAULT_PROMPT = "alarm> ";

    @Setter private String prompt;

    public @Nonnull String getPrompt() { return ofNullable(prompt).orElse(DEFAULT_PROMPT); }

    /**
     * Read the {@code crayfish.countdown} section. Absent keys keep their defaults.
     * @param config loaded configuration, usually {@code ConfigFactory.load()}
     * @return console configuration
     */
    public static @Nonnull CountdownConsoleConfiguration fromConfig(@Nonnull Config config) {
        Objects.requireNonNull(config, "CountdownConsoleConfiguration::fromConfig - config is null");
        CountdownConsoleConfiguration configuration = new CountdownConsoleConfiguration();
        if (config.hasPath(CONFIG_PATH)) {
            Config section = config.getConfig(CONFIG_PATH);
            if (section.hasPath("poll-interval")) configuration.setPollInterval(section.getDuration("poll-interval"));
            if (section.hasPath("report-interval")) configuration.setReportInterval(section.getDuration("report-interval"));
            if (section.hasPath("prompt")) configuration.setPrompt(section.getString("prompt"));
        }
        return configuration;
    }

}
