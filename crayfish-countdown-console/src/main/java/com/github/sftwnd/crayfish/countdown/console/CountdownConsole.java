/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.service.AlarmCountdownService;
import com.typesafe.config.ConfigFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Interactive alarm console: every {@code <seconds> <message>} line read from the standard input becomes an alarm.
 * The end of the input terminates the console, alarms still counting down are abandoned.
 */
@Slf4j
public class CountdownConsole {

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(CountdownConsole::abort);
        CountdownConsoleConfiguration configuration = CountdownConsoleConfiguration.fromConfig(ConfigFactory.load());
        try (AlarmCountdownService service = new AlarmCountdownService(configuration, new LoggingAlarmReporter(), Clock.systemUTC(), CountdownConsole::abort)) {
            service.start();
            long submitted = service.process(new ConsoleRequestSource(
                    new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out, configuration.getPrompt()));
            logger.info("End of input, {} alarm(s) submitted", submitted);
        }
    }

    // The shared queue and mailboxes can't be trusted after an unexpected failure
    private static void abort(Thread thread, Throwable throwable) {
        logger.error("Thread {} is terminated by unexpected cause, the console is aborted", thread.getName(), throwable);
        System.exit(1);
    }

}
