/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import com.github.sftwnd.crayfish.countdown.service.AlarmCommand;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser of the console line {@code <seconds> <message>}.
 * <p>
 * Blank lines are skipped silently. The message is the rest of the line after the whitespace following the number,
 * it is cut to {@link AlarmRequest#MAX_MESSAGE_BYTES} UTF-8 bytes. Any other line is a bad command: it is logged
 * and never reaches the service.
 * </p>
 */
@Slf4j
public class AlarmCommandParser {

    private static final Pattern COMMAND_PATTERN = Pattern.compile("^\\s*([+-]?\\d+)\\s+(\\S.*)$");

    /**
     * Parse the line
     * @param line console line without the line terminator
     * @return the command or empty for a blank or malformed line
     */
    public @NonNull Optional<AlarmCommand> parse(@Nullable String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = COMMAND_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return badCommand(line);
        }
        int duration;
        try {
            duration = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException nfex) {
            return badCommand(line);
        }
        if (duration <= 0) {
            return badCommand(line);
        }
        return Optional.of(new AlarmCommand(duration, AlarmRequest.truncateMessage(matcher.group(2))));
    }

    private static Optional<AlarmCommand> badCommand(String line) {
        logger.warn("Bad command: {}", line);
        return Optional.empty();
    }

}
