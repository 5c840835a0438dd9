/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.service.AlarmCommand;
import com.github.sftwnd.crayfish.countdown.service.IRequestSource;
import edu.umd.cs.findbugs.annotations.NonNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Line by line source of the alarm commands. The prompt is printed before every read, lines that don't parse
 * are skipped, the end of the input exhausts the source.
 */
public class ConsoleRequestSource implements IRequestSource {

    private final BufferedReader reader;
    private final PrintStream promptStream;
    private final String prompt;
    private final AlarmCommandParser parser;

    public ConsoleRequestSource(@NonNull Reader reader, @NonNull PrintStream promptStream, @NonNull String prompt) {
        this(reader, promptStream, prompt, new AlarmCommandParser());
    }

    public ConsoleRequestSource(
            @NonNull Reader reader,
            @NonNull PrintStream promptStream,
            @NonNull String prompt,
            @NonNull AlarmCommandParser parser
    ) {
        Objects.requireNonNull(reader, "ConsoleRequestSource::new - reader is null");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.promptStream = Objects.requireNonNull(promptStream, "ConsoleRequestSource::new - promptStream is null");
        this.prompt = Objects.requireNonNull(prompt, "ConsoleRequestSource::new - prompt is null");
        this.parser = Objects.requireNonNull(parser, "ConsoleRequestSource::new - parser is null");
    }

    @Override
    public @NonNull Optional<AlarmCommand> nextCommand() {
        try {
            for (;;) {
                promptStream.print(prompt);
                promptStream.flush();
                String line = reader.readLine();
                if (line == null) {
                    return Optional.empty();
                }
                Optional<AlarmCommand> command = parser.parse(line);
                if (command.isPresent()) {
                    return command;
                }
            }
        } catch (IOException ioex) {
            throw new UncheckedIOException("ConsoleRequestSource::nextCommand - unable to read the command", ioex);
        }
    }

}
