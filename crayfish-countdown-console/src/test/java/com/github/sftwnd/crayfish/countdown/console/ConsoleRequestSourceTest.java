package com.github.sftwnd.crayfish.countdown.console;

import com.github.sftwnd.crayfish.countdown.service.AlarmCommand;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleRequestSourceTest {

    @Test
    void nextCommandTest() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ConsoleRequestSource source = new ConsoleRequestSource(
                new StringReader("5 a\n\nbad command\n3 b\n"),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                "alarm> ");
        assertEquals(Optional.of(new AlarmCommand(5, "a")), source.nextCommand(), "the first command has to be read");
        assertEquals(Optional.of(new AlarmCommand(3, "b")), source.nextCommand(), "blank and bad lines have to be skipped");
        assertTrue(source.nextCommand().isEmpty(), "end of input has to exhaust the source");
        assertEquals("alarm> ".repeat(5), output.toString(StandardCharsets.UTF_8), "prompt has to be printed before every read");
    }

    @Test
    void readFailureTest() {
        IOException failure = new IOException("closed");
        Reader reader = new Reader() {
            @Override public int read(char[] cbuf, int off, int len) throws IOException { throw failure; }
            @Override public void close() { }
        };
        ConsoleRequestSource source = new ConsoleRequestSource(reader, new PrintStream(new ByteArrayOutputStream()), "> ");
        UncheckedIOException exception = assertThrows(UncheckedIOException.class, source::nextCommand, "read failure has to be rethrown");
        assertSame(failure, exception.getCause(), "cause of the failure has to be kept");
    }

    @Test
    @SuppressWarnings("ConstantConditions")
    void nullArgumentsTest() {
        PrintStream printStream = new PrintStream(new ByteArrayOutputStream());
        StringReader reader = new StringReader("");
        assertThrows(NullPointerException.class, () -> new ConsoleRequestSource(null, printStream, "> "), "null reader has to throw NPE");
        assertThrows(NullPointerException.class, () -> new ConsoleRequestSource(reader, null, "> "), "null promptStream has to throw NPE");
        assertThrows(NullPointerException.class, () -> new ConsoleRequestSource(reader, printStream, null), "null prompt has to throw NPE");
    }

}
