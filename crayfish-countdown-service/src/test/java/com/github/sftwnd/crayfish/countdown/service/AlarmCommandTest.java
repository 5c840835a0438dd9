package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AlarmCommandTest {

    @Test
    void toAlarmRequestTest() {
        AlarmCommand command = new AlarmCommand(7, "tea");
        AlarmRequest request = command.toAlarmRequest(Instant.ofEpochSecond(100, 400_000_000));
        assertEquals(7, request.getDuration(), "duration has to be taken from the command");
        assertEquals("tea", request.getMessage(), "message has to be taken from the command");
        assertEquals(Instant.ofEpochSecond(107), request.getExpiryInstant(), "expiry has to be counted from the submission second");
    }

    @Test
    void equalsTest() {
        assertEquals(new AlarmCommand(3, "x"), new AlarmCommand(3, "x"), "commands with the same content have to be equal");
    }

    @Test
    @SuppressWarnings("ConstantConditions")
    void validationTest() {
        assertThrows(IllegalArgumentException.class, () -> new AlarmCommand(0, "x"), "zero duration has to be rejected");
        assertThrows(IllegalArgumentException.class, () -> new AlarmCommand(-1, "x"), "negative duration has to be rejected");
        assertThrows(NullPointerException.class, () -> new AlarmCommand(1, null), "null message has to throw NPE");
        assertThrows(IllegalArgumentException.class, () -> new AlarmCommand(1, "x".repeat(AlarmRequest.MAX_MESSAGE_BYTES + 1)), "too long message has to be rejected");
        assertThrows(IllegalArgumentException.class, () -> new AlarmCommand(1, "\u00e9".repeat(32)), "message over the byte limit has to be rejected");
    }

}
