/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;

import lombok.Getter;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Pending countdown: the requested duration, a short message and the absolute moment of expiry.
 * The expiry instant is fixed at creation and never changes afterwards.
 */
public final class AlarmRequest {

    /**
     * Maximal size of the alarm message in UTF-8 bytes
     */
    public static final int MAX_MESSAGE_BYTES = 63;

    @Getter private final int duration;
    @Getter @Nonnull private final String message;
    @Getter @Nonnull private final Instant expiryInstant;

    /**
     * Alarm with the explicitly defined expiry instant
     * @param duration requested duration in seconds, has to be positive
     * @param message alarm message, not longer than {@link #MAX_MESSAGE_BYTES} UTF-8 bytes
     * @param expiryInstant moment of the alarm expiry
     */
    public AlarmRequest(int duration, @Nonnull String message, @Nonnull Instant expiryInstant) {
        this.duration = checkDuration(duration);
        this.message = checkMessage(message);
        this.expiryInstant = Objects.requireNonNull(expiryInstant, "AlarmRequest::new - expiryInstant is null");
    }

    /**
     * Alarm submitted at the defined moment. Expiry is counted in whole seconds from the submission second.
     * @param duration requested duration in seconds
     * @param message alarm message
     * @param submissionInstant moment of submission
     * @return alarm expiring duration seconds after the submission second
     */
    public static AlarmRequest submitted(int duration, @Nonnull String message, @Nonnull Instant submissionInstant) {
        Objects.requireNonNull(submissionInstant, "AlarmRequest::submitted - submissionInstant is null");
        return new AlarmRequest(
                duration, message,
                submissionInstant.truncatedTo(ChronoUnit.SECONDS).plusSeconds(checkDuration(duration))
        );
    }

    /**
     * Routing class of the alarm
     * @return class defined by the parity of the expiry second
     */
    public @Nonnull RoutingClass getRoutingClass() {
        return RoutingClass.of(this.expiryInstant);
    }

    /**
     * Whole seconds left from the instant up to the expiry, a started second counts as a whole one
     * @param instant point in time to count from
     * @return seconds left, zero only if the alarm has expired
     */
    public long secondsLeft(@Nonnull Instant instant) {
        Duration remaining = remaining(instant);
        return remaining.getNano() > 0 ? remaining.getSeconds() + 1 : remaining.getSeconds();
    }

    /**
     * Time left from the instant up to the expiry
     * @param instant point in time to count from
     * @return time left, Duration.ZERO if the alarm has expired
     */
    public @Nonnull Duration remaining(@Nonnull Instant instant) {
        Duration remaining = Duration.between(instant, this.expiryInstant);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Alarm has expired at the instant
     * @param instant point in time at which the check is made
     * @return true if the expiry instant has come
     */
    public boolean isExpired(@Nonnull Instant instant) {
        return !instant.isBefore(this.expiryInstant);
    }

    @Override
    public String toString() {
        return this.expiryInstant.getEpochSecond() + "[\"" + this.message + "\"]";
    }

    private static int checkDuration(int duration) {
        if (duration <= 0) {
            throw new IllegalArgumentException("AlarmRequest::new - duration has to be positive: " + duration);
        }
        return duration;
    }

    /**
     * Size of the message in UTF-8 bytes
     * @param message alarm message
     * @return number of bytes
     */
    public static int messageBytes(@Nonnull String message) {
        return Objects.requireNonNull(message, "AlarmRequest::messageBytes - message is null").getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Cut the message to {@link #MAX_MESSAGE_BYTES} UTF-8 bytes. A character is never split.
     * @param message alarm message of any size
     * @return the message itself if it fits, otherwise its longest fitting prefix
     */
    public static @Nonnull String truncateMessage(@Nonnull String message) {
        if (messageBytes(message) <= MAX_MESSAGE_BYTES) {
            return message;
        }
        StringBuilder result = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < message.length(); ) {
            int codePoint = message.codePointAt(i);
            int size = utf8Size(codePoint);
            if (bytes + size > MAX_MESSAGE_BYTES) {
                break;
            }
            result.appendCodePoint(codePoint);
            bytes += size;
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }

    private static int utf8Size(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    private static String checkMessage(String message) {
        Objects.requireNonNull(message, "AlarmRequest::new - message is null");
        if (messageBytes(message) > MAX_MESSAGE_BYTES) {
            throw new IllegalArgumentException("AlarmRequest::new - message is longer than " + MAX_MESSAGE_BYTES + " bytes");
        }
        return message;
    }

}
