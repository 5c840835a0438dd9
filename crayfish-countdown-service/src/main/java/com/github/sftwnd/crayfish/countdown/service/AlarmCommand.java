/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import com.github.sftwnd.crayfish.countdown.queue.AlarmRequest;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Parsed alarm request: duration in seconds and the message
 */
@ToString
@EqualsAndHashCode
public final class AlarmCommand {

    @Getter private final int duration;
    @Getter @NonNull private final String message;

    public AlarmCommand(int duration, @NonNull String message) {
        if (duration <= 0) {
            throw new IllegalArgumentException("AlarmCommand::new - duration has to be positive: " + duration);
        }
        Objects.requireNonNull(message, "AlarmCommand::new - message is null");
        if (AlarmRequest.messageBytes(message) > AlarmRequest.MAX_MESSAGE_BYTES) {
            throw new IllegalArgumentException("AlarmCommand::new - message is longer than " + AlarmRequest.MAX_MESSAGE_BYTES + " bytes");
        }
        this.duration = duration;
        this.message = message;
    }

    /**
     * Alarm for the command submitted at the instant
     * @param submissionInstant moment of submission
     * @return new alarm request
     */
    public @NonNull AlarmRequest toAlarmRequest(@NonNull Instant submissionInstant) {
        return AlarmRequest.submitted(this.duration, this.message, submissionInstant);
    }

}
