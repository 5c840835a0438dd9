/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.service;

import edu.umd.cs.findbugs.annotations.NonNull;

import java.util.Optional;

/**
 * Source of the validated alarm commands. Malformed input never leaves the source.
 */
@FunctionalInterface
public interface IRequestSource {

    /**
     * Wait for the next valid command
     * @return the next command or Optional.empty() when the source is exhausted
     */
    @NonNull Optional<AlarmCommand> nextCommand();

}
