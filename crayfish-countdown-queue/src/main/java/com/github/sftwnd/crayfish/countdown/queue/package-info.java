/**
 * This package implements the shared alarm structures
 * <p>
 * Pending alarms are kept in a time-ordered queue until the dispatcher removes the earliest one and hands it over to
 * the mailbox of the countdown worker chosen by the parity of its expiry instant.
 * </p>
 *
 * @since 0.1.0
 * @author Andrey D. Shindarev
 * @version 0.1.0
 *
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.countdown.queue;
