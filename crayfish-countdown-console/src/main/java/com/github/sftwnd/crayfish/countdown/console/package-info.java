/**
 * Interactive console over the alarm countdown service
 * <p>
 * Reads {@code <seconds> <message>} lines from the standard input and logs every alarm event.
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
package com.github.sftwnd.crayfish.countdown.console;
