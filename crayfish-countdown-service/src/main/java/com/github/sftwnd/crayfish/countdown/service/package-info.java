/**
 * This package implements the alarm countdown service
 * <p>
 * The submitter registers alarms in the time-ordered queue, the dispatcher routes the earliest one to the mailbox of
 * the countdown worker selected by the parity of the expiry instant, and the worker reports the countdown up to the
 * expiry.
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
package com.github.sftwnd.crayfish.countdown.service;
