/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A sink that only logs. The default when no delivery is wired up.
 */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String userId, NotificationType type, Notification payload) {
        log.info("{} for: {} proposal: {} band: {} - {}", type, userId, payload.proposalId(), payload.bandId(),
                 payload.message());
    }
}
