/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.notification;

import com.bandstand.governance.GovernanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Best effort delivery of one notification to many recipients. Each recipient gets exactly one attempt; a failure
 * is logged and counted, and never prevents delivery to the remaining recipients or propagates to the caller. No
 * ordering across recipients is implied.
 */
public class NotificationFanout {
    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final GovernanceMetrics metrics;
    private final NotificationSink  sink;

    public NotificationFanout(NotificationSink sink, GovernanceMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
    }

    /**
     * @return the number of recipients the sink accepted
     */
    public int fanout(Collection<String> recipients, NotificationType type, Notification payload) {
        int delivered = 0;
        for (var userId : recipients) {
            try {
                sink.notify(userId, type, payload);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Unable to deliver: {} to: {} for proposal: {}", type, userId, payload.proposalId(), e);
                if (metrics != null) {
                    metrics.notificationFailed();
                }
            }
        }
        if (metrics != null) {
            metrics.notificationsSent(delivered);
        }
        log.debug("Delivered: {} of: {} {} notifications for proposal: {}", delivered, recipients.size(), type,
                  payload.proposalId());
        return delivered;
    }
}
