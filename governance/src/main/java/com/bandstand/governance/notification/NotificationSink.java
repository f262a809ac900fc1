/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.notification;

/**
 * Delivery of notifications to users. Implementations own the delivery mechanics; the engine makes a single
 * attempt per recipient and treats any exception as a failed delivery to that recipient only.
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(String userId, NotificationType type, Notification payload);
}
