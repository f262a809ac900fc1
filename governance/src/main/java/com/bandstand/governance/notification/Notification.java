/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.notification;

import com.bandstand.governance.Priority;

/**
 * The payload of a governance notification
 */
public record Notification(String title, String message, String bandId, String proposalId, Priority priority) {
}
