/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.codahale.metrics.Timer;

/**
 * Operational metrics of the governance engine
 */
public interface GovernanceMetrics {

    Timer closeLatency();

    void invalidConfiguration();

    void notificationFailed();

    void notificationsSent(int count);

    void proposalClosed(Outcome outcome);

    void proposalCreated();

    void rejected(GovernanceException failure);

    void voteCast(boolean created);
}
