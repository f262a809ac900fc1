/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import static com.codahale.metrics.MetricRegistry.name;

public class GovernanceMetricsImpl implements GovernanceMetrics {

    private final Meter          approved;
    private final Timer          closeLatency;
    private final Counter        invalidConfiguration;
    private final Meter          notificationFailed;
    private final Meter          notificationsSent;
    private final Meter          proposalCreated;
    private final MetricRegistry registry;
    private final String         prefix;
    private final Meter          rejected;
    private final Meter          voteCast;
    private final Meter          voteUpdated;

    public GovernanceMetricsImpl(MetricRegistry registry) {
        this("governance", registry);
    }

    public GovernanceMetricsImpl(String prefix, MetricRegistry registry) {
        this.registry = registry;
        this.prefix = prefix;
        approved = registry.meter(name(prefix, "proposals.approved"));
        rejected = registry.meter(name(prefix, "proposals.rejected"));
        proposalCreated = registry.meter(name(prefix, "proposals.created"));
        closeLatency = registry.timer(name(prefix, "proposals.close.latency"));
        voteCast = registry.meter(name(prefix, "votes.cast"));
        voteUpdated = registry.meter(name(prefix, "votes.updated"));
        notificationsSent = registry.meter(name(prefix, "notifications.sent"));
        notificationFailed = registry.meter(name(prefix, "notifications.failed"));
        invalidConfiguration = registry.counter(name(prefix, "configuration.invalid"));
    }

    @Override
    public Timer closeLatency() {
        return closeLatency;
    }

    @Override
    public void invalidConfiguration() {
        invalidConfiguration.inc();
    }

    @Override
    public void notificationFailed() {
        notificationFailed.mark();
    }

    @Override
    public void notificationsSent(int count) {
        notificationsSent.mark(count);
    }

    @Override
    public void proposalClosed(Outcome outcome) {
        switch (outcome) {
        case APPROVED -> approved.mark();
        case REJECTED -> rejected.mark();
        }
    }

    @Override
    public void proposalCreated() {
        proposalCreated.mark();
    }

    @Override
    public void rejected(GovernanceException failure) {
        registry.meter(name(prefix, "failures", failure.getClass().getSimpleName())).mark();
    }

    @Override
    public void voteCast(boolean created) {
        if (created) {
            voteCast.mark();
        } else {
            voteUpdated.mark();
        }
    }
}
