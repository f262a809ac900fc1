/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.directory.BandConfig;
import com.bandstand.governance.directory.JdbcDirectory;
import com.bandstand.governance.directory.Member;
import com.bandstand.governance.directory.MemberStatus;
import com.bandstand.governance.directory.Role;
import org.jooq.DSLContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Shared scaffolding for tests against a freshly migrated in-memory store
 */
public final class Fixtures {

    /**
     * A clock that only moves when told to
     */
    public static class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant start) {
            now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Instant instant() {
            return now;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    public static final Instant EPOCH = Instant.parse("2024-03-01T12:00:00Z");

    private Fixtures() {
    }

    public static Member active(String bandId, String userId, Role role) {
        return new Member(bandId, userId, role, MemberStatus.ACTIVE);
    }

    public static GovernanceDatabase database() {
        var configuration = new GovernanceConfiguration();
        configuration.jdbcUrl = String.format("jdbc:h2:mem:governance-%s;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
                                              UUID.randomUUID());
        return new GovernanceDatabase(configuration);
    }

    public static ProposalDraft draft(String title) {
        return ProposalDraft.newBuilder().setTitle(title).setDescription("Description of " + title).build();
    }

    public static void put(DSLContext dsl, BandConfig band, Member... members) {
        JdbcDirectory.put(dsl, band);
        for (var member : members) {
            JdbcDirectory.put(dsl, member);
        }
    }
}
