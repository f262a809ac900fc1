/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import java.time.Instant;
import java.util.Objects;

/**
 * A proposal as stored. <code>votingEndsAt</code> is fixed when the proposal is created and never recomputed.
 *
 * @param closedAt null until the proposal is resolved
 */
public record Proposal(String id, String bandId, String createdById, ProposalDraft content, Instant createdAt,
                       Instant votingEndsAt, ProposalStatus status, Instant closedAt) {

    public Proposal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bandId, "bandId");
        Objects.requireNonNull(createdById, "createdById");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(votingEndsAt, "votingEndsAt");
        Objects.requireNonNull(status, "status");
    }

    public String title() {
        return content.title();
    }

    public ProposalType type() {
        return content.type();
    }

    public Priority priority() {
        return content.priority();
    }

    /**
     * Answer true if the voting window has elapsed. Derived for display only: an expired proposal stays
     * {@link ProposalStatus#OPEN} until it is explicitly closed.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(votingEndsAt);
    }

    /**
     * Answer true if a vote cast at <code>now</code> would be accepted
     */
    public boolean isOpenForVoting(Instant now) {
        return status == ProposalStatus.OPEN && now.isBefore(votingEndsAt);
    }

    @Override
    public String toString() {
        return "Proposal[" + id + " band: " + bandId + " status: " + status + " ends: " + votingEndsAt + "]";
    }
}
