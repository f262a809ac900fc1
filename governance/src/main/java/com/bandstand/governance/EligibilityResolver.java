/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.directory.BandConfig;
import com.bandstand.governance.directory.Member;
import com.bandstand.governance.directory.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.bandstand.governance.directory.Role.*;

/**
 * The single owner of the role to capability policy. Every check takes the band configuration and the member
 * explicitly and requires the member to be ACTIVE; a null member is never eligible.
 * <p>
 * Creation is a union of the platform creator roles and the band's <code>whoCanCreateProposals</code>: a band may
 * widen the default, never narrow it. Closing is hard coded to the proposal's creator and the FOUNDER and GOVERNOR
 * roles and does not consult the band's <code>whoCanApprove</code> roles, which other approval paths do use.
 */
public final class EligibilityResolver {

    /** Roles that may close any proposal of their band */
    public static final Set<Role> CLOSER_ROLES  = Collections.unmodifiableSet(EnumSet.of(FOUNDER, GOVERNOR));
    /** Roles that may always create proposals */
    public static final Set<Role> CREATOR_ROLES = Collections.unmodifiableSet(
    EnumSet.of(FOUNDER, GOVERNOR, MODERATOR, CONDUCTOR));
    /** Roles that may vote. Observers never vote. */
    public static final Set<Role> VOTER_ROLES   = Collections.unmodifiableSet(
    EnumSet.of(FOUNDER, GOVERNOR, MODERATOR, CONDUCTOR, VOTING_MEMBER));

    private EligibilityResolver() {
    }

    public static boolean canClose(Proposal proposal, Member member) {
        if (member == null || !member.isActive() || !member.bandId().equals(proposal.bandId())) {
            return false;
        }
        return member.userId().equals(proposal.createdById()) || CLOSER_ROLES.contains(member.role());
    }

    public static boolean canCreate(BandConfig band, Member member) {
        if (!activeIn(band, member)) {
            return false;
        }
        return CREATOR_ROLES.contains(member.role()) || band.whoCanCreateProposals().contains(member.role());
    }

    public static boolean canVote(BandConfig band, Member member) {
        return activeIn(band, member) && VOTER_ROLES.contains(member.role());
    }

    private static boolean activeIn(BandConfig band, Member member) {
        return member != null && member.isActive() && member.bandId().equals(band.bandId());
    }
}
