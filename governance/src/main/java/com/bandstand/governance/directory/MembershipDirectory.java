/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import java.util.List;
import java.util.Optional;

/**
 * Read only view of band membership. The governance engine treats this as an oracle and never mutates it.
 */
public interface MembershipDirectory {

    /**
     * Answer the ACTIVE members of the band
     */
    List<Member> activeMembers(String bandId);

    /**
     * Answer the ACTIVE memberships of the user, across all bands
     */
    List<Member> activeMemberships(String userId);

    /**
     * Answer the membership of the user in the band, regardless of status
     */
    Optional<Member> getMember(String bandId, String userId);
}
