/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import java.util.Objects;

/**
 * A user's role carrying association with a single band
 */
public record Member(String bandId, String userId, Role role, MemberStatus status) {

    public Member {
        Objects.requireNonNull(bandId, "bandId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(status, "status");
    }

    public boolean isActive() {
        return status.isActive();
    }

    @Override
    public String toString() {
        return bandId + ":" + userId + "[" + role + "/" + status + "]";
    }
}
