/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

/**
 * Membership status. Only {@link #ACTIVE} members take part in governance.
 */
public enum MemberStatus {
    ACTIVE, PENDING, INVITED, REJECTED, SUSPENDED, LEFT;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
