/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

/**
 * A member's role within a band
 */
public enum Role {
    FOUNDER, GOVERNOR, MODERATOR, CONDUCTOR, VOTING_MEMBER, OBSERVER;
}
