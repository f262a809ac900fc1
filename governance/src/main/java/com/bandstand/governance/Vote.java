/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import java.time.Instant;

/**
 * The single vote of a member on a proposal
 */
public record Vote(String proposalId, String userId, VoteChoice choice, String comment, Instant createdAt,
                   Instant updatedAt) {
}
