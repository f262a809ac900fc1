/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * A vote was attempted on a proposal that is no longer open, or whose voting period has ended
 */
public class VotingClosedException extends GovernanceException {

    private static final long serialVersionUID = 1L;
    private final String      proposalId;

    public VotingClosedException(String proposalId, String message) {
        super(message);
        this.proposalId = proposalId;
    }

    public String proposalId() {
        return proposalId;
    }
}
