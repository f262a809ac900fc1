/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * A close was attempted on a proposal that has already been resolved
 */
public class AlreadyClosedException extends GovernanceException {

    private static final long    serialVersionUID = 1L;
    private final String         proposalId;
    private final ProposalStatus status;

    public AlreadyClosedException(String proposalId, ProposalStatus status) {
        super(String.format("Proposal is already closed: %s status: %s", proposalId, status));
        this.proposalId = proposalId;
        this.status = status;
    }

    public String proposalId() {
        return proposalId;
    }

    public ProposalStatus status() {
        return status;
    }
}
