/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * The resolved result of a closed proposal
 */
public enum Outcome {
    APPROVED, REJECTED;

    public ProposalStatus status() {
        return switch (this) {
            case APPROVED -> ProposalStatus.APPROVED;
            case REJECTED -> ProposalStatus.REJECTED;
        };
    }
}
