/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

public class NotFoundException extends GovernanceException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException band(String bandId) {
        return new NotFoundException(String.format("Band not found: %s", bandId));
    }

    public static NotFoundException proposal(String proposalId) {
        return new NotFoundException(String.format("Proposal not found: %s", proposalId));
    }
}
