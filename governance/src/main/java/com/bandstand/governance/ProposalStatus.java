/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * Persisted proposal status. A proposal is created {@link #OPEN} and moves once, to {@link #APPROVED} or
 * {@link #REJECTED}. {@link #CLOSED} is a legacy terminal alias that is read but never written.
 */
public enum ProposalStatus {
    OPEN, CLOSED, APPROVED, REJECTED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
