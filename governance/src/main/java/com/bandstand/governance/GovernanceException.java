/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * The root of the governance domain failures. These are recoverable at the request boundary and carry a message
 * suitable for the user. Failures of the store itself are not governance exceptions; they surface as
 * {@link org.jooq.exception.DataAccessException}.
 */
public abstract class GovernanceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
