/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

/**
 * Stored governance configuration that the engine cannot act on, such as an unknown voting method. Should not occur
 * when configuration is validated on write.
 */
public class InvalidConfigurationException extends GovernanceException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
