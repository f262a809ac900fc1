/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import java.util.Arrays;
import java.util.Optional;

/**
 * The threshold algorithm a band resolves its proposals with. All methods are unweighted, one member one vote.
 */
public enum VotingMethod {
    /** More than half of the countable votes */
    SIMPLE_MAJORITY,
    /** At least 66% of the countable votes */
    SUPERMAJORITY_66,
    /** At least 75% of the countable votes */
    SUPERMAJORITY_75,
    /** At least one YES and no NO */
    UNANIMOUS;

    /**
     * Answer the voting method stored under the supplied name, or empty if the name is not a known method
     */
    public static Optional<VotingMethod> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(m -> m.name().equals(name)).findFirst();
    }
}
