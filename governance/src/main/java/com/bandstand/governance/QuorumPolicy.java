/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.Governance.Participation;
import com.bandstand.governance.ResolutionEngine.Resolution;

/**
 * An optional minimum participation rule layered over threshold resolution. Not applied by default: quorum is
 * reported on close, but only gates the outcome when the engine is configured with {@link #bandQuorum()}.
 */
@FunctionalInterface
public interface QuorumPolicy {

    /** Participation never affects the outcome */
    QuorumPolicy NONE = participation -> true;

    /**
     * Require the band's configured quorum percentage
     */
    static QuorumPolicy bandQuorum() {
        return Participation::quorumMet;
    }

    /**
     * Answer the resolution after applying this policy. An approval without quorum becomes a rejection; a
     * rejection is never turned into an approval.
     */
    default Resolution apply(Resolution resolution, Participation participation) {
        if (resolution.outcome() == Outcome.REJECTED || isSatisfied(participation)) {
            return resolution;
        }
        return Resolution.rejected(
        String.format("Quorum not met: %s of %s eligible voters participated (%.0f%%), needed %s%%",
                      participation.totalVoters(), participation.eligibleVoters(),
                      participation.participationPercentage(), participation.quorumPercentage()));
    }

    boolean isSatisfied(Participation participation);
}
