/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.Governance.Participation;
import com.bandstand.governance.ResolutionEngine.Resolution;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuorumPolicyTest {

    @Test
    public void bandQuorum() {
        var policy = QuorumPolicy.bandQuorum();
        var thin = Participation.of(50, 1, 50);
        assertFalse(thin.quorumMet());
        assertEquals(2.0, thin.participationPercentage());

        var resolution = policy.apply(Resolution.APPROVED, thin);
        assertEquals(Outcome.REJECTED, resolution.outcome());
        assertEquals("Quorum not met: 1 of 50 eligible voters participated (2%), needed 50%", resolution.reason());

        var quorate = Participation.of(4, 2, 50);
        assertTrue(quorate.quorumMet());
        assertSame(Resolution.APPROVED, policy.apply(Resolution.APPROVED, quorate));
    }

    @Test
    public void neverApprovesARejection() {
        var rejected = Resolution.rejected("No countable votes were cast");
        assertSame(rejected, QuorumPolicy.bandQuorum().apply(rejected, Participation.of(10, 10, 50)));
        assertSame(rejected, QuorumPolicy.NONE.apply(rejected, Participation.of(10, 10, 50)));
    }

    @Test
    public void none() {
        var resolution = QuorumPolicy.NONE.apply(Resolution.APPROVED, Participation.of(50, 1, 100));
        assertEquals(Outcome.APPROVED, resolution.outcome());
        assertNull(resolution.reason());
    }

    @Test
    public void noElectorate() {
        var empty = Participation.of(0, 0, 0);
        assertEquals(0.0, empty.participationPercentage());
        assertTrue(empty.quorumMet());
        assertFalse(Participation.of(0, 0, 10).quorumMet());
    }
}
