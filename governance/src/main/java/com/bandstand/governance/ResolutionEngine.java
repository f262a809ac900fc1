/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.Governance.Tally;
import com.bandstand.governance.directory.VotingMethod;

import java.util.Collection;

/**
 * Threshold resolution of a closed vote. A pure function of the YES and NO counts and the voting method: ABSTAIN
 * never enters the calculation, zero countable votes always reject, and participation is not considered here (see
 * {@link QuorumPolicy}).
 */
public final class ResolutionEngine {

    private ResolutionEngine() {
    }

    /**
     * Resolve the counts under the voting method
     *
     * @throws InvalidConfigurationException if the method is null
     */
    public static Outcome resolve(int yes, int no, VotingMethod method) {
        if (method == null) {
            throw new InvalidConfigurationException("No voting method");
        }
        if (yes < 0 || no < 0) {
            throw new IllegalArgumentException(String.format("Negative vote count, yes: %s no: %s", yes, no));
        }
        if (yes + no == 0) {
            return Outcome.REJECTED;
        }
        var approved = switch (method) {
            case SIMPLE_MAJORITY -> yesPercentage(yes, no) > 50;
            case SUPERMAJORITY_66 -> yesPercentage(yes, no) >= 66;
            case SUPERMAJORITY_75 -> yesPercentage(yes, no) >= 75;
            case UNANIMOUS -> no == 0 && yes > 0;
        };
        return approved ? Outcome.APPROVED : Outcome.REJECTED;
    }

    public static Outcome resolve(Collection<VoteChoice> votes, VotingMethod method) {
        var yes = (int) votes.stream().filter(v -> v == VoteChoice.YES).count();
        var no = (int) votes.stream().filter(v -> v == VoteChoice.NO).count();
        return resolve(yes, no, method);
    }

    /**
     * Resolve the tally, explaining a rejection
     *
     * @throws InvalidConfigurationException if the method is null
     */
    public static Resolution resolve(Tally tally, VotingMethod method) {
        var outcome = resolve(tally.yes(), tally.no(), method);
        if (outcome == Outcome.APPROVED) {
            return Resolution.APPROVED;
        }
        if (tally.countable() == 0) {
            return Resolution.rejected("No countable votes were cast");
        }
        if (method == VotingMethod.UNANIMOUS) {
            return Resolution.rejected(String.format("Unanimous approval required, %s member(s) voted NO", tally.no()));
        }
        return Resolution.rejected(String.format("%s not reached, %.2f%% voted YES", method,
                                                 yesPercentage(tally.yes(), tally.no())));
    }

    /**
     * Percentage of the countable votes that are YES, zero when there are none
     */
    public static double yesPercentage(int yes, int no) {
        var total = yes + no;
        return total == 0 ? 0.0 : yes * 100.0 / total;
    }

    /**
     * @param reason null when approved
     */
    public record Resolution(Outcome outcome, String reason) {
        public static final Resolution APPROVED = new Resolution(Outcome.APPROVED, null);

        public static Resolution rejected(String reason) {
            return new Resolution(Outcome.REJECTED, reason);
        }
    }
}
