/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import com.bandstand.governance.InvalidConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The governance configuration of a band. Read only to the engine; it is maintained through the band settings.
 * <p>
 * The voting method is kept as stored, so that an unrecognized method can be detected and failed closed at
 * resolution time rather than silently replaced. Likewise a stored configuration is never rejected on read; it is
 * {@link #validate() validated} when written.
 *
 * @param bandId                the band
 * @param votingMethodName      the stored name of the band's {@link VotingMethod}
 * @param votingPeriodDays      length of the voting window of new proposals, at least one day
 * @param whoCanCreateProposals roles that may create proposals in addition to the platform default
 * @param whoCanApprove         roles configured to approve. Not consulted when closing proposals
 * @param quorumPercentage      minimum participation percentage, informational unless enforced
 */
public record BandConfig(String bandId, String votingMethodName, int votingPeriodDays,
                         Set<Role> whoCanCreateProposals, Set<Role> whoCanApprove, int quorumPercentage) {

    public static final int DEFAULT_VOTING_PERIOD_DAYS = 7;

    public BandConfig {
        Objects.requireNonNull(bandId, "bandId");
        whoCanCreateProposals = immutable(whoCanCreateProposals);
        whoCanApprove = immutable(whoCanApprove);
    }

    public static BandConfig of(String bandId, VotingMethod votingMethod, int votingPeriodDays) {
        return new BandConfig(bandId, votingMethod.name(), votingPeriodDays, Set.of(), Set.of(), 0);
    }

    private static Set<Role> immutable(Set<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /**
     * Answer the band's voting method, or empty if the stored name is not a known method
     */
    public Optional<VotingMethod> votingMethod() {
        return VotingMethod.lookup(votingMethodName);
    }

    /**
     * @throws InvalidConfigurationException if the voting method is unknown, the voting period is shorter than a
     *                                       day, or the quorum is not a percentage
     */
    public BandConfig validate() {
        if (votingMethod().isEmpty()) {
            throw new InvalidConfigurationException(
            String.format("Band: %s has an invalid voting method: %s", bandId, votingMethodName));
        }
        if (votingPeriodDays < 1) {
            throw new InvalidConfigurationException(
            String.format("Band: %s has an invalid voting period: %s days", bandId, votingPeriodDays));
        }
        if (quorumPercentage < 0 || quorumPercentage > 100) {
            throw new InvalidConfigurationException(
            String.format("Band: %s has an invalid quorum percentage: %s", bandId, quorumPercentage));
        }
        return this;
    }

    public BandConfig withVotingMethod(VotingMethod method) {
        return new BandConfig(bandId, method.name(), votingPeriodDays, whoCanCreateProposals, whoCanApprove,
                              quorumPercentage);
    }

    public BandConfig withVotingPeriodDays(int days) {
        return new BandConfig(bandId, votingMethodName, days, whoCanCreateProposals, whoCanApprove,
                              quorumPercentage);
    }

    public BandConfig withWhoCanCreateProposals(Set<Role> roles) {
        return new BandConfig(bandId, votingMethodName, votingPeriodDays, roles, whoCanApprove, quorumPercentage);
    }

    public BandConfig withWhoCanApprove(Set<Role> roles) {
        return new BandConfig(bandId, votingMethodName, votingPeriodDays, whoCanCreateProposals, roles,
                              quorumPercentage);
    }

    public BandConfig withQuorumPercentage(int percentage) {
        return new BandConfig(bandId, votingMethodName, votingPeriodDays, whoCanCreateProposals, whoCanApprove,
                              percentage);
    }
}
