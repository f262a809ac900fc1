/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import java.util.List;
import java.util.Optional;

/**
 * The proposal governance operations a band exposes to its presentation layer.
 * <p>
 * All operations are synchronous and read through to the store; nothing is cached between calls. Domain failures
 * are reported as {@link GovernanceException}s, store failures as {@link org.jooq.exception.DataAccessException}.
 */
public interface Governance {

    /**
     * Cast or replace the voter's vote on the proposal
     *
     * @return whether the vote was newly recorded or replaced a prior vote of the same member
     * @throws NotFoundException      if the proposal does not exist
     * @throws VotingClosedException  if the proposal is not open or its voting period has ended
     * @throws NotAuthorizedException if the voter is not an active member with a voting role
     */
    VoteReceipt castVote(String proposalId, String voterId, VoteChoice choice, String comment);

    default VoteReceipt castVote(String proposalId, String voterId, VoteChoice choice) {
        return castVote(proposalId, voterId, choice, null);
    }

    /**
     * Resolve the proposal from its current votes under the band's voting method. Closing is never automatic and is
     * not gated on the voting deadline.
     *
     * @throws NotFoundException      if the proposal does not exist
     * @throws AlreadyClosedException if the proposal has already been resolved, including by a concurrent close
     * @throws NotAuthorizedException if the closer is neither the creator nor an active founder or governor
     */
    CloseResult closeProposal(String proposalId, String closerId);

    /**
     * Create a proposal in the band, open for voting for the band's configured voting period. Eligible voters other
     * than the creator are notified.
     *
     * @throws NotFoundException      if the band does not exist
     * @throws NotAuthorizedException if the creator is not an active member permitted to create proposals
     */
    Proposal createProposal(String bandId, String creatorId, ProposalDraft draft);

    /**
     * Answer the proposal, its votes, and the vote summary
     *
     * @throws NotFoundException if the proposal does not exist
     */
    ProposalView getProposal(String proposalId);

    /**
     * Answer the user's vote on the proposal, if any
     */
    Optional<Vote> getVote(String proposalId, String userId);

    /**
     * Answer the open, unexpired proposals the user may vote on and has not, soonest deadline first
     */
    List<Proposal> listPendingVotesForUser(String userId);

    /**
     * Answer the band's proposals, newest first, optionally filtered by status and type
     */
    List<Proposal> listProposals(String bandId, ProposalStatus status, ProposalType type);

    /**
     * Counts of the votes on a proposal
     *
     * @param total all votes, abstentions included
     */
    record Tally(int yes, int no, int abstain, int total) {
        public static final Tally EMPTY = new Tally(0, 0, 0, 0);

        /**
         * The votes that count toward a threshold
         */
        public int countable() {
            return yes + no;
        }
    }

    /**
     * The vote summary of a proposal for display. Percentages are of the countable (YES and NO) votes only.
     *
     * @param eligibleVoters informational, the active members currently able to vote
     */
    record VoteSummary(int yes, int no, int abstain, int total, int eligibleVoters, double yesPercentage,
                       double noPercentage) {

        public static VoteSummary of(Tally tally, int eligibleVoters) {
            var countable = tally.countable();
            var yesPercentage = countable == 0 ? 0.0 : tally.yes() * 100.0 / countable;
            var noPercentage = countable == 0 ? 0.0 : tally.no() * 100.0 / countable;
            return new VoteSummary(tally.yes(), tally.no(), tally.abstain(), tally.total(), eligibleVoters,
                                   yesPercentage, noPercentage);
        }
    }

    record ProposalView(Proposal proposal, List<Vote> votes, VoteSummary summary) {
    }

    /**
     * @param created true if this was the member's first vote on the proposal, false if it replaced a prior vote
     */
    record VoteReceipt(boolean created, Vote vote) {
    }

    /**
     * Participation at the time a proposal was closed
     *
     * @param eligibleVoters   active members able to vote
     * @param totalVoters      members who voted, abstentions included
     * @param quorumPercentage the band's configured quorum
     * @param quorumMet        whether participation reached the quorum
     */
    record Participation(int eligibleVoters, int totalVoters, double participationPercentage, int quorumPercentage,
                         boolean quorumMet) {

        public static Participation of(int eligibleVoters, int totalVoters, int quorumPercentage) {
            var percentage = eligibleVoters > 0 ? totalVoters * 100.0 / eligibleVoters : 0.0;
            return new Participation(eligibleVoters, totalVoters, percentage, quorumPercentage,
                                     percentage >= quorumPercentage);
        }
    }

    /**
     * @param rejectionReason null when approved
     */
    record CloseResult(Outcome outcome, Proposal proposal, Tally tally, Participation participation,
                       String rejectionReason) {
    }
}
