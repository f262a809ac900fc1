/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.ResolutionEngine.Resolution;
import com.bandstand.governance.directory.BandConfig;
import com.bandstand.governance.directory.BandDirectory;
import com.bandstand.governance.directory.JdbcDirectory;
import com.bandstand.governance.directory.Member;
import com.bandstand.governance.directory.MembershipDirectory;
import com.bandstand.governance.notification.Notification;
import com.bandstand.governance.notification.NotificationFanout;
import com.bandstand.governance.notification.NotificationSink;
import com.bandstand.governance.notification.NotificationType;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The proposal lifecycle over the governance store. Every operation runs in its own transaction against the shared
 * store and keeps no proposal or vote state between calls. Votes and closes of a proposal are serialized by its row
 * lock; the OPEN to APPROVED | REJECTED transition is a conditional update, so exactly one close ever wins.
 * Notifications are sent after commit and never affect the committed result.
 */
public class GovernanceEngine implements Governance {
    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final BandDirectory       bands;
    private final Clock               clock;
    private final DSLContext          dslCtx;
    private final NotificationFanout  fanout;
    private final MembershipDirectory members;
    private final GovernanceMetrics   metrics;
    private final QuorumPolicy        quorum;

    public GovernanceEngine(DSLContext dslCtx, MembershipDirectory members, BandDirectory bands,
                            NotificationSink sink, Clock clock, QuorumPolicy quorum, GovernanceMetrics metrics) {
        this.dslCtx = dslCtx;
        this.members = members;
        this.bands = bands;
        this.clock = clock;
        this.quorum = quorum == null ? QuorumPolicy.NONE : quorum;
        this.metrics = metrics;
        this.fanout = new NotificationFanout(sink, metrics);
    }

    /**
     * An engine whose membership and band configuration are read from the same store
     */
    public GovernanceEngine(DSLContext dslCtx, NotificationSink sink, Clock clock) {
        this(dslCtx, new JdbcDirectory(dslCtx), new JdbcDirectory(dslCtx), sink, clock, QuorumPolicy.NONE, null);
    }

    @Override
    public VoteReceipt castVote(String proposalId, String voterId, VoteChoice choice, String comment) {
        if (choice == null) {
            throw new IllegalArgumentException("A vote choice is required");
        }
        return guarded(() -> {
            var now = now();
            // Membership and band configuration are read before the row lock is taken, so that a request never
            // holds a locked connection while waiting on the pool for another
            var current = new ProposalStore(dslCtx).fetch(proposalId);
            if (current == null) {
                throw NotFoundException.proposal(proposalId);
            }
            var band = band(current.bandId());
            var voter = members.getMember(current.bandId(), voterId).orElse(null);
            var receipt = dslCtx.transactionResult(ctx -> {
                var dsl = DSL.using(ctx);
                var proposal = new ProposalStore(dsl).fetchForUpdate(proposalId);
                if (proposal == null) {
                    throw NotFoundException.proposal(proposalId);
                }
                if (proposal.status() != ProposalStatus.OPEN) {
                    throw new VotingClosedException(proposalId, "This proposal is no longer open for voting");
                }
                if (!now.isBefore(proposal.votingEndsAt())) {
                    throw new VotingClosedException(proposalId, "Voting period has ended");
                }
                if (!EligibilityResolver.canVote(band, voter)) {
                    throw new NotAuthorizedException(
                    voter == null || !voter.isActive() ? "You are not an active member of this band"
                                                       : "You do not have permission to vote on this proposal");
                }
                var ledger = new VoteLedger(dsl);
                var created = ledger.upsert(proposalId, voterId, choice, comment, now);
                return new VoteReceipt(created, ledger.votesByUser(proposalId, voterId).orElseThrow());
            });
            if (metrics != null) {
                metrics.voteCast(receipt.created());
            }
            log.debug("{} vote: {} by: {} on: {}", receipt.created() ? "Cast" : "Updated", choice, voterId,
                      proposalId);
            return receipt;
        });
    }

    @Override
    public CloseResult closeProposal(String proposalId, String closerId) {
        return guarded(() -> {
            var timer = metrics == null ? null : metrics.closeLatency().time();
            try {
                var now = now();
                var electorate = electorate(proposalId, closerId);
                Closing closing;
                try {
                    closing = dslCtx.transactionResult(ctx -> close(DSL.using(ctx), electorate, now));
                } catch (DataAccessException e) {
                    var current = dslCtx.transactionResult(ctx -> new ProposalStore(DSL.using(ctx)).fetch(proposalId));
                    if (current != null && current.status().isTerminal()) {
                        log.debug("Lost close of: {} to a concurrent close", proposalId);
                        throw new AlreadyClosedException(proposalId, current.status());
                    }
                    throw e;
                }
                var result = closing.result();
                if (metrics != null) {
                    metrics.proposalClosed(result.outcome());
                }
                log.info("Closed: {} outcome: {} yes: {} no: {} abstain: {} by: {}", proposalId, result.outcome(),
                         result.tally().yes(), result.tally().no(), result.tally().abstain(), closerId);
                announce(closing);
                return result;
            } finally {
                if (timer != null) {
                    timer.stop();
                }
            }
        });
    }

    @Override
    public Proposal createProposal(String bandId, String creatorId, ProposalDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("A proposal draft is required");
        }
        return guarded(() -> {
            var band = band(bandId);
            var creator = members.getMember(bandId, creatorId).orElse(null);
            if (!EligibilityResolver.canCreate(band, creator)) {
                throw new NotAuthorizedException(
                creator == null || !creator.isActive() ? "You are not an active member of this band"
                                                       : "You do not have permission to create proposals in this band");
            }
            if (band.votingPeriodDays() < 1) {
                log.error("Band: {} has an invalid voting period: {} days", bandId, band.votingPeriodDays());
                if (metrics != null) {
                    metrics.invalidConfiguration();
                }
                throw new InvalidConfigurationException(
                String.format("Band: %s has an invalid voting period: %s days", bandId, band.votingPeriodDays()));
            }
            var now = now();
            var proposal = new Proposal(UUID.randomUUID().toString(), bandId, creatorId, draft, now,
                                        now.plus(Duration.ofDays(band.votingPeriodDays())), ProposalStatus.OPEN,
                                        null);
            dslCtx.transaction(ctx -> new ProposalStore(DSL.using(ctx)).insert(proposal));
            if (metrics != null) {
                metrics.proposalCreated();
            }
            log.info("Created: {} in: {} by: {} voting ends: {}", proposal.id(), bandId, creatorId,
                     proposal.votingEndsAt());

            var notification = new Notification("New Proposal",
                                                String.format("%s created the proposal \"%s\"", creatorId,
                                                              draft.title()), bandId, proposal.id(),
                                                draft.priority() == Priority.URGENT ? Priority.HIGH
                                                                                    : Priority.MEDIUM);
            notifyQuietly(NotificationType.PROPOSAL_CREATED, notification,
                          () -> members.activeMembers(bandId)
                                       .stream()
                                       .filter(m -> EligibilityResolver.canVote(band, m))
                                       .map(Member::userId)
                                       .filter(id -> !id.equals(creatorId))
                                       .toList());
            return proposal;
        });
    }

    @Override
    public ProposalView getProposal(String proposalId) {
        return guarded(() -> {
            var snapshot = dslCtx.transactionResult(ctx -> {
                var dsl = DSL.using(ctx);
                var proposal = new ProposalStore(dsl).fetch(proposalId);
                if (proposal == null) {
                    throw NotFoundException.proposal(proposalId);
                }
                var ledger = new VoteLedger(dsl);
                return new Snapshot(proposal, ledger.votes(proposalId), ledger.tally(proposalId));
            });
            var eligible = bands.getBandConfig(snapshot.proposal().bandId())
                                .map(band -> eligibleVoters(band).size())
                                .orElse(0);
            return new ProposalView(snapshot.proposal(), snapshot.votes(), VoteSummary.of(snapshot.tally(), eligible));
        });
    }

    @Override
    public Optional<Vote> getVote(String proposalId, String userId) {
        return dslCtx.transactionResult(ctx -> new VoteLedger(DSL.using(ctx)).votesByUser(proposalId, userId));
    }

    @Override
    public List<Proposal> listPendingVotesForUser(String userId) {
        var now = now();
        var bandIds = members.activeMemberships(userId)
                             .stream()
                             .filter(m -> bands.getBandConfig(m.bandId())
                                               .map(band -> EligibilityResolver.canVote(band, m))
                                               .orElse(false))
                             .map(Member::bandId)
                             .toList();
        return dslCtx.transactionResult(ctx -> new ProposalStore(DSL.using(ctx)).pending(userId, bandIds, now));
    }

    @Override
    public List<Proposal> listProposals(String bandId, ProposalStatus status, ProposalType type) {
        return dslCtx.transactionResult(ctx -> new ProposalStore(DSL.using(ctx)).byBand(bandId, status, type));
    }

    private void announce(Closing closing) {
        var result = closing.result();
        var proposal = result.proposal();
        Notification notification;
        NotificationType type;
        if (result.outcome() == Outcome.APPROVED) {
            type = NotificationType.PROPOSAL_APPROVED;
            notification = new Notification("Proposal Approved",
                                            String.format("The proposal \"%s\" was approved", proposal.title()),
                                            proposal.bandId(), proposal.id(), Priority.MEDIUM);
        } else {
            type = NotificationType.PROPOSAL_REJECTED;
            notification = new Notification("Proposal Rejected",
                                            String.format("The proposal \"%s\" was rejected: %s", proposal.title(),
                                                          result.rejectionReason()), proposal.bandId(),
                                            proposal.id(), Priority.MEDIUM);
        }
        notifyQuietly(type, notification, closing::recipients);
    }

    private BandConfig band(String bandId) {
        return bands.getBandConfig(bandId).orElseThrow(() -> NotFoundException.band(bandId));
    }

    private Closing close(DSLContext dsl, Electorate electorate, Instant now) {
        var proposalId = electorate.proposalId();
        var store = new ProposalStore(dsl);
        var proposal = store.fetchForUpdate(proposalId);
        if (proposal == null) {
            throw NotFoundException.proposal(proposalId);
        }
        if (proposal.status().isTerminal()) {
            throw new AlreadyClosedException(proposalId, proposal.status());
        }
        if (!EligibilityResolver.canClose(proposal, electorate.closer())) {
            throw new NotAuthorizedException("You do not have permission to close this proposal");
        }
        var band = electorate.band();
        var tally = new VoteLedger(dsl).tally(proposalId);
        var eligible = (int) electorate.members()
                                       .stream()
                                       .filter(m -> EligibilityResolver.canVote(band, m))
                                       .count();
        var participation = Participation.of(eligible, tally.total(), band.quorumPercentage());

        Resolution resolution;
        var method = band.votingMethod();
        if (method.isEmpty()) {
            log.error("Band: {} has an invalid voting method: {}, rejecting: {}", band.bandId(),
                      band.votingMethodName(), proposalId);
            if (metrics != null) {
                metrics.invalidConfiguration();
            }
            resolution = Resolution.rejected("Invalid voting method: " + band.votingMethodName());
        } else {
            resolution = quorum.apply(ResolutionEngine.resolve(tally, method.get()), participation);
        }

        if (!store.transition(proposalId, resolution.outcome(), now)) {
            throw new AlreadyClosedException(proposalId, store.fetch(proposalId).status());
        }
        var closed = new Proposal(proposal.id(), proposal.bandId(), proposal.createdById(), proposal.content(),
                                  proposal.createdAt(), proposal.votingEndsAt(), resolution.outcome().status(), now);
        return new Closing(new CloseResult(resolution.outcome(), closed, tally, participation, resolution.reason()),
                           electorate.members().stream().map(Member::userId).toList());
    }

    /**
     * Read everything a close needs from the directories without holding the proposal's row lock
     */
    private Electorate electorate(String proposalId, String closerId) {
        var proposal = new ProposalStore(dslCtx).fetch(proposalId);
        if (proposal == null) {
            throw NotFoundException.proposal(proposalId);
        }
        return new Electorate(proposalId, band(proposal.bandId()),
                              members.getMember(proposal.bandId(), closerId).orElse(null),
                              members.activeMembers(proposal.bandId()));
    }

    private List<Member> eligibleVoters(BandConfig band) {
        return members.activeMembers(band.bandId())
                      .stream()
                      .filter(m -> EligibilityResolver.canVote(band, m))
                      .toList();
    }

    private <T> T guarded(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (GovernanceException e) {
            log.debug("Rejected: {}", e.getMessage());
            if (metrics != null) {
                metrics.rejected(e);
            }
            throw e;
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Notification is best effort once the operation has committed. Failure to enumerate the recipients is logged
     * like any other delivery failure.
     */
    private void notifyQuietly(NotificationType type, Notification notification, Supplier<List<String>> recipients) {
        List<String> userIds;
        try {
            userIds = recipients.get();
        } catch (RuntimeException e) {
            log.warn("Unable to resolve recipients of: {} for proposal: {}", type, notification.proposalId(), e);
            if (metrics != null) {
                metrics.notificationFailed();
            }
            return;
        }
        fanout.fanout(userIds, type, notification);
    }

    private record Closing(CloseResult result, List<String> recipients) {
    }

    private record Electorate(String proposalId, BandConfig band, Member closer, List<Member> members) {
    }

    private record Snapshot(Proposal proposal, List<Vote> votes, Tally tally) {
    }
}
