/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.SelectField;
import org.jooq.impl.DSL;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static com.bandstand.governance.Schema.*;

/**
 * Proposal persistence. Operates within whatever transaction the supplied context is bound to.
 */
public class ProposalStore {

    private static final SelectField<?>[] COLUMNS = { PROPOSAL_ID, PROPOSAL_BAND, PROPOSAL_CREATED_BY, PROPOSAL_TITLE,
                                                      PROPOSAL_DESCRIPTION, PROPOSAL_TYPE, PROPOSAL_PRIORITY,
                                                      PROPOSAL_PROBLEM_STATEMENT, PROPOSAL_EXPECTED_OUTCOME,
                                                      PROPOSAL_BUDGET_REQUESTED, PROPOSAL_START_DATE,
                                                      PROPOSAL_END_DATE, PROPOSAL_MILESTONES, PROPOSAL_CREATED_AT,
                                                      PROPOSAL_VOTING_ENDS_AT, PROPOSAL_STATUS, PROPOSAL_CLOSED_AT };

    private final DSLContext dsl;

    public ProposalStore(DSLContext dsl) {
        this.dsl = dsl;
    }

    static Instant instant(Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    static Proposal proposal(Record r) {
        var content = new ProposalDraft(r.get(PROPOSAL_TITLE), r.get(PROPOSAL_DESCRIPTION),
                                        ProposalType.valueOf(r.get(PROPOSAL_TYPE)),
                                        Priority.valueOf(r.get(PROPOSAL_PRIORITY)),
                                        r.get(PROPOSAL_PROBLEM_STATEMENT), r.get(PROPOSAL_EXPECTED_OUTCOME),
                                        r.get(PROPOSAL_BUDGET_REQUESTED), r.get(PROPOSAL_START_DATE),
                                        r.get(PROPOSAL_END_DATE), r.get(PROPOSAL_MILESTONES));
        return new Proposal(r.get(PROPOSAL_ID), r.get(PROPOSAL_BAND), r.get(PROPOSAL_CREATED_BY), content,
                            instant(r.get(PROPOSAL_CREATED_AT)), instant(r.get(PROPOSAL_VOTING_ENDS_AT)),
                            ProposalStatus.valueOf(r.get(PROPOSAL_STATUS)), instant(r.get(PROPOSAL_CLOSED_AT)));
    }

    /**
     * Answer the band's proposals, newest first. Null filters match everything.
     */
    public List<Proposal> byBand(String bandId, ProposalStatus status, ProposalType type) {
        Condition condition = PROPOSAL_BAND.eq(bandId);
        if (status != null) {
            condition = condition.and(PROPOSAL_STATUS.eq(status.name()));
        }
        if (type != null) {
            condition = condition.and(PROPOSAL_TYPE.eq(type.name()));
        }
        return dsl.select(COLUMNS)
                  .from(PROPOSAL)
                  .where(condition)
                  .orderBy(PROPOSAL_CREATED_AT.desc(), PROPOSAL_ID)
                  .fetch()
                  .map(ProposalStore::proposal);
    }

    public Proposal fetch(String proposalId) {
        var r = dsl.select(COLUMNS).from(PROPOSAL).where(PROPOSAL_ID.eq(proposalId)).fetchOne();
        return r == null ? null : proposal(r);
    }

    /**
     * Fetch the proposal, holding its row lock for the remainder of the transaction. Serializes votes and closes of
     * the same proposal.
     */
    public Proposal fetchForUpdate(String proposalId) {
        var r = dsl.select(COLUMNS).from(PROPOSAL).where(PROPOSAL_ID.eq(proposalId)).forUpdate().fetchOne();
        return r == null ? null : proposal(r);
    }

    public void insert(Proposal proposal) {
        var content = proposal.content();
        dsl.insertInto(PROPOSAL)
           .set(PROPOSAL_ID, proposal.id())
           .set(PROPOSAL_BAND, proposal.bandId())
           .set(PROPOSAL_CREATED_BY, proposal.createdById())
           .set(PROPOSAL_TITLE, content.title())
           .set(PROPOSAL_DESCRIPTION, content.description())
           .set(PROPOSAL_TYPE, content.type().name())
           .set(PROPOSAL_PRIORITY, content.priority().name())
           .set(PROPOSAL_PROBLEM_STATEMENT, content.problemStatement())
           .set(PROPOSAL_EXPECTED_OUTCOME, content.expectedOutcome())
           .set(PROPOSAL_BUDGET_REQUESTED, content.budgetRequested())
           .set(PROPOSAL_START_DATE, content.proposedStartDate())
           .set(PROPOSAL_END_DATE, content.proposedEndDate())
           .set(PROPOSAL_MILESTONES, content.milestones())
           .set(PROPOSAL_CREATED_AT, proposal.createdAt().toEpochMilli())
           .set(PROPOSAL_VOTING_ENDS_AT, proposal.votingEndsAt().toEpochMilli())
           .set(PROPOSAL_STATUS, proposal.status().name())
           .execute();
    }

    /**
     * Answer the open proposals of the bands whose voting period has not ended at <code>now</code> and on which the
     * user has not voted, soonest deadline first
     */
    public List<Proposal> pending(String userId, Collection<String> bandIds, Instant now) {
        if (bandIds.isEmpty()) {
            return List.of();
        }
        return dsl.select(COLUMNS)
                  .from(PROPOSAL)
                  .where(PROPOSAL_BAND.in(bandIds))
                  .and(PROPOSAL_STATUS.eq(ProposalStatus.OPEN.name()))
                  .and(PROPOSAL_VOTING_ENDS_AT.gt(now.toEpochMilli()))
                  .andNotExists(dsl.selectOne()
                                   .from(VOTE)
                                   .where(VOTE_PROPOSAL.eq(PROPOSAL_ID))
                                   .and(VOTE_USER.eq(userId)))
                  .orderBy(PROPOSAL_VOTING_ENDS_AT.asc(), PROPOSAL_ID)
                  .fetch()
                  .map(ProposalStore::proposal);
    }

    /**
     * Move the proposal from OPEN to the outcome's terminal status. Conditional on the stored status still being
     * OPEN, so that at most one caller ever succeeds.
     *
     * @return true if this call performed the transition
     */
    public boolean transition(String proposalId, Outcome outcome, Instant closedAt) {
        return dsl.update(PROPOSAL)
                  .set(PROPOSAL_STATUS, outcome.status().name())
                  .set(PROPOSAL_CLOSED_AT, closedAt.toEpochMilli())
                  .where(PROPOSAL_ID.eq(proposalId))
                  .and(PROPOSAL_STATUS.eq(DSL.inline(ProposalStatus.OPEN.name())))
                  .execute() == 1;
    }
}
