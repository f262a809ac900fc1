/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.Governance.Tally;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.bandstand.governance.Schema.*;

/**
 * The votes cast on proposals. At most one vote exists per proposal and member; the store's unique key on
 * (proposal, user) is what guarantees it, not any check made here.
 */
public class VoteLedger {
    private static final Logger log = LoggerFactory.getLogger(VoteLedger.class);

    private final DSLContext dsl;

    public VoteLedger(DSLContext dsl) {
        this.dsl = dsl;
    }

    static Vote vote(Record r) {
        return new Vote(r.get(VOTE_PROPOSAL), r.get(VOTE_USER), VoteChoice.valueOf(r.get(VOTE_VALUE)),
                        r.get(VOTE_COMMENT), ProposalStore.instant(r.get(VOTE_CREATED_AT)),
                        ProposalStore.instant(r.get(VOTE_UPDATED_AT)));
    }

    /**
     * Answer the counts of the proposal's votes
     */
    public Tally tally(String proposalId) {
        int yes = 0, no = 0, abstain = 0;
        for (var count : dsl.select(VOTE_VALUE, DSL.count())
                            .from(VOTE)
                            .where(VOTE_PROPOSAL.eq(proposalId))
                            .groupBy(VOTE_VALUE)
                            .fetch()) {
            switch (VoteChoice.valueOf(count.value1())) {
            case YES -> yes = count.value2();
            case NO -> no = count.value2();
            case ABSTAIN -> abstain = count.value2();
            }
        }
        return new Tally(yes, no, abstain, yes + no + abstain);
    }

    /**
     * Record the member's vote, replacing any prior vote of the member on the proposal. Last write wins; no history
     * of replaced votes is kept.
     *
     * @return true if the vote was newly created, false if it replaced an existing vote
     */
    public boolean upsert(String proposalId, String userId, VoteChoice choice, String comment, Instant now) {
        var millis = now.toEpochMilli();
        try {
            dsl.transaction(nested -> DSL.using(nested)
                                         .insertInto(VOTE)
                                         .columns(VOTE_PROPOSAL, VOTE_USER, VOTE_VALUE, VOTE_COMMENT,
                                                  VOTE_CREATED_AT, VOTE_UPDATED_AT)
                                         .values(proposalId, userId, choice.name(), comment, millis, millis)
                                         .execute());
            return true;
        } catch (DataAccessException e) {
            if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
                throw e;
            }
            log.trace("Replacing vote of: {} on: {}", userId, proposalId);
        }
        var updated = dsl.update(VOTE)
                         .set(VOTE_VALUE, choice.name())
                         .set(VOTE_COMMENT, comment)
                         .set(VOTE_UPDATED_AT, millis)
                         .where(VOTE_PROPOSAL.eq(proposalId))
                         .and(VOTE_USER.eq(userId))
                         .execute();
        if (updated != 1) {
            throw new IllegalStateException(
            String.format("Vote of: %s on: %s conflicted on insert but was not found to replace", userId,
                          proposalId));
        }
        return false;
    }

    /**
     * Answer the proposal's votes, most recently cast first
     */
    public List<Vote> votes(String proposalId) {
        return dsl.select(VOTE_PROPOSAL, VOTE_USER, VOTE_VALUE, VOTE_COMMENT, VOTE_CREATED_AT, VOTE_UPDATED_AT)
                  .from(VOTE)
                  .where(VOTE_PROPOSAL.eq(proposalId))
                  .orderBy(VOTE_CREATED_AT.desc(), VOTE_USER)
                  .fetch()
                  .map(VoteLedger::vote);
    }

    /**
     * Answer the member's vote on the proposal, if any
     */
    public Optional<Vote> votesByUser(String proposalId, String userId) {
        return dsl.select(VOTE_PROPOSAL, VOTE_USER, VOTE_VALUE, VOTE_COMMENT, VOTE_CREATED_AT, VOTE_UPDATED_AT)
                  .from(VOTE)
                  .where(VOTE_PROPOSAL.eq(proposalId))
                  .and(VOTE_USER.eq(userId))
                  .fetchOptional()
                  .map(VoteLedger::vote);
    }
}
