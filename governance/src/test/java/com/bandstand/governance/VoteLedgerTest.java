/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.directory.BandConfig;
import com.bandstand.governance.directory.VotingMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.bandstand.governance.Fixtures.EPOCH;
import static com.bandstand.governance.Schema.VOTE;
import static com.bandstand.governance.Schema.VOTE_PROPOSAL;
import static org.junit.jupiter.api.Assertions.*;

public class VoteLedgerTest {
    private GovernanceDatabase database;
    private VoteLedger         ledger;
    private Proposal           proposal;
    private ProposalStore      store;

    @AfterEach
    public void after() {
        if (database != null) {
            database.close();
        }
    }

    @BeforeEach
    public void before() {
        database = Fixtures.database();
        Fixtures.put(database.dslCtx(), BandConfig.of("band", VotingMethod.SIMPLE_MAJORITY, 7));
        store = new ProposalStore(database.dslCtx());
        ledger = new VoteLedger(database.dslCtx());
        proposal = new Proposal("proposal-1", "band", "founder", Fixtures.draft("Practice space"), EPOCH,
                                EPOCH.plus(Duration.ofDays(7)), ProposalStatus.OPEN, null);
        store.insert(proposal);
    }

    @Test
    public void lastWriteWins() {
        var choices = new VoteChoice[] { VoteChoice.YES, VoteChoice.ABSTAIN, VoteChoice.NO, VoteChoice.YES,
                                         VoteChoice.NO };
        var now = EPOCH;
        for (int i = 0; i < choices.length; i++) {
            now = now.plusSeconds(1);
            assertEquals(i == 0, ledger.upsert(proposal.id(), "voter", choices[i], "take " + i, now));
        }
        assertEquals(1, database.dslCtx().fetchCount(VOTE, VOTE_PROPOSAL.eq(proposal.id())));

        var vote = ledger.votesByUser(proposal.id(), "voter").orElseThrow();
        assertEquals(VoteChoice.NO, vote.choice());
        assertEquals("take 4", vote.comment());
        assertEquals(EPOCH.plusSeconds(1), vote.createdAt());
        assertEquals(now, vote.updatedAt());
    }

    @Test
    public void tally() {
        assertEquals(Governance.Tally.EMPTY, ledger.tally(proposal.id()));
        ledger.upsert(proposal.id(), "a", VoteChoice.YES, null, EPOCH);
        ledger.upsert(proposal.id(), "b", VoteChoice.YES, null, EPOCH);
        ledger.upsert(proposal.id(), "c", VoteChoice.NO, null, EPOCH);
        ledger.upsert(proposal.id(), "d", VoteChoice.ABSTAIN, null, EPOCH);
        ledger.upsert(proposal.id(), "d", VoteChoice.YES, null, EPOCH);

        var tally = ledger.tally(proposal.id());
        assertEquals(new Governance.Tally(3, 1, 0, 4), tally);
        assertEquals(4, tally.countable());
        assertEquals(4, ledger.votes(proposal.id()).size());
        assertTrue(ledger.votesByUser(proposal.id(), "e").isEmpty());
    }

    @Test
    public void transitionsOnlyOnce() {
        assertTrue(store.transition(proposal.id(), Outcome.APPROVED, EPOCH.plusSeconds(5)));
        assertFalse(store.transition(proposal.id(), Outcome.REJECTED, EPOCH.plusSeconds(6)));

        var stored = store.fetch(proposal.id());
        assertEquals(ProposalStatus.APPROVED, stored.status());
        assertEquals(EPOCH.plusSeconds(5), stored.closedAt());
        assertNull(store.fetch("no-such-proposal"));
    }
}
