/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.Fixtures.MutableClock;
import com.bandstand.governance.Governance.CloseResult;
import com.bandstand.governance.directory.BandConfig;
import com.bandstand.governance.directory.JdbcDirectory;
import com.bandstand.governance.directory.Role;
import com.bandstand.governance.directory.VotingMethod;
import com.bandstand.governance.notification.Notification;
import com.bandstand.governance.notification.NotificationSink;
import com.bandstand.governance.notification.NotificationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.bandstand.governance.Fixtures.active;
import static com.bandstand.governance.Schema.VOTE;
import static com.bandstand.governance.Schema.VOTE_PROPOSAL;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Votes and closes racing on the same proposal
 */
public class ConcurrentGovernanceTest {
    // More than the pool's default connections
    private static final int VOTERS = 16;

    private GovernanceDatabase database;
    private GovernanceEngine   engine;
    private ExecutorService    exec;
    private NotificationSink   sink;

    @AfterEach
    public void after() throws InterruptedException {
        if (exec != null) {
            exec.shutdownNow();
            exec.awaitTermination(10, TimeUnit.SECONDS);
        }
        if (database != null) {
            database.close();
        }
    }

    @BeforeEach
    public void before() {
        database = Fixtures.database();
        Fixtures.put(database.dslCtx(), BandConfig.of("band", VotingMethod.SIMPLE_MAJORITY, 7),
                     active("band", "founder", Role.FOUNDER), active("band", "governor", Role.GOVERNOR),
                     active("band", "voter1", Role.VOTING_MEMBER), active("band", "voter2", Role.VOTING_MEMBER));
        sink = mock(NotificationSink.class);
        engine = new GovernanceEngine(database.dslCtx(), sink, new MutableClock(Fixtures.EPOCH));
        exec = Executors.newFixedThreadPool(VOTERS);
    }

    @Test
    public void simultaneousCloses() throws Exception {
        var proposal = engine.createProposal("band", "founder", Fixtures.draft("Headline"));
        engine.castVote(proposal.id(), "voter1", VoteChoice.YES);
        engine.castVote(proposal.id(), "voter2", VoteChoice.YES);
        clearInvocations(sink);

        var outcomes = race(List.<Callable<CloseResult>>of(() -> engine.closeProposal(proposal.id(), "founder"),
                                                           () -> engine.closeProposal(proposal.id(), "governor")));

        var closed = new ArrayList<CloseResult>();
        var lost = new ArrayList<Throwable>();
        for (var outcome : outcomes) {
            try {
                closed.add(outcome.get());
            } catch (ExecutionException e) {
                lost.add(e.getCause());
            }
        }
        assertEquals(1, closed.size(), "closes: " + closed + " failures: " + lost);
        assertEquals(1, lost.size());
        assertInstanceOf(AlreadyClosedException.class, lost.get(0));
        assertEquals(Outcome.APPROVED, closed.get(0).outcome());
        assertEquals(ProposalStatus.APPROVED, engine.getProposal(proposal.id()).proposal().status());

        verify(sink, times(4)).notify(anyString(), eq(NotificationType.PROPOSAL_APPROVED), any(Notification.class));
        verify(sink, never()).notify(anyString(), eq(NotificationType.PROPOSAL_REJECTED), any(Notification.class));
    }

    @Test
    public void simultaneousVotesOfManyMembers() throws Exception {
        assertTrue(VOTERS > new GovernanceConfiguration().maxConnections);
        for (int i = 0; i < VOTERS; i++) {
            JdbcDirectory.put(database.dslCtx(), active("band", "member" + i, Role.VOTING_MEMBER));
        }
        var proposal = engine.createProposal("band", "founder", Fixtures.draft("Second encore"));
        var votes = new ArrayList<Callable<Governance.VoteReceipt>>();
        for (int i = 0; i < VOTERS; i++) {
            var voter = "member" + i;
            votes.add(() -> engine.castVote(proposal.id(), voter, VoteChoice.YES));
        }
        var failures = new ArrayList<Throwable>();
        for (var receipt : race(votes)) {
            try {
                assertTrue(receipt.get().created());
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        assertTrue(failures.isEmpty(), "failures: " + failures);
        var summary = engine.getProposal(proposal.id()).summary();
        assertEquals(VOTERS, summary.yes());
        assertEquals(VOTERS, summary.total());
    }

    @Test
    public void simultaneousVotesOfOneMember() throws Exception {
        var proposal = engine.createProposal("band", "founder", Fixtures.draft("Encore"));
        var votes = new ArrayList<Callable<Governance.VoteReceipt>>();
        for (int i = 0; i < 8; i++) {
            var choice = i % 2 == 0 ? VoteChoice.YES : VoteChoice.NO;
            votes.add(() -> engine.castVote(proposal.id(), "voter1", choice));
        }
        var created = 0;
        for (var receipt : race(votes)) {
            if (receipt.get().created()) {
                created++;
            }
        }
        assertEquals(1, created);
        assertEquals(1, database.dslCtx().fetchCount(VOTE, VOTE_PROPOSAL.eq(proposal.id())));
        assertEquals(1, engine.getProposal(proposal.id()).summary().total());
    }

    private <T> List<Future<T>> race(List<Callable<T>> contenders) throws InterruptedException {
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<T>>();
        for (var contender : contenders) {
            futures.add(exec.submit(() -> {
                start.await();
                return contender.call();
            }));
        }
        start.countDown();
        for (var future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                // inspected by the caller
            } catch (TimeoutException e) {
                fail("Contender did not finish");
            }
        }
        return futures;
    }
}
