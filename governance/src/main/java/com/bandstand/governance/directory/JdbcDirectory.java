/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import com.bandstand.governance.InvalidConfigurationException;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.bandstand.governance.Schema.*;

/**
 * Membership and band configuration backed by the governance schema. Reads are direct; the static maintenance
 * operations are for the band settings and membership workflows that own this data, and for seeding.
 */
public class JdbcDirectory implements MembershipDirectory, BandDirectory {

    static final String CAPABILITY_APPROVE = "APPROVE";
    static final String CAPABILITY_CREATE  = "CREATE";

    private static final Logger log = LoggerFactory.getLogger(JdbcDirectory.class);

    private final DSLContext dslCtx;

    public JdbcDirectory(DSLContext dslCtx) {
        this.dslCtx = dslCtx;
    }

    /**
     * Add or replace the band's configuration, including its role sets
     *
     * @throws InvalidConfigurationException if the configuration does not validate
     */
    public static void put(DSLContext context, BandConfig config) {
        config.validate();
        context.transaction(ctx -> {
            var dsl = DSL.using(ctx);
            var updated = dsl.update(BAND)
                             .set(BAND_VOTING_METHOD, config.votingMethodName())
                             .set(BAND_VOTING_PERIOD, config.votingPeriodDays())
                             .set(BAND_QUORUM, config.quorumPercentage())
                             .where(BAND_ID.eq(config.bandId()))
                             .execute();
            if (updated == 0) {
                dsl.insertInto(BAND)
                   .columns(BAND_ID, BAND_VOTING_METHOD, BAND_VOTING_PERIOD, BAND_QUORUM)
                   .values(config.bandId(), config.votingMethodName(), config.votingPeriodDays(),
                           config.quorumPercentage())
                   .execute();
            }
            dsl.deleteFrom(BAND_ROLE).where(BAND_ROLE_BAND.eq(config.bandId())).execute();
            insertRoles(dsl, config.bandId(), CAPABILITY_CREATE, config.whoCanCreateProposals());
            insertRoles(dsl, config.bandId(), CAPABILITY_APPROVE, config.whoCanApprove());
        });
    }

    /**
     * Add or replace the membership
     */
    public static void put(DSLContext context, Member member) {
        context.transaction(ctx -> {
            var dsl = DSL.using(ctx);
            var updated = dsl.update(MEMBER)
                             .set(MEMBER_ROLE, member.role().name())
                             .set(MEMBER_STATUS, member.status().name())
                             .where(MEMBER_BAND.eq(member.bandId()))
                             .and(MEMBER_USER.eq(member.userId()))
                             .execute();
            if (updated == 0) {
                dsl.insertInto(MEMBER)
                   .columns(MEMBER_BAND, MEMBER_USER, MEMBER_ROLE, MEMBER_STATUS)
                   .values(member.bandId(), member.userId(), member.role().name(), member.status().name())
                   .execute();
            }
        });
    }

    private static void insertRoles(DSLContext dsl, String bandId, String capability, Set<Role> roles) {
        for (var role : roles) {
            dsl.insertInto(BAND_ROLE)
               .columns(BAND_ROLE_BAND, BAND_ROLE_CAPABILITY, BAND_ROLE_ROLE)
               .values(bandId, capability, role.name())
               .execute();
        }
    }

    private static Member member(Record r) {
        return new Member(r.get(MEMBER_BAND), r.get(MEMBER_USER), Role.valueOf(r.get(MEMBER_ROLE)),
                          MemberStatus.valueOf(r.get(MEMBER_STATUS)));
    }

    @Override
    public List<Member> activeMembers(String bandId) {
        return dslCtx.select(MEMBER_BAND, MEMBER_USER, MEMBER_ROLE, MEMBER_STATUS)
                     .from(MEMBER)
                     .where(MEMBER_BAND.eq(bandId))
                     .and(MEMBER_STATUS.eq(MemberStatus.ACTIVE.name()))
                     .orderBy(MEMBER_USER)
                     .fetch()
                     .map(JdbcDirectory::member);
    }

    @Override
    public List<Member> activeMemberships(String userId) {
        return dslCtx.select(MEMBER_BAND, MEMBER_USER, MEMBER_ROLE, MEMBER_STATUS)
                     .from(MEMBER)
                     .where(MEMBER_USER.eq(userId))
                     .and(MEMBER_STATUS.eq(MemberStatus.ACTIVE.name()))
                     .orderBy(MEMBER_BAND)
                     .fetch()
                     .map(JdbcDirectory::member);
    }

    @Override
    public Optional<BandConfig> getBandConfig(String bandId) {
        var band = dslCtx.select(BAND_ID, BAND_VOTING_METHOD, BAND_VOTING_PERIOD, BAND_QUORUM)
                         .from(BAND)
                         .where(BAND_ID.eq(bandId))
                         .fetchOne();
        if (band == null) {
            return Optional.empty();
        }
        var creators = EnumSet.noneOf(Role.class);
        var approvers = EnumSet.noneOf(Role.class);
        for (var role : dslCtx.select(BAND_ROLE_CAPABILITY, BAND_ROLE_ROLE)
                              .from(BAND_ROLE)
                              .where(BAND_ROLE_BAND.eq(bandId))
                              .fetch()) {
            Role r;
            try {
                r = Role.valueOf(role.value2());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown role: {} configured for: {} on band: {}", role.value2(), role.value1(),
                         bandId);
                continue;
            }
            switch (role.value1()) {
            case CAPABILITY_CREATE -> creators.add(r);
            case CAPABILITY_APPROVE -> approvers.add(r);
            default -> log.warn("Ignoring unknown capability: {} on band: {}", role.value1(), bandId);
            }
        }
        return Optional.of(new BandConfig(band.value1(), band.value2(), band.value3(), creators, approvers,
                                          band.value4()));
    }

    @Override
    public Optional<Member> getMember(String bandId, String userId) {
        return dslCtx.select(MEMBER_BAND, MEMBER_USER, MEMBER_ROLE, MEMBER_STATUS)
                     .from(MEMBER)
                     .where(MEMBER_BAND.eq(bandId))
                     .and(MEMBER_USER.eq(userId))
                     .fetchOptional()
                     .map(JdbcDirectory::member);
    }
}
