/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Tables and columns of the governance schema, as created by <code>governance/initialize.xml</code>. Timestamps
 * are epoch milliseconds.
 */
public final class Schema {

    public static final Table<Record>  BAND               = table("BAND");
    public static final Field<String>  BAND_ID            = field("BAND", "ID", String.class);
    public static final Field<String>  BAND_VOTING_METHOD = field("BAND", "VOTING_METHOD", String.class);
    public static final Field<Integer> BAND_VOTING_PERIOD = field("BAND", "VOTING_PERIOD_DAYS", Integer.class);
    public static final Field<Integer> BAND_QUORUM        = field("BAND", "QUORUM_PERCENTAGE", Integer.class);

    public static final Table<Record> BAND_ROLE            = table("BAND_ROLE");
    public static final Field<String> BAND_ROLE_BAND       = field("BAND_ROLE", "BAND_ID", String.class);
    public static final Field<String> BAND_ROLE_CAPABILITY = field("BAND_ROLE", "CAPABILITY", String.class);
    public static final Field<String> BAND_ROLE_ROLE       = field("BAND_ROLE", "ROLE_NAME", String.class);

    public static final Table<Record> MEMBER        = table("BAND_MEMBER");
    public static final Field<String> MEMBER_BAND   = field("BAND_MEMBER", "BAND_ID", String.class);
    public static final Field<String> MEMBER_USER   = field("BAND_MEMBER", "USER_ID", String.class);
    public static final Field<String> MEMBER_ROLE   = field("BAND_MEMBER", "MEMBER_ROLE", String.class);
    public static final Field<String> MEMBER_STATUS = field("BAND_MEMBER", "MEMBER_STATUS", String.class);

    public static final Table<Record>     PROPOSAL                   = table("PROPOSAL");
    public static final Field<String>     PROPOSAL_ID                = field("PROPOSAL", "ID", String.class);
    public static final Field<String>     PROPOSAL_BAND              = field("PROPOSAL", "BAND_ID", String.class);
    public static final Field<String>     PROPOSAL_CREATED_BY        = field("PROPOSAL", "CREATED_BY", String.class);
    public static final Field<String>     PROPOSAL_TITLE             = field("PROPOSAL", "TITLE", String.class);
    public static final Field<String>     PROPOSAL_DESCRIPTION       = field("PROPOSAL", "DESCRIPTION", String.class);
    public static final Field<String>     PROPOSAL_TYPE              = field("PROPOSAL", "PROPOSAL_TYPE", String.class);
    public static final Field<String>     PROPOSAL_PRIORITY          = field("PROPOSAL", "PRIORITY", String.class);
    public static final Field<String>     PROPOSAL_PROBLEM_STATEMENT = field("PROPOSAL", "PROBLEM_STATEMENT",
                                                                             String.class);
    public static final Field<String>     PROPOSAL_EXPECTED_OUTCOME  = field("PROPOSAL", "EXPECTED_OUTCOME",
                                                                             String.class);
    public static final Field<BigDecimal> PROPOSAL_BUDGET_REQUESTED  = field("PROPOSAL", "BUDGET_REQUESTED",
                                                                             BigDecimal.class);
    public static final Field<LocalDate>  PROPOSAL_START_DATE        = field("PROPOSAL", "PROPOSED_START_DATE",
                                                                             LocalDate.class);
    public static final Field<LocalDate>  PROPOSAL_END_DATE          = field("PROPOSAL", "PROPOSED_END_DATE",
                                                                             LocalDate.class);
    public static final Field<String>     PROPOSAL_MILESTONES        = field("PROPOSAL", "MILESTONES", String.class);
    public static final Field<Long>       PROPOSAL_CREATED_AT        = field("PROPOSAL", "CREATED_AT", Long.class);
    public static final Field<Long>       PROPOSAL_VOTING_ENDS_AT    = field("PROPOSAL", "VOTING_ENDS_AT", Long.class);
    public static final Field<String>     PROPOSAL_STATUS            = field("PROPOSAL", "PROPOSAL_STATUS", String.class);
    public static final Field<Long>       PROPOSAL_CLOSED_AT         = field("PROPOSAL", "CLOSED_AT", Long.class);

    public static final Table<Record> VOTE            = table("PROPOSAL_VOTE");
    public static final Field<String> VOTE_PROPOSAL   = field("PROPOSAL_VOTE", "PROPOSAL_ID", String.class);
    public static final Field<String> VOTE_USER       = field("PROPOSAL_VOTE", "USER_ID", String.class);
    public static final Field<String> VOTE_VALUE      = field("PROPOSAL_VOTE", "CHOICE", String.class);
    public static final Field<String> VOTE_COMMENT    = field("PROPOSAL_VOTE", "VOTE_COMMENT", String.class);
    public static final Field<Long>   VOTE_CREATED_AT = field("PROPOSAL_VOTE", "CREATED_AT", Long.class);
    public static final Field<Long>   VOTE_UPDATED_AT = field("PROPOSAL_VOTE", "UPDATED_AT", Long.class);

    private Schema() {
    }

    private static Table<Record> table(String table) {
        return DSL.table(DSL.name(table));
    }

    private static <T> Field<T> field(String table, String column, Class<T> type) {
        return DSL.field(DSL.name(table, column), type);
    }
}
