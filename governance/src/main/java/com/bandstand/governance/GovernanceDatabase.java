/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.bandstand.governance.directory.JdbcDirectory;
import com.bandstand.governance.notification.NotificationSink;
import com.codahale.metrics.MetricRegistry;
import liquibase.Liquibase;
import liquibase.database.core.H2Database;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.LiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.sql.SQLException;
import java.time.Clock;

/**
 * The pooled governance store described by a {@link GovernanceConfiguration}
 */
public class GovernanceDatabase implements Closeable {
    public static final String CHANGE_LOG = "governance/initialize.xml";

    private static final Logger log = LoggerFactory.getLogger(GovernanceDatabase.class);

    private final GovernanceConfiguration configuration;
    private final DSLContext              dslCtx;
    private final JdbcConnectionPool      pool;

    public GovernanceDatabase(GovernanceConfiguration configuration) {
        this.configuration = configuration;
        pool = JdbcConnectionPool.create(configuration.jdbcUrl, configuration.user, configuration.password);
        pool.setMaxConnections(configuration.maxConnections);
        dslCtx = DSL.using(pool, SQLDialect.H2);
        if (configuration.migrate) {
            try {
                migrate();
            } catch (SQLException | LiquibaseException e) {
                pool.dispose();
                throw new IllegalStateException("Unable to migrate governance schema: " + configuration.jdbcUrl, e);
            }
        }
    }

    @Override
    public void close() {
        pool.dispose();
        log.info("Closed governance store: {}", configuration.jdbcUrl);
    }

    public DSLContext dslCtx() {
        return dslCtx;
    }

    /**
     * Answer an engine over this store, reading membership and band configuration from it
     *
     * @param metrics - may be null
     */
    public GovernanceEngine newEngine(NotificationSink sink, Clock clock, MetricRegistry metrics) {
        var directory = new JdbcDirectory(dslCtx);
        return new GovernanceEngine(dslCtx, directory, directory, sink, clock, configuration.quorumPolicy(),
                                    metrics == null ? null : new GovernanceMetricsImpl(metrics));
    }

    private void migrate() throws SQLException, LiquibaseException {
        var database = new H2Database();
        database.setConnection(new JdbcConnection(pool.getConnection()));
        try (Liquibase liquibase = new Liquibase(CHANGE_LOG, new ClassLoaderResourceAccessor(), database)) {
            liquibase.update((String) null);
        }
        log.info("Migrated governance store: {}", configuration.jdbcUrl);
    }
}
