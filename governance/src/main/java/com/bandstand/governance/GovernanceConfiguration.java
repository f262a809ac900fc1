/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;

/**
 * Configuration of the governance store and engine, usually read from YAML. The defaults describe an in-memory
 * store migrated on start, with quorum informational only.
 */
public class GovernanceConfiguration {
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:mem:governance;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";

    /** Reject approvals whose participation is below the band's quorum percentage */
    public boolean enforceQuorum  = false;
    public String  jdbcUrl        = DEFAULT_JDBC_URL;
    public int     maxConnections = 10;
    /** Apply the schema change log before first use */
    public boolean migrate        = true;
    public String  password       = "";
    public String  user           = "";

    public static GovernanceConfiguration load(InputStream yaml) throws IOException {
        return mapper().readValue(yaml, GovernanceConfiguration.class);
    }

    public static GovernanceConfiguration load(URL yaml) throws IOException {
        try (var is = yaml.openStream()) {
            return load(is);
        }
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory()).configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                                                               true);
    }

    public QuorumPolicy quorumPolicy() {
        return enforceQuorum ? QuorumPolicy.bandQuorum() : QuorumPolicy.NONE;
    }

    @Override
    public String toString() {
        return "GovernanceConfiguration [jdbcUrl=" + jdbcUrl + ", maxConnections=" + maxConnections + ", migrate="
        + migrate + ", enforceQuorum=" + enforceQuorum + "]";
    }
}
