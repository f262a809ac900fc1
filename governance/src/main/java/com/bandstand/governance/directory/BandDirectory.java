/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.bandstand.governance.directory;

import java.util.Optional;

/**
 * Read only view of the governance configuration of bands
 */
public interface BandDirectory {

    /**
     * Answer the governance configuration of the band, or empty if the band does not exist
     */
    Optional<BandConfig> getBandConfig(String bandId);
}
