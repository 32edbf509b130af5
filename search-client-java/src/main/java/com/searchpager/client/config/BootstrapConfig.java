package com.searchpager.client.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One-shot administrative steps run before the retrieval.
 */
@Data
@NoArgsConstructor
public class BootstrapConfig {

    private boolean createIndex = false;

    /** Number of users to seed; {@code 0} disables seeding. */
    private int seedCount = 0;
}
