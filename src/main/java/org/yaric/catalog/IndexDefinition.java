package org.yaric.catalog;

import java.util.Set;

/**
 * A resolved index: its fully expanded formula and the band symbols the formula reads.
 */
public record IndexDefinition(String name, String formula, Set<String> requiredBands) {

    public IndexDefinition {
        requiredBands = Set.copyOf(requiredBands);
    }
}
