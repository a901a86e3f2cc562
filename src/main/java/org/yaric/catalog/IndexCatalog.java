package org.yaric.catalog;

import java.util.Set;

/**
 * Lookup of index names to formulas.
 */
public interface IndexCatalog {

    /**
     * @throws UnknownIndexException when the name is not known or has no usable formula
     */
    IndexDefinition resolve(String indexName) throws UnknownIndexException;

    /** Names that {@link #resolve(String)} accepts. */
    Set<String> names();
}
