package org.yaric.catalog;

public class UnknownIndexException extends Exception {

    private final String indexName;

    public UnknownIndexException(final String indexName, final String message) {
        super(message);
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }
}
