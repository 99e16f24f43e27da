package org.indexbench.benchmarks.store;

public class IndexNotFoundException extends RuntimeException {

    public IndexNotFoundException(String table, String indexName) {
        super("Index " + indexName + " does not exist on table " + table);
    }
}
