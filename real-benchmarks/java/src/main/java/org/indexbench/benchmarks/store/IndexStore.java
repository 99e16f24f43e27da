package org.indexbench.benchmarks.store;

import org.indexbench.benchmarks.IndexKind;

import java.io.IOException;

/**
 * Secondary indexes over tables of the current database.
 */
public interface IndexStore {

    boolean indexExists(String table, String indexName) throws IOException;

    /**
     * @throws IndexNotFoundException if there is no such index
     */
    void dropIndex(String table, String indexName) throws IOException;

    /**
     * Builds {@code <table>_<column>_index} of the given kind unless an index of that name
     * already exists.
     */
    void createIndexIfNotAbsent(String table, String column, IndexKind kind) throws IOException;

    /**
     * Human-readable size of the index on {@code column} of the table stored under
     * {@code location}.
     */
    String indexSizeOnDisk(String table, String location, String column) throws IOException;
}
