package org.indexbench.benchmarks;

import org.indexbench.benchmarks.store.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an index from scratch and measures what it cost.
 */
public class IndexBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(IndexBuilder.class);

    private final IndexStore indexes;

    public IndexBuilder(IndexStore indexes) {
        this.indexes = indexes;
    }

    /**
     * Drops {@code <table>_<column>_index} if present, creates it as {@code kind} and measures
     * it. Only the create call is timed. Creation failures propagate unchanged.
     *
     * @param location directory holding the table, as produced by {@link NamingPolicy}
     */
    public IndexCostRecord buildIndex(IndexKind kind, String location, String table, String column) throws IOException {
        String indexName = IndexKind.indexName(table, column);
        if (indexes.indexExists(table, indexName)) {
            indexes.dropIndex(table, indexName);
        } else {
            LOG.warn("Index {} doesn't exist, so don't need to drop here!", indexName);
        }

        long start = System.nanoTime();
        indexes.createIndexIfNotAbsent(table, column, kind);
        long elapsed = System.nanoTime() - start;

        String size = indexes.indexSizeOnDisk(table, location, column);
        IndexCostRecord record = new IndexCostRecord(kind.label(), elapsed, size);
        LOG.info("{} index on {}.{}: {}", kind.label(), table, column, record);
        return record;
    }

    /**
     * Builds the Btree index on {@code orderedColumn}, then the Bitmap index on
     * {@code bitmapColumn}. The returned list is always in that order.
     */
    public List<IndexCostRecord> buildTableIndexes(String location, String table,
                                                   String orderedColumn, String bitmapColumn) throws IOException {
        List<IndexCostRecord> costs = new ArrayList<>(2);
        costs.add(buildIndex(IndexKind.ORDERED, location, table, orderedColumn));
        costs.add(buildIndex(IndexKind.BITMAP, location, table, bitmapColumn));
        return costs;
    }
}
