package org.indexbench.benchmarks;

import org.indexbench.benchmarks.store.IndexNotFoundException;
import org.indexbench.benchmarks.store.IndexStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexBuilderTest {

    /**
     * Keeps indexes in memory and records every call.
     */
    static class RecordingIndexStore implements IndexStore {
        final Map<String, IndexKind> indexes = new HashMap<>();
        final List<String> calls = new ArrayList<>();
        IOException createFailure;

        @Override
        public boolean indexExists(String table, String indexName) {
            calls.add("exists " + indexName);
            return indexes.containsKey(indexName);
        }

        @Override
        public void dropIndex(String table, String indexName) {
            calls.add("drop " + indexName);
            if (indexes.remove(indexName) == null) {
                throw new IndexNotFoundException(table, indexName);
            }
        }

        @Override
        public void createIndexIfNotAbsent(String table, String column, IndexKind kind) throws IOException {
            calls.add("create " + IndexKind.indexName(table, column) + " " + kind.label());
            if (createFailure != null) {
                throw createFailure;
            }
            indexes.putIfAbsent(IndexKind.indexName(table, column), kind);
        }

        @Override
        public String indexSizeOnDisk(String table, String location, String column) {
            calls.add("size " + location + table + "/" + column);
            return "12 KB";
        }
    }

    @Test
    void missingIndexIsCreatedWithoutDrop() throws IOException {
        RecordingIndexStore store = new RecordingIndexStore();

        IndexCostRecord record = new IndexBuilder(store)
                .buildIndex(IndexKind.ORDERED, "/db/", "store_sales", "ss_customer_sk");

        assertThat(store.calls).containsExactly(
                "exists store_sales_ss_customer_sk_index",
                "create store_sales_ss_customer_sk_index Btree",
                "size /db/store_sales/ss_customer_sk");
        assertThat(record.kindLabel).isEqualTo("Btree");
        assertThat(record.size).isEqualTo("12 KB");
        assertThat(record.buildTimeNanos).isGreaterThanOrEqualTo(0);
    }

    @Test
    void existingIndexIsDroppedAndRebuilt() throws IOException {
        RecordingIndexStore store = new RecordingIndexStore();
        store.indexes.put("store_sales_ss_item_sk1_index", IndexKind.ORDERED);

        new IndexBuilder(store).buildIndex(IndexKind.BITMAP, "/db/", "store_sales", "ss_item_sk1");

        assertThat(store.calls).containsSubsequence(
                "drop store_sales_ss_item_sk1_index",
                "create store_sales_ss_item_sk1_index Bitmap");
        assertThat(store.indexes).containsEntry("store_sales_ss_item_sk1_index", IndexKind.BITMAP);
    }

    @Test
    void tableIndexesAreReturnedBtreeFirst() throws IOException {
        RecordingIndexStore store = new RecordingIndexStore();

        List<IndexCostRecord> costs = new IndexBuilder(store)
                .buildTableIndexes("/db/", "store_sales", "ss_customer_sk", "ss_item_sk1");

        assertThat(costs).extracting(r -> r.kindLabel).containsExactly("Btree", "Bitmap");
        assertThat(store.indexes).containsOnlyKeys(
                "store_sales_ss_customer_sk_index", "store_sales_ss_item_sk1_index");
    }

    @Test
    void creationFailurePropagates() {
        RecordingIndexStore store = new RecordingIndexStore();
        store.createFailure = new IOException("disk full");

        assertThatThrownBy(() -> new IndexBuilder(store)
                .buildIndex(IndexKind.ORDERED, "/db/", "store_sales", "ss_customer_sk"))
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");
        assertThat(store.calls).noneMatch(call -> call.startsWith("size"));
    }

    @Test
    void indexNamesFollowTableAndColumn() {
        assertThat(IndexKind.indexName("store_sales", "ss_customer_sk")).isEqualTo("store_sales_ss_customer_sk_index");
        assertThat(IndexKind.ORDERED.label()).isEqualTo("Btree");
        assertThat(IndexKind.BITMAP.label()).isEqualTo("Bitmap");
    }
}
