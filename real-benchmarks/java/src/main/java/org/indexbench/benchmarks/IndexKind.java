package org.indexbench.benchmarks;

import org.indexbench.benchmarks.index.BitmapIndexWriter;
import org.indexbench.benchmarks.index.IndexWriter;
import org.indexbench.benchmarks.index.OrderedIndexWriter;

/**
 * Index structures under comparison. Each kind owns its report label, the file suffix its
 * index is stored under, and the writer that builds it.
 */
public enum IndexKind {
    ORDERED("Btree", "btree") {
        @Override
        public IndexWriter newWriter() {
            return new OrderedIndexWriter();
        }
    },
    BITMAP("Bitmap", "bitmap") {
        @Override
        public IndexWriter newWriter() {
            return new BitmapIndexWriter();
        }
    };

    private final String label;
    private final String fileSuffix;

    IndexKind(String label, String fileSuffix) {
        this.label = label;
        this.fileSuffix = fileSuffix;
    }

    public String label() {
        return label;
    }

    public String fileSuffix() {
        return fileSuffix;
    }

    public abstract IndexWriter newWriter();

    public static String indexName(String table, String column) {
        return table + "_" + column + "_index";
    }
}
