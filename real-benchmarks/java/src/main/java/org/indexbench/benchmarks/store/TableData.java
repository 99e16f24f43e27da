package org.indexbench.benchmarks.store;

import org.apache.iceberg.Schema;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.io.CloseableIterable;

import java.io.Closeable;
import java.io.IOException;

/**
 * A schema plus a lazily-read sequence of rows. The rows may be iterated more than once;
 * every pass re-reads the underlying files.
 */
public class TableData implements Closeable {
    private final Schema schema;
    private final CloseableIterable<Record> rows;

    public TableData(Schema schema, CloseableIterable<Record> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static TableData of(Schema schema, Iterable<Record> rows) {
        return new TableData(schema, CloseableIterable.withNoopClose(rows));
    }

    public Schema schema() {
        return schema;
    }

    public CloseableIterable<Record> rows() {
        return rows;
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }
}
