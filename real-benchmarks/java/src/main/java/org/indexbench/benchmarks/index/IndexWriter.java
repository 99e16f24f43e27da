package org.indexbench.benchmarks.index;

import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Serializes the entries of one column into an index file.
 */
public interface IndexWriter {
    void write(ColumnEntries entries, DataOutputStream out) throws IOException;
}
