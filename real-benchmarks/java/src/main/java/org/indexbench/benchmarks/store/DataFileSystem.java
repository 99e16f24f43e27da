package org.indexbench.benchmarks.store;

import java.io.IOException;

/**
 * File operations the benchmark performs directly on dataset directories.
 */
public interface DataFileSystem {

    /**
     * @return whether anything was deleted
     */
    boolean delete(String path, boolean recursive) throws IOException;

    /**
     * Copies a file or directory tree. With {@code deleteSource} the source is removed once
     * the copy has completed.
     */
    void copy(String src, String dst, boolean deleteSource) throws IOException;
}
