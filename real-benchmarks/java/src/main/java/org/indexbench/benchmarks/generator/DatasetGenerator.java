package org.indexbench.benchmarks.generator;

import org.indexbench.benchmarks.StorageFormat;

import java.io.IOException;

/**
 * Produces raw benchmark tables under a database location. Re-running may overwrite or
 * duplicate data; callers treat generation as a one-off provisioning step.
 */
public interface DatasetGenerator {

    /**
     * Writes {@code tableSelection} to {@code location + tableSelection} in {@code format},
     * spread over {@code partitions} data files.
     */
    void generate(String location, StorageFormat format, int scale, int partitions, String tableSelection)
            throws IOException;
}
