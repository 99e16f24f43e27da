package org.indexbench.benchmarks.store;

import org.indexbench.benchmarks.StorageFormat;

import java.io.IOException;

/**
 * Databases of external tables over format-encoded data directories.
 */
public interface TableStore {

    enum WriteMode {
        /** Replaces whatever is stored at the location. */
        OVERWRITE,
        /** Adds the rows as one more data file, creating the table if it does not exist yet. */
        APPEND
    }

    /**
     * Creates the database unless it already exists.
     */
    void createDatabase(String name) throws IOException;

    /**
     * Makes {@code name} the database that unqualified table names resolve against.
     *
     * @throws org.apache.iceberg.exceptions.NoSuchNamespaceException if it was never created
     */
    void useDatabase(String name) throws IOException;

    String currentDatabase();

    /**
     * Removes the table registration. The data directory is left untouched.
     *
     * @return whether a registration was removed
     */
    boolean dropTableIfExists(String name) throws IOException;

    /**
     * @throws org.apache.iceberg.exceptions.AlreadyExistsException if the name is taken
     */
    void createExternalTable(String name, String location, StorageFormat format) throws IOException;

    /**
     * @throws org.apache.iceberg.exceptions.NoSuchTableException if the table is not registered
     */
    TableDescriptor describeTable(String name);

    TableData readTable(String location, StorageFormat format) throws IOException;

    void writeTable(TableData data, String location, StorageFormat format, WriteMode mode) throws IOException;

    /**
     * Sets the write compression codec used for every later write in {@code format}.
     */
    void setCompressionCodec(StorageFormat format, String codec);

    long rowCount(String location, StorageFormat format) throws IOException;

    /**
     * Bytes occupied by the table's data files at {@code location}.
     */
    long tableSize(String location) throws IOException;
}
