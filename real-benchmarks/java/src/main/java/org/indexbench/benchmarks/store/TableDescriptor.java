package org.indexbench.benchmarks.store;

import org.indexbench.benchmarks.StorageFormat;

/**
 * Where a registered table lives and how it is encoded.
 */
public final class TableDescriptor {
    public final String database;
    public final String name;
    public final String location;
    public final StorageFormat format;

    public TableDescriptor(String database, String name, String location, StorageFormat format) {
        this.database = database;
        this.name = name;
        this.location = location;
        this.format = format;
    }

    @Override
    public String toString() {
        return database + "." + name + " (" + format + " at " + location + ")";
    }
}
