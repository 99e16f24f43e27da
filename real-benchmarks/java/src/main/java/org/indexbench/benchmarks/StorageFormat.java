package org.indexbench.benchmarks;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Name of a physical table encoding under test. The set of formats comes from
 * configuration, so any name is accepted here; only the table store decides which
 * names it can actually read and write.
 */
public final class StorageFormat {
    public static final StorageFormat PARQUET = new StorageFormat("parquet");
    public static final StorageFormat AVRO = new StorageFormat("avro");

    private final String name;

    private StorageFormat(String name) {
        this.name = name;
    }

    public static StorageFormat of(String name) {
        Objects.requireNonNull(name, "format name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Empty storage format name");
        }
        return new StorageFormat(normalized);
    }

    static List<StorageFormat> parseList(String csv) {
        Set<StorageFormat> formats = new LinkedHashSet<>();
        for (String part : csv.split(",")) {
            if (!part.trim().isEmpty()) {
                formats.add(of(part));
            }
        }
        return new ArrayList<>(formats);
    }

    public String name() {
        return name;
    }

    public boolean isKnown() {
        return equals(PARQUET) || equals(AVRO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StorageFormat)) {
            return false;
        }
        return name.equals(((StorageFormat) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
