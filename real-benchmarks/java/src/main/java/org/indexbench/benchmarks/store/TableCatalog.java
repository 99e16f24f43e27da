package org.indexbench.benchmarks.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.iceberg.exceptions.AlreadyExistsException;
import org.apache.iceberg.exceptions.NoSuchNamespaceException;
import org.apache.iceberg.exceptions.NoSuchTableException;
import org.indexbench.benchmarks.StorageFormat;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Table registrations, one JSON document per database under {@code <root>/_catalog/}.
 * Registrations survive the process so that index building can run separately from
 * table generation.
 */
public class TableCatalog {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path catalogDir;
    private final Configuration conf;

    public TableCatalog(String root, Configuration conf) {
        this.catalogDir = new Path(root, "_catalog");
        this.conf = conf;
    }

    public boolean databaseExists(String database) throws IOException {
        Path file = databaseFile(database);
        return fs().exists(file);
    }

    /**
     * @return whether the database was created by this call
     */
    public boolean createDatabase(String database) throws IOException {
        if (databaseExists(database)) {
            return false;
        }
        DatabaseEntry entry = new DatabaseEntry();
        entry.name = database;
        save(entry);
        return true;
    }

    public void register(String database, String table, String location, StorageFormat format) throws IOException {
        DatabaseEntry entry = load(database);
        if (entry.tables.containsKey(table)) {
            throw new AlreadyExistsException("Table already exists: %s.%s", database, table);
        }
        TableEntry tableEntry = new TableEntry();
        tableEntry.location = location;
        tableEntry.format = format.name();
        entry.tables.put(table, tableEntry);
        save(entry);
    }

    public boolean unregister(String database, String table) throws IOException {
        DatabaseEntry entry = load(database);
        if (entry.tables.remove(table) == null) {
            return false;
        }
        save(entry);
        return true;
    }

    public boolean contains(String database, String table) throws IOException {
        return load(database).tables.containsKey(table);
    }

    public TableDescriptor describe(String database, String table) throws IOException {
        TableEntry entry = load(database).tables.get(table);
        if (entry == null) {
            throw new NoSuchTableException("Table does not exist: %s.%s", database, table);
        }
        return new TableDescriptor(database, table, entry.location, StorageFormat.of(entry.format));
    }

    private DatabaseEntry load(String database) throws IOException {
        Path file = databaseFile(database);
        FileSystem fs = fs();
        if (!fs.exists(file)) {
            throw new NoSuchNamespaceException("Database does not exist: %s", database);
        }
        try (FSDataInputStream in = fs.open(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            DatabaseEntry entry = GSON.fromJson(reader, DatabaseEntry.class);
            if (entry == null) {
                throw new IOException("Empty catalog file " + file);
            }
            if (entry.tables == null) {
                entry.tables = new LinkedHashMap<>();
            }
            return entry;
        } catch (JsonParseException e) {
            throw new IOException("Corrupt catalog file " + file, e);
        }
    }

    private void save(DatabaseEntry entry) throws IOException {
        Path file = databaseFile(entry.name);
        try (FSDataOutputStream out = fs().create(file, true);
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            GSON.toJson(entry, writer);
        }
    }

    private Path databaseFile(String database) {
        return new Path(catalogDir, database + ".json");
    }

    private FileSystem fs() throws IOException {
        return catalogDir.getFileSystem(conf);
    }

    static class DatabaseEntry {
        String name;
        Map<String, TableEntry> tables = new LinkedHashMap<>();
    }

    static class TableEntry {
        String location;
        String format;
    }
}
