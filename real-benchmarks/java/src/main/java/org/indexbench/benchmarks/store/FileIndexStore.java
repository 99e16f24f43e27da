package org.indexbench.benchmarks.store;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.StringUtils;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;
import org.indexbench.benchmarks.IndexKind;
import org.indexbench.benchmarks.index.ColumnEntries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Keeps each index as a single file {@code <table dir>/_index/<index name>.<kind suffix>}
 * next to the table's data files.
 */
public class FileIndexStore implements IndexStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileIndexStore.class);

    static final String INDEX_DIR = "_index";

    private final TableStore tables;
    private final Configuration conf;

    public FileIndexStore(TableStore tables, Configuration conf) {
        this.tables = tables;
        this.conf = conf;
    }

    @Override
    public boolean indexExists(String table, String indexName) throws IOException {
        return indexFiles(indexDir(table), indexName).length > 0;
    }

    @Override
    public void dropIndex(String table, String indexName) throws IOException {
        Path dir = indexDir(table);
        FileStatus[] files = indexFiles(dir, indexName);
        if (files.length == 0) {
            throw new IndexNotFoundException(table, indexName);
        }
        FileSystem fs = dir.getFileSystem(conf);
        for (FileStatus file : files) {
            if (!fs.delete(file.getPath(), false)) {
                throw new IOException("Failed to delete index file " + file.getPath());
            }
        }
        LOG.info("Dropped index {} on {}", indexName, table);
    }

    @Override
    public void createIndexIfNotAbsent(String table, String column, IndexKind kind) throws IOException {
        String indexName = IndexKind.indexName(table, column);
        if (indexExists(table, indexName)) {
            LOG.info("Index {} already exists on {}, skip building", indexName, table);
            return;
        }

        TableDescriptor descriptor = tables.describeTable(table);
        ColumnEntries entries = scanColumn(descriptor, column);

        Path file = new Path(indexDir(table), indexName + "." + kind.fileSuffix());
        FileSystem fs = file.getFileSystem(conf);
        try (FSDataOutputStream raw = fs.create(file, false);
             DataOutputStream out = new DataOutputStream(new BufferedOutputStream(raw))) {
            kind.newWriter().write(entries, out);
        }
        LOG.info("Built {} index {} over {} entries", kind.label(), indexName, entries.size());
    }

    @Override
    public String indexSizeOnDisk(String table, String location, String column) throws IOException {
        Path dir = new Path(new Path(location, table), INDEX_DIR);
        long size = 0;
        for (FileStatus file : indexFiles(dir, IndexKind.indexName(table, column))) {
            size += file.getLen();
        }
        return StringUtils.byteDesc(size);
    }

    private ColumnEntries scanColumn(TableDescriptor descriptor, String column) throws IOException {
        try (TableData data = tables.readTable(descriptor.location, descriptor.format)) {
            Types.NestedField field = data.schema().findField(column);
            if (field == null) {
                throw new IllegalArgumentException("Column " + column + " not found in " + descriptor);
            }
            Type.TypeID type = field.type().typeId();
            if (type != Type.TypeID.INTEGER && type != Type.TypeID.LONG) {
                throw new IllegalArgumentException(
                        "Cannot index column " + column + " of type " + field.type() + ", only int and long are supported");
            }

            ColumnEntries entries = new ColumnEntries();
            int rowId = 0;
            for (Record record : data.rows()) {
                Object value = record.getField(column);
                if (value != null) {
                    entries.add(rowId, ((Number) value).longValue());
                }
                rowId++;
            }
            return entries;
        }
    }

    private Path indexDir(String table) {
        return new Path(tables.describeTable(table).location, INDEX_DIR);
    }

    private FileStatus[] indexFiles(Path dir, String indexName) throws IOException {
        FileSystem fs = dir.getFileSystem(conf);
        if (!fs.exists(dir)) {
            return new FileStatus[0];
        }
        String prefix = indexName + ".";
        return fs.listStatus(dir, path -> path.getName().startsWith(prefix));
    }
}
