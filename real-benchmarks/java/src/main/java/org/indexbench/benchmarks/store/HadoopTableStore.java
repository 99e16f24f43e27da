package org.indexbench.benchmarks.store;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.iceberg.Schema;
import org.apache.iceberg.SchemaParser;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.avro.Avro;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.avro.DataReader;
import org.apache.iceberg.data.avro.DataWriter;
import org.apache.iceberg.data.parquet.GenericParquetReaders;
import org.apache.iceberg.data.parquet.GenericParquetWriter;
import org.apache.iceberg.exceptions.NoSuchNamespaceException;
import org.apache.iceberg.hadoop.HadoopInputFile;
import org.apache.iceberg.hadoop.HadoopOutputFile;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.io.FileAppender;
import org.apache.iceberg.io.InputFile;
import org.apache.iceberg.io.OutputFile;
import org.apache.iceberg.parquet.Parquet;
import org.indexbench.benchmarks.StorageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores each table as a directory of {@code part-NNNNN.<format>} files written with
 * Iceberg's generic Parquet and Avro writers, plus a hidden {@code _schema.json}.
 * Files whose names start with {@code _} or {@code .} are never treated as data.
 */
public class HadoopTableStore implements TableStore {
    private static final Logger LOG = LoggerFactory.getLogger(HadoopTableStore.class);

    static final String SCHEMA_FILE = "_schema.json";

    private final Configuration conf;
    private final TableCatalog catalog;
    private final Map<StorageFormat, String> codecs = new HashMap<>();
    private String currentDatabase;

    public HadoopTableStore(Configuration conf, TableCatalog catalog) {
        this.conf = conf;
        this.catalog = catalog;
    }

    @Override
    public void createDatabase(String name) throws IOException {
        if (catalog.createDatabase(name)) {
            LOG.info("Created database {}", name);
        }
    }

    @Override
    public void useDatabase(String name) throws IOException {
        if (!catalog.databaseExists(name)) {
            throw new NoSuchNamespaceException("Database does not exist: %s", name);
        }
        currentDatabase = name;
    }

    @Override
    public String currentDatabase() {
        if (currentDatabase == null) {
            throw new IllegalStateException("No database selected");
        }
        return currentDatabase;
    }

    @Override
    public boolean dropTableIfExists(String name) throws IOException {
        boolean dropped = catalog.unregister(currentDatabase(), name);
        if (!dropped) {
            LOG.warn("Table {}.{} doesn't exist, so don't need to drop here!", currentDatabase, name);
        }
        return dropped;
    }

    @Override
    public void createExternalTable(String name, String location, StorageFormat format) throws IOException {
        extension(format);
        catalog.register(currentDatabase(), name, location, format);
        LOG.info("Registered table {}.{} at {}", currentDatabase, name, location);
    }

    @Override
    public TableDescriptor describeTable(String name) {
        try {
            return catalog.describe(currentDatabase(), name);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public TableData readTable(String location, StorageFormat format) throws IOException {
        Path dir = new Path(location);
        Schema schema = readSchema(dir);
        List<CloseableIterable<Record>> parts = new ArrayList<>();
        for (FileStatus file : dataFiles(dir, format)) {
            parts.add(openReader(HadoopInputFile.fromPath(file.getPath(), conf), format, schema));
        }
        return new TableData(schema, CloseableIterable.concat(parts));
    }

    @Override
    public void writeTable(TableData data, String location, StorageFormat format, WriteMode mode) throws IOException {
        if (mode == WriteMode.APPEND) {
            append(data, location, format);
            return;
        }
        Path dir = new Path(location);
        FileSystem fs = dir.getFileSystem(conf);
        if (fs.exists(dir)) {
            fs.delete(dir, true);
        }
        fs.mkdirs(dir);
        writeSchema(dir, data.schema());
        long rows = writePart(data, new Path(dir, partName(0, format)), format);
        LOG.info("Wrote {} rows to {}", rows, location);
    }

    private void append(TableData data, String location, StorageFormat format) throws IOException {
        Path dir = new Path(location);
        FileSystem fs = dir.getFileSystem(conf);
        int next = 0;
        if (fs.exists(new Path(dir, SCHEMA_FILE))) {
            Schema existing = readSchema(dir);
            if (!existing.sameSchema(data.schema())) {
                throw new IllegalArgumentException("Schema mismatch appending to " + location);
            }
            next = dataFiles(dir, format).length;
        } else {
            fs.mkdirs(dir);
            writeSchema(dir, data.schema());
        }
        long rows = writePart(data, new Path(dir, partName(next, format)), format);
        LOG.info("Appended {} rows to {}", rows, location);
    }

    @Override
    public void setCompressionCodec(StorageFormat format, String codec) {
        codecs.put(format, codec);
    }

    @Override
    public long rowCount(String location, StorageFormat format) throws IOException {
        long count = 0;
        try (TableData data = readTable(location, format)) {
            for (Record ignored : data.rows()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public long tableSize(String location) throws IOException {
        Path dir = new Path(location);
        FileSystem fs = dir.getFileSystem(conf);
        long size = 0;
        for (FileStatus status : fs.listStatus(dir)) {
            if (status.isFile() && !isHidden(status.getPath())) {
                size += status.getLen();
            }
        }
        return size;
    }

    private long writePart(TableData data, Path file, StorageFormat format) throws IOException {
        long rows = 0;
        try (FileAppender<Record> appender = openWriter(HadoopOutputFile.fromPath(file, conf), format, data.schema())) {
            for (Record record : data.rows()) {
                appender.add(record);
                rows++;
            }
        }
        return rows;
    }

    private FileAppender<Record> openWriter(OutputFile file, StorageFormat format, Schema schema) throws IOException {
        String codec = codecs.get(format);
        if (StorageFormat.PARQUET.equals(format)) {
            Parquet.WriteBuilder builder = Parquet.write(file)
                    .schema(schema)
                    .createWriterFunc(GenericParquetWriter::buildWriter)
                    .overwrite();
            if (codec != null) {
                builder.set(TableProperties.PARQUET_COMPRESSION, codec);
            }
            return builder.build();
        } else if (StorageFormat.AVRO.equals(format)) {
            Avro.WriteBuilder builder = Avro.write(file)
                    .schema(schema)
                    .createWriterFunc(DataWriter::create)
                    .overwrite();
            if (codec != null) {
                builder.set(TableProperties.AVRO_COMPRESSION, codec);
            }
            return builder.build();
        }
        throw unsupported(format);
    }

    private CloseableIterable<Record> openReader(InputFile file, StorageFormat format, Schema schema) {
        if (StorageFormat.PARQUET.equals(format)) {
            return Parquet.read(file)
                    .project(schema)
                    .createReaderFunc(fileSchema -> GenericParquetReaders.buildReader(schema, fileSchema))
                    .build();
        } else if (StorageFormat.AVRO.equals(format)) {
            return Avro.read(file)
                    .project(schema)
                    .createReaderFunc(avroSchema -> DataReader.create(schema, avroSchema))
                    .build();
        }
        throw unsupported(format);
    }

    private FileStatus[] dataFiles(Path dir, StorageFormat format) throws IOException {
        FileSystem fs = dir.getFileSystem(conf);
        if (!fs.exists(dir)) {
            throw new FileNotFoundException("Table location does not exist: " + dir);
        }
        String suffix = "." + extension(format);
        FileStatus[] files = fs.listStatus(dir,
                path -> !isHidden(path) && path.getName().endsWith(suffix));
        Arrays.sort(files, Comparator.comparing(status -> status.getPath().getName()));
        return files;
    }

    private Schema readSchema(Path dir) throws IOException {
        Path file = new Path(dir, SCHEMA_FILE);
        FileSystem fs = dir.getFileSystem(conf);
        if (!fs.exists(file)) {
            throw new FileNotFoundException("No table at " + dir + ": missing " + SCHEMA_FILE);
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (FSDataInputStream in = fs.open(file)) {
            in.transferTo(buffer);
        }
        return SchemaParser.fromJson(buffer.toString(StandardCharsets.UTF_8));
    }

    private void writeSchema(Path dir, Schema schema) throws IOException {
        FileSystem fs = dir.getFileSystem(conf);
        try (FSDataOutputStream out = fs.create(new Path(dir, SCHEMA_FILE), true)) {
            out.write(SchemaParser.toJson(schema).getBytes(StandardCharsets.UTF_8));
        }
    }

    static boolean isHidden(Path path) {
        String name = path.getName();
        return name.startsWith("_") || name.startsWith(".");
    }

    private static String partName(int index, StorageFormat format) {
        return String.format("part-%05d.%s", index, extension(format));
    }

    private static String extension(StorageFormat format) {
        if (StorageFormat.PARQUET.equals(format) || StorageFormat.AVRO.equals(format)) {
            return format.name();
        }
        throw unsupported(format);
    }

    private static IllegalArgumentException unsupported(StorageFormat format) {
        return new IllegalArgumentException("Unsupported storage format: " + format);
    }
}
