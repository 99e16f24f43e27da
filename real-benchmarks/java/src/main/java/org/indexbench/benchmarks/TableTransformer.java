package org.indexbench.benchmarks;

import org.apache.hadoop.util.StringUtils;
import org.apache.iceberg.Schema;
import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;
import org.indexbench.benchmarks.store.DataFileSystem;
import org.indexbench.benchmarks.store.TableData;
import org.indexbench.benchmarks.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Prepares a base table for the Btree vs Bitmap comparison.
 *
 * The key column is divided by {@code max(key) / 1000} into a new column
 * {@code <key>1} with at most about a thousand distinct values. The augmented data replaces
 * the base table in place and is also kept as {@code <table>_dup}, which other experiments
 * may use without disturbing the indexed table.
 */
public class TableTransformer {
    private static final Logger LOG = LoggerFactory.getLogger(TableTransformer.class);

    static final int TARGET_CARDINALITY = 1000;
    public static final String STAGING_SUFFIX = "1";
    public static final String DUPLICATE_SUFFIX = "_dup";

    private final TableStore tables;
    private final DataFileSystem fs;

    public TableTransformer(TableStore tables, DataFileSystem fs) {
        this.tables = tables;
        this.fs = fs;
    }

    public static String derivedColumn(String keyColumn) {
        return keyColumn + STAGING_SUFFIX;
    }

    /**
     * Runs the whole transform for one table. Any I/O failure before the tables are
     * registered again propagates and leaves the dataset to be regenerated.
     *
     * @param location database directory, with trailing slash
     * @return the divisor that was applied
     */
    public long transform(String database, String location, StorageFormat format,
                          String table, String keyColumn) throws IOException {
        String duplicate = table + DUPLICATE_SUFFIX;
        String baseLocation = location + table;
        String stagingLocation = location + table + STAGING_SUFFIX;
        String duplicateLocation = location + duplicate;

        tables.useDatabase(database);
        tables.dropTableIfExists(table);
        tables.dropTableIfExists(duplicate);

        final long divisor;
        try (TableData base = tables.readTable(baseLocation, format)) {
            Types.NestedField key = base.schema().findField(keyColumn);
            if (key == null) {
                throw new IllegalArgumentException("Column " + keyColumn + " not found in " + baseLocation);
            }
            if (key.type().typeId() != Type.TypeID.INTEGER && key.type().typeId() != Type.TypeID.LONG) {
                throw new IllegalArgumentException("Key column " + keyColumn + " must be int or long, not " + key.type());
            }

            long factor = divisor(maxValue(base, keyColumn));
            Schema derivedSchema = derivedSchema(base.schema(), key, derivedColumn(keyColumn));
            TableData derived = new TableData(derivedSchema,
                    CloseableIterable.transform(base.rows(), row -> derive(row, derivedSchema, key, factor)));
            tables.writeTable(derived, stagingLocation, format, TableStore.WriteMode.OVERWRITE);
            divisor = factor;
        }

        fs.delete(baseLocation, true);
        fs.delete(duplicateLocation, true);
        // the first copy must keep its source: the second one consumes it
        fs.copy(stagingLocation, baseLocation, false);
        fs.copy(stagingLocation, duplicateLocation, true);

        tables.createExternalTable(table, baseLocation, format);
        tables.createExternalTable(duplicate, duplicateLocation, format);

        logDiagnostics(table, baseLocation, format);
        return divisor;
    }

    static long divisor(long maxKey) {
        long divisor = maxKey / TARGET_CARDINALITY;
        if (divisor <= 0) {
            LOG.warn("Max key {} is below {}, using divisor 1", maxKey, TARGET_CARDINALITY);
            return 1;
        }
        return divisor;
    }

    private static long maxValue(TableData data, String column) {
        boolean found = false;
        long max = Long.MIN_VALUE;
        for (Record row : data.rows()) {
            Object value = row.getField(column);
            if (value != null) {
                max = Math.max(max, ((Number) value).longValue());
                found = true;
            }
        }
        if (!found) {
            throw new IllegalStateException("No non-null value in column " + column);
        }
        return max;
    }

    /**
     * Base columns followed by the derived one. A derived column left over from an earlier
     * run is replaced rather than duplicated.
     */
    static Schema derivedSchema(Schema base, Types.NestedField key, String derivedName) {
        List<Types.NestedField> fields = new ArrayList<>();
        for (Types.NestedField field : base.columns()) {
            if (!field.name().equals(derivedName)) {
                fields.add(field);
            }
        }
        fields.add(Types.NestedField.optional(base.highestFieldId() + 1, derivedName, key.type()));
        return new Schema(fields);
    }

    private static Record derive(Record row, Schema schema, Types.NestedField key, long divisor) {
        Record out = GenericRecord.create(schema);
        List<Types.NestedField> columns = schema.columns();
        for (int i = 0; i < columns.size() - 1; i++) {
            String name = columns.get(i).name();
            out.setField(name, row.getField(name));
        }
        Object value = row.getField(key.name());
        Object derived = null;
        if (value != null) {
            long quotient = ((Number) value).longValue() / divisor;
            derived = key.type().typeId() == Type.TypeID.INTEGER ? (Object) (int) quotient : (Object) quotient;
        }
        out.setField(columns.get(columns.size() - 1).name(), derived);
        return out;
    }

    private void logDiagnostics(String table, String location, StorageFormat format) {
        try {
            LOG.warn("File size of original table {} in {} format: {}",
                    table, format, StringUtils.byteDesc(tables.tableSize(location)));
            LOG.warn("Records of table {}: {}", table, tables.rowCount(location, format));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not measure table {} at {}", table, location, e);
        }
    }
}
