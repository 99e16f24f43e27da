package org.indexbench.benchmarks.generator;

import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.indexbench.benchmarks.StorageFormat;
import org.indexbench.benchmarks.store.TableData;
import org.indexbench.benchmarks.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic stand-in for dsdgen. Writes {@code scale * 10,000} rows of
 * {@code store_sales}; {@code ss_item_sk} walks a permutation of {@code [0, scale * 1000)}
 * so that every item key, including the maximum, occurs.
 */
public class SyntheticStoreSalesGenerator implements DatasetGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(SyntheticStoreSalesGenerator.class);

    public static final int ROWS_PER_SCALE = 10_000;
    public static final int ITEMS_PER_SCALE = 1_000;
    public static final int CUSTOMERS_PER_SCALE = 2_000;

    private static final int FIRST_DATE_SK = 2_450_816;
    private static final int DATE_RANGE = 1_823;
    private static final int STORES = 12;
    private static final int ITEM_STRIDE = 7_919;

    private final TableStore tables;
    private final long seed;

    public SyntheticStoreSalesGenerator(TableStore tables) {
        this(tables, 42L);
    }

    public SyntheticStoreSalesGenerator(TableStore tables, long seed) {
        this.tables = tables;
        this.seed = seed;
    }

    @Override
    public void generate(String location, StorageFormat format, int scale, int partitions, String tableSelection)
            throws IOException {
        if (!StoreSales.TABLE.equals(tableSelection)) {
            throw new IllegalArgumentException("Synthetic generator only produces " + StoreSales.TABLE
                    + ", not " + tableSelection);
        }

        long totalRows = (long) scale * ROWS_PER_SCALE;
        int itemCount = scale * ITEMS_PER_SCALE;
        int customerCount = scale * CUSTOMERS_PER_SCALE;
        int stride = strideFor(itemCount);
        int files = (int) Math.max(1, Math.min(partitions, totalRows));
        long rowsPerFile = (totalRows + files - 1) / files;
        String tableLocation = location + tableSelection;

        LOG.info("Generating {} rows of {} in {} files at {}", totalRows, tableSelection, files, tableLocation);
        Random random = new Random(seed);
        long row = 0;
        for (int file = 0; file < files; file++) {
            long end = Math.min(totalRows, row + rowsPerFile);
            List<Record> records = new ArrayList<>((int) (end - row));
            for (; row < end; row++) {
                records.add(nextRow(random, row, itemCount, customerCount, stride));
            }
            TableData part = TableData.of(StoreSales.SCHEMA, records);
            if (file == 0) {
                tables.writeTable(part, tableLocation, format, TableStore.WriteMode.OVERWRITE);
            } else {
                tables.writeTable(part, tableLocation, format, TableStore.WriteMode.APPEND);
            }
        }
    }

    private static Record nextRow(Random random, long row, int itemCount, int customerCount, int stride) {
        Record record = GenericRecord.create(StoreSales.SCHEMA);
        int quantity = 1 + random.nextInt(100);
        double price = Math.round(random.nextDouble() * 20_000) / 100.0;
        record.setField(StoreSales.SOLD_DATE_SK, FIRST_DATE_SK + random.nextInt(DATE_RANGE));
        record.setField(StoreSales.ITEM_SK, (int) ((row * stride) % itemCount));
        // roughly 2% of sales have no customer, as in dsdgen output
        record.setField(StoreSales.CUSTOMER_SK, random.nextInt(50) == 0 ? null : 1 + random.nextInt(customerCount));
        record.setField(StoreSales.STORE_SK, 1 + random.nextInt(STORES));
        record.setField(StoreSales.TICKET_NUMBER, row / 10 + 1);
        record.setField(StoreSales.QUANTITY, quantity);
        record.setField(StoreSales.SALES_PRICE, price);
        record.setField(StoreSales.NET_PROFIT, Math.round((random.nextDouble() - 0.5) * price * quantity * 100) / 100.0);
        return record;
    }

    static int strideFor(int itemCount) {
        int stride = ITEM_STRIDE;
        while (gcd(stride, itemCount) != 1) {
            stride += 2;
        }
        return stride;
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
