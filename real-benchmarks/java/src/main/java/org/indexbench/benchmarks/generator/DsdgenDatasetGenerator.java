package org.indexbench.benchmarks.generator;

import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.io.CloseableIterable;
import org.indexbench.benchmarks.StorageFormat;
import org.indexbench.benchmarks.store.TableData;
import org.indexbench.benchmarks.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the TPC-DS kit's {@code dsdgen} once per partition ({@code -parallel N -child i}) and
 * converts its pipe-delimited output into one data file per child.
 */
public class DsdgenDatasetGenerator implements DatasetGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(DsdgenDatasetGenerator.class);

    static final String RNG_SEED = "100";

    // positions of the kept columns in a dsdgen store_sales line
    private static final int SOLD_DATE_SK = 0;
    private static final int ITEM_SK = 2;
    private static final int CUSTOMER_SK = 3;
    private static final int STORE_SK = 7;
    private static final int TICKET_NUMBER = 9;
    private static final int QUANTITY = 10;
    private static final int SALES_PRICE = 13;
    private static final int NET_PROFIT = 22;

    private final TableStore tables;
    private final String toolDir;

    public DsdgenDatasetGenerator(TableStore tables, String toolDir) {
        this.tables = tables;
        this.toolDir = toolDir;
    }

    @Override
    public void generate(String location, StorageFormat format, int scale, int partitions, String tableSelection)
            throws IOException {
        if (!StoreSales.TABLE.equals(tableSelection)) {
            throw new IllegalArgumentException("Only " + StoreSales.TABLE + " is supported, not " + tableSelection);
        }
        File dsdgen = new File(toolDir, "dsdgen");
        if (!dsdgen.canExecute()) {
            throw new IOException("dsdgen not found or not executable at " + dsdgen.getAbsolutePath());
        }

        String tableLocation = location + tableSelection;
        for (int child = 1; child <= partitions; child++) {
            Path output = Files.createTempFile("dsdgen-" + tableSelection + "-" + child + "-", ".dat");
            try {
                runDsdgen(command(dsdgen, tableSelection, scale, partitions, child), output.toFile());
                Stream<String> lines = Files.lines(output, StandardCharsets.UTF_8);
                Iterable<Record> rows = () -> lines
                        .filter(line -> !line.isEmpty())
                        .map(DsdgenDatasetGenerator::parseRow)
                        .iterator();
                try (TableData part = new TableData(StoreSales.SCHEMA, CloseableIterable.combine(rows, lines::close))) {
                    if (child == 1) {
                        tables.writeTable(part, tableLocation, format, TableStore.WriteMode.OVERWRITE);
                    } else {
                        tables.writeTable(part, tableLocation, format, TableStore.WriteMode.APPEND);
                    }
                }
                LOG.info("dsdgen child {}/{} written to {}", child, partitions, tableLocation);
            } finally {
                Files.deleteIfExists(output);
            }
        }
    }

    List<String> command(File dsdgen, String table, int scale, int partitions, int child) {
        List<String> command = new ArrayList<>();
        command.add(dsdgen.getAbsolutePath());
        command.add("-table");
        command.add(table);
        command.add("-filter");
        command.add("Y");
        command.add("-scale");
        command.add(String.valueOf(scale));
        command.add("-RNGSEED");
        command.add(RNG_SEED);
        if (partitions > 1) {
            command.add("-parallel");
            command.add(String.valueOf(partitions));
            command.add("-child");
            command.add(String.valueOf(child));
        }
        return command;
    }

    private void runDsdgen(List<String> command, File output) throws IOException {
        LOG.info("Running {}", String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .directory(new File(toolDir))
                .redirectOutput(output)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("dsdgen exited with code " + exitCode + ": " + String.join(" ", command));
            }
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for dsdgen");
        }
    }

    /**
     * Converts one {@code |}-separated dsdgen line. Empty fields are nulls.
     */
    static Record parseRow(String line) {
        String[] fields = line.split("\\|", -1);
        if (fields.length <= NET_PROFIT) {
            throw new IllegalArgumentException("Malformed store_sales line with " + fields.length + " fields: " + line);
        }
        Record record = GenericRecord.create(StoreSales.SCHEMA);
        record.setField(StoreSales.SOLD_DATE_SK, parseInt(fields[SOLD_DATE_SK]));
        record.setField(StoreSales.ITEM_SK, parseInt(fields[ITEM_SK]));
        record.setField(StoreSales.CUSTOMER_SK, parseInt(fields[CUSTOMER_SK]));
        record.setField(StoreSales.STORE_SK, parseInt(fields[STORE_SK]));
        record.setField(StoreSales.TICKET_NUMBER, parseLong(fields[TICKET_NUMBER]));
        record.setField(StoreSales.QUANTITY, parseInt(fields[QUANTITY]));
        record.setField(StoreSales.SALES_PRICE, parseDouble(fields[SALES_PRICE]));
        record.setField(StoreSales.NET_PROFIT, parseDouble(fields[NET_PROFIT]));
        return record;
    }

    private static Integer parseInt(String field) {
        return field.isEmpty() ? null : Integer.valueOf(field);
    }

    private static Long parseLong(String field) {
        return field.isEmpty() ? null : Long.valueOf(field);
    }

    private static Double parseDouble(String field) {
        return field.isEmpty() ? null : Double.valueOf(field);
    }
}
