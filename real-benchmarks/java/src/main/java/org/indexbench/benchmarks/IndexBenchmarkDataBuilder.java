package org.indexbench.benchmarks;

import org.apache.hadoop.conf.Configuration;
import org.indexbench.benchmarks.generator.DatasetGenerator;
import org.indexbench.benchmarks.generator.DsdgenDatasetGenerator;
import org.indexbench.benchmarks.generator.StoreSales;
import org.indexbench.benchmarks.generator.SyntheticStoreSalesGenerator;
import org.indexbench.benchmarks.store.DataFileSystem;
import org.indexbench.benchmarks.store.FileIndexStore;
import org.indexbench.benchmarks.store.HadoopDataFileSystem;
import org.indexbench.benchmarks.store.HadoopTableStore;
import org.indexbench.benchmarks.store.IndexStore;
import org.indexbench.benchmarks.store.TableCatalog;
import org.indexbench.benchmarks.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Builds the index cost benchmark data set and measures Btree and Bitmap index construction
 * on it.
 *
 * The three steps may run in separate processes, since tables are registered in a catalog
 * persisted under the root directory:
 * <ol>
 *   <li>{@link #generateTables()} writes the raw {@code store_sales} data per format</li>
 *   <li>{@link #generateDatabases()} derives {@code ss_item_sk1} and the duplicate table</li>
 *   <li>{@link #buildAllIndex()} builds both indexes per format and prints the report</li>
 * </ol>
 */
public class IndexBenchmarkDataBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(IndexBenchmarkDataBuilder.class);

    public static final String ORDERED_INDEX_COLUMN = StoreSales.CUSTOMER_SK;
    public static final String BITMAP_INDEX_COLUMN = TableTransformer.derivedColumn(StoreSales.ITEM_SK);

    private final BenchmarkConfig config;
    private final TableStore tables;
    private final DatasetMaterializer materializer;
    private final IndexBuilder indexBuilder;
    private final PrintStream out;

    public IndexBenchmarkDataBuilder(BenchmarkConfig config, TableStore tables, DataFileSystem fs,
                                     IndexStore indexes, DatasetGenerator generator, PrintStream out) {
        this.config = config;
        this.tables = tables;
        this.materializer = new DatasetMaterializer(config, tables, generator, new TableTransformer(tables, fs));
        this.indexBuilder = new IndexBuilder(indexes);
        this.out = out;
    }

    /**
     * Wires the Hadoop-backed stores for {@code config}, printing the report to stdout.
     */
    public static IndexBenchmarkDataBuilder create(BenchmarkConfig config) {
        Configuration conf = new Configuration();
        TableCatalog catalog = new TableCatalog(NamingPolicy.catalogRoot(config), conf);
        HadoopTableStore tables = new HadoopTableStore(conf, catalog);
        return new IndexBenchmarkDataBuilder(config, tables, new HadoopDataFileSystem(conf),
                new FileIndexStore(tables, conf), generatorFor(config, tables), System.out);
    }

    static DatasetGenerator generatorFor(BenchmarkConfig config, TableStore tables) {
        switch (config.generator()) {
            case "dsdgen":
                return new DsdgenDatasetGenerator(tables, config.tpcdsToolDir());
            case "synthetic":
                return new SyntheticStoreSalesGenerator(tables);
            default:
                throw new IllegalArgumentException("Unknown generator: " + config.generator());
        }
    }

    public void generateTables() throws IOException {
        generateTables(config.dataFormats());
    }

    public void generateTables(List<StorageFormat> formats) throws IOException {
        materializer.generateTables(formats);
    }

    public void generateDatabases() throws IOException {
        materializer.generateDatabases(config.dataFormats());
    }

    /**
     * Builds the Btree index on {@code ss_customer_sk} and the Bitmap index on
     * {@code ss_item_sk1} of every format's {@code store_sales}, then prints the report.
     * A failure aborts the remaining formats; results of completed formats stay in the
     * aggregator.
     */
    public ResultAggregator buildAllIndex() throws IOException {
        return buildAllIndex(new ResultAggregator());
    }

    ResultAggregator buildAllIndex(ResultAggregator results) throws IOException {
        for (StorageFormat format : config.dataFormats()) {
            tables.useDatabase(NamingPolicy.databaseName(config, format));
            String location = NamingPolicy.tableLocation(config, format);
            LOG.info("Building indexes for format {} at {}", format, location);
            List<IndexCostRecord> costs = indexBuilder.buildTableIndexes(
                    location, StoreSales.TABLE, ORDERED_INDEX_COLUMN, BITMAP_INDEX_COLUMN);
            results.record(ResultAggregator.testLabel(format), costs);
        }

        out.println("#" + engineName());
        out.print(results.render());
        out.flush();
        return results;
    }

    public String engineName() {
        return getClass().getCanonicalName();
    }
}
