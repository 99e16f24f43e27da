package org.indexbench.benchmarks;

import org.indexbench.benchmarks.generator.DatasetGenerator;
import org.indexbench.benchmarks.generator.StoreSales;
import org.indexbench.benchmarks.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Provisions the per-format datasets and databases that indexes are built on.
 */
public class DatasetMaterializer {
    private static final Logger LOG = LoggerFactory.getLogger(DatasetMaterializer.class);

    static final String DEFAULT_TABLE_SELECTION = StoreSales.TABLE;

    private final BenchmarkConfig config;
    private final TableStore tables;
    private final DatasetGenerator generator;
    private final TableTransformer transformer;

    public DatasetMaterializer(BenchmarkConfig config, TableStore tables,
                               DatasetGenerator generator, TableTransformer transformer) {
        this.config = config;
        this.tables = tables;
        this.generator = generator;
        this.transformer = transformer;
    }

    /**
     * Generates the raw tables of every format, in order. Not idempotent: what happens to
     * data from an earlier run is up to the generator.
     */
    public void generateTables(List<StorageFormat> formats) throws IOException {
        for (StorageFormat format : formats) {
            tables.setCompressionCodec(format, config.compressionCodec());
            String location = NamingPolicy.tableLocation(config, format);
            LOG.info("Generating {} tables for format {} at {}", DEFAULT_TABLE_SELECTION, format, location);
            generator.generate(location, format, config.dataScale(), config.dataPartitions(), DEFAULT_TABLE_SELECTION);
        }
    }

    /**
     * Creates every format's database if missing, then derives the transformed and duplicate
     * tables for each format in turn.
     */
    public void generateDatabases(List<StorageFormat> formats) throws IOException {
        for (StorageFormat format : formats) {
            tables.createDatabase(NamingPolicy.databaseName(config, format));
        }
        for (StorageFormat format : formats) {
            tables.setCompressionCodec(format, config.compressionCodec());
            String database = NamingPolicy.databaseName(config, format);
            String location = NamingPolicy.tableLocation(config, format);
            long divisor = transformer.transform(database, location, format, StoreSales.TABLE, StoreSales.ITEM_SK);
            LOG.info("Derived {} in {} with divisor {}",
                    TableTransformer.derivedColumn(StoreSales.ITEM_SK), database, divisor);
        }
    }
}
