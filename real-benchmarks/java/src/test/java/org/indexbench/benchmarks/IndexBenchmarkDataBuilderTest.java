package org.indexbench.benchmarks;

import org.apache.hadoop.conf.Configuration;
import org.indexbench.benchmarks.generator.DsdgenDatasetGenerator;
import org.indexbench.benchmarks.generator.SyntheticStoreSalesGenerator;
import org.indexbench.benchmarks.store.FileIndexStore;
import org.indexbench.benchmarks.store.HadoopDataFileSystem;
import org.indexbench.benchmarks.store.HadoopTableStore;
import org.indexbench.benchmarks.store.IndexStore;
import org.indexbench.benchmarks.store.TableCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexBenchmarkDataBuilderTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private IndexBenchmarkDataBuilder builder(BenchmarkConfig config) {
        Configuration conf = new Configuration();
        HadoopTableStore tables = new HadoopTableStore(conf, new TableCatalog(NamingPolicy.catalogRoot(config), conf));
        return new IndexBenchmarkDataBuilder(config, tables, new HadoopDataFileSystem(conf),
                new FileIndexStore(tables, conf), new SyntheticStoreSalesGenerator(tables),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void fullRunOnParquetReportsBothIndexes() throws IOException {
        BenchmarkConfig config = ConfigFixtures.config(dir, 10, 2, "parquet");
        IndexBenchmarkDataBuilder builder = builder(config);

        builder.generateTables();
        builder.generateDatabases();
        ResultAggregator results = builder.buildAllIndex();

        Path database = dir.resolve("0.4.0/tpcds/parquet_tpcds_10");
        assertThat(Files.isDirectory(database.resolve("store_sales"))).isTrue();
        assertThat(Files.isDirectory(database.resolve("store_sales_dup"))).isTrue();
        assertThat(Files.exists(database.resolve("store_sales1"))).isFalse();
        assertThat(database.resolve("store_sales/_index/store_sales_ss_customer_sk_index.btree")).exists();
        assertThat(database.resolve("store_sales/_index/store_sales_ss_item_sk1_index.bitmap")).exists();

        assertThat(results.results()).containsOnlyKeys("parquet index cost");
        assertThat(results.results().get("parquet index cost"))
                .extracting(r -> r.kindLabel).containsExactly("Btree", "Bitmap");
        for (IndexCostRecord record : results.results().get("parquet index cost")) {
            assertThat(record.buildTimeNanos).isPositive();
            assertThat(record.size).isNotEmpty();
        }

        String report = output.toString(StandardCharsets.UTF_8);
        assertThat(report).startsWith("#" + IndexBenchmarkDataBuilder.class.getCanonicalName() + "\n");
        assertThat(report).contains("##parquet index cost\n| Index ");
        assertThat(report.indexOf("| Btree")).isLessThan(report.indexOf("| Bitmap"));
    }

    @Test
    void rebuildingIndexesIsRepeatable() throws IOException {
        BenchmarkConfig config = ConfigFixtures.config(dir, 1, 1, "parquet,avro");
        IndexBenchmarkDataBuilder builder = builder(config);
        builder.generateTables();
        builder.generateDatabases();

        ResultAggregator first = builder.buildAllIndex();
        ResultAggregator second = builder.buildAllIndex();

        assertThat(second.results().keySet()).containsExactly("parquet index cost", "avro index cost");
        for (ResultAggregator run : new ResultAggregator[] {first, second}) {
            for (List<IndexCostRecord> records : run.results().values()) {
                assertThat(records).hasSize(2);
                assertThat(records).allSatisfy(record -> assertThat(record.buildTimeNanos).isNotNegative());
            }
        }
        for (String label : first.results().keySet()) {
            for (int i = 0; i < 2; i++) {
                assertThat(second.results().get(label).get(i).size)
                        .isEqualTo(first.results().get(label).get(i).size);
            }
        }

        String report = output.toString(StandardCharsets.UTF_8);
        assertThat(report.indexOf("##parquet index cost")).isLessThan(report.indexOf("##avro index cost"));
    }

    @Test
    void failedFormatKeepsEarlierResults() throws IOException {
        BenchmarkConfig config = ConfigFixtures.config(dir, 1, 1, "parquet,avro");
        IndexBenchmarkDataBuilder setup = builder(config);
        setup.generateTables();
        setup.generateDatabases();

        Configuration conf = new Configuration();
        HadoopTableStore tables = new HadoopTableStore(conf, new TableCatalog(NamingPolicy.catalogRoot(config), conf));
        IOException failure = new IOException("index volume unavailable");
        IndexStore indexes = new FileIndexStore(tables, conf) {
            @Override
            public void createIndexIfNotAbsent(String table, String column, IndexKind kind) throws IOException {
                if (tables.currentDatabase().startsWith("avro")) {
                    throw failure;
                }
                super.createIndexIfNotAbsent(table, column, kind);
            }
        };
        IndexBenchmarkDataBuilder builder = new IndexBenchmarkDataBuilder(config, tables,
                new HadoopDataFileSystem(conf), indexes, new SyntheticStoreSalesGenerator(tables),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        ResultAggregator results = new ResultAggregator();

        assertThatThrownBy(() -> builder.buildAllIndex(results)).isSameAs(failure);

        assertThat(results.results()).containsOnlyKeys("parquet index cost");
        assertThat(results.results().get("parquet index cost"))
                .extracting(r -> r.kindLabel).containsExactly("Btree", "Bitmap");
        assertThat(output.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void generatorFollowsConfig() {
        BenchmarkConfig config = ConfigFixtures.config(dir, 1, 1, "parquet");
        Configuration conf = new Configuration();
        HadoopTableStore tables = new HadoopTableStore(conf, new TableCatalog(dir.toString(), conf));

        assertThat(IndexBenchmarkDataBuilder.generatorFor(config, tables))
                .isInstanceOf(SyntheticStoreSalesGenerator.class);
        assertThat(IndexBenchmarkDataBuilder.generatorFor(config.with(BenchmarkConfig.GENERATOR, "dsdgen"), tables))
                .isInstanceOf(DsdgenDatasetGenerator.class);
    }
}
