package org.indexbench.benchmarks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Main entry point for the index cost benchmark
 *
 * Usage:
 *   java -jar index-cost-benchmarks.jar \
 *     --step all \
 *     --config ./conf/index-benchmark-default.conf \
 *     --formats parquet,avro
 *
 * Steps:
 *   - generate-tables: write raw store_sales per format
 *   - generate-databases: derive ss_item_sk1 and register store_sales / store_sales_dup
 *   - build-index: build Btree and Bitmap indexes and print their cost
 *   - all: the three steps above, in order
 */
public class BenchmarkRunner {
    private static final Logger LOG = LoggerFactory.getLogger(BenchmarkRunner.class);

    public static void main(String[] args) {
        RunnerOptions options = parseArgs(args);

        if (options == null) {
            printUsage();
            System.exit(1);
        }

        LOG.info("=".repeat(70));
        LOG.info("Index Cost Benchmark: {}", options.step);
        LOG.info("=".repeat(70));

        try {
            BenchmarkConfig config = resolveConfig(options);
            LOG.info("Using {}", config);
            run(IndexBenchmarkDataBuilder.create(config), options.step);
        } catch (Exception e) {
            LOG.error("Benchmark failed", e);
            System.exit(1);
        }

        LOG.info("Benchmark complete!");
    }

    static BenchmarkConfig resolveConfig(RunnerOptions options) {
        BenchmarkConfig config = options.configFile == null
                ? BenchmarkConfig.load()
                : BenchmarkConfig.load(Paths.get(options.configFile));
        if (options.formats != null) {
            config = config.with(BenchmarkConfig.DATA_FORMATS, options.formats);
        }
        return config;
    }

    static void run(IndexBenchmarkDataBuilder builder, String step) throws Exception {
        switch (step) {
            case "generate-tables":
                builder.generateTables();
                break;
            case "generate-databases":
                builder.generateDatabases();
                break;
            case "build-index":
                builder.buildAllIndex();
                break;
            case "all":
                LOG.info("Step 1: Generating tables...");
                builder.generateTables();
                LOG.info("Step 2: Generating databases...");
                builder.generateDatabases();
                LOG.info("Step 3: Building indexes...");
                builder.buildAllIndex();
                break;
            default:
                throw new IllegalArgumentException("Unknown step: " + step);
        }
    }

    static RunnerOptions parseArgs(String[] args) {
        RunnerOptions options = new RunnerOptions();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--step":
                    options.step = valueOf(args, ++i);
                    break;
                case "--config":
                    options.configFile = valueOf(args, ++i);
                    break;
                case "--formats":
                    options.formats = valueOf(args, ++i);
                    break;
                case "--help":
                    return null;
                default:
                    LOG.warn("Unknown argument: {}", args[i]);
            }
        }

        if (options.step == null) {
            return null;
        }

        return options;
    }

    private static String valueOf(String[] args, int i) {
        return i < args.length ? args[i] : null;
    }

    private static void printUsage() {
        System.out.println("\nUsage:");
        System.out.println("  java -jar index-cost-benchmarks.jar [OPTIONS]");
        System.out.println("\nRequired Options:");
        System.out.println("  --step <step>           generate-tables, generate-databases, build-index or all");
        System.out.println("\nOptional:");
        System.out.println("  --config <path>         Config file (default: " + BenchmarkConfig.DEFAULT_CONFIG_FILE + ")");
        System.out.println("  --formats <a,b>         Storage formats to run, overrides the config file");
        System.out.println("\nExamples:");
        System.out.println("  java -jar index-cost-benchmarks.jar --step all");
        System.out.println("  java -jar index-cost-benchmarks.jar --step build-index --formats parquet");
        System.out.println();
    }

    /**
     * Command line options
     */
    static class RunnerOptions {
        String step;
        String configFile;
        String formats;
    }
}
