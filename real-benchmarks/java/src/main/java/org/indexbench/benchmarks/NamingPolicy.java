package org.indexbench.benchmarks;

/**
 * Maps storage formats to database names and dataset locations.
 */
public final class NamingPolicy {
    static final String DEFAULT_DATABASE = "default";

    private NamingPolicy() {
    }

    public static String baseNameFor(StorageFormat format, int scale) {
        if (format == null || !format.isKnown()) {
            return DEFAULT_DATABASE;
        }
        return format.name() + "_tpcds_" + scale;
    }

    public static String resolveDatabaseName(StorageFormat format, int scale, String prefix, String postfix) {
        return nullToEmpty(prefix) + baseNameFor(format, scale) + nullToEmpty(postfix);
    }

    /**
     * {@code root/version/tpcds/<database>/}, always with a trailing slash so that table
     * names can be appended directly.
     */
    public static String resolveTableLocation(String root, String version, StorageFormat format,
                                              int scale, String prefix, String postfix) {
        String base = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
        return String.join("/", base, version, "tpcds",
                resolveDatabaseName(format, scale, prefix, postfix)) + "/";
    }

    public static String databaseName(BenchmarkConfig config, StorageFormat format) {
        return resolveDatabaseName(format, config.dataScale(), config.databasePrefix(), config.databasePostfix());
    }

    public static String tableLocation(BenchmarkConfig config, StorageFormat format) {
        return resolveTableLocation(config.rootDir(), config.engineVersion(), format,
                config.dataScale(), config.databasePrefix(), config.databasePostfix());
    }

    /**
     * Directory shared by every database of one engine version; the table catalog lives here.
     */
    public static String catalogRoot(BenchmarkConfig config) {
        String root = config.rootDir();
        String base = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
        return String.join("/", base, config.engineVersion(), "tpcds");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
