package org.indexbench.benchmarks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Benchmark parameters, resolved once per run.
 *
 * A config file either supplies every recognized key with a valid value, or it is
 * ignored as a whole and the built-in defaults are used. Values from a broken file
 * are never mixed with defaults.
 */
public final class BenchmarkConfig {
    private static final Logger LOG = LoggerFactory.getLogger(BenchmarkConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "./conf/index-benchmark-default.conf";

    public static final String COMPRESSION_CODEC = "index.benchmark.compression.codec";
    public static final String ENGINE_VERSION = "index.benchmark.support.engine.version";
    public static final String TPCDS_TOOL_DIR = "index.benchmark.tpcds.tool.dir";
    public static final String FILE_ROOT_DIR = "index.benchmark.file.root.dir";
    public static final String DATABASE_PREFIX = "index.benchmark.database.prefix";
    public static final String DATABASE_POSTFIX = "index.benchmark.database.postfix";
    public static final String DATA_SCALE = "index.benchmark.tpcds.data.scale";
    public static final String DATA_PARTITION = "index.benchmark.tpcds.data.partition";
    public static final String DATA_FORMATS = "index.benchmark.data.formats";
    public static final String GENERATOR = "index.benchmark.tpcds.generator";

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(COMPRESSION_CODEC, "gzip");
        defaults.put(ENGINE_VERSION, "0.4.0");
        defaults.put(TPCDS_TOOL_DIR, "/home/indexbench/tpcds-kit/tools");
        defaults.put(FILE_ROOT_DIR, "/tmp/indexbench/");
        defaults.put(DATABASE_PREFIX, "");
        defaults.put(DATABASE_POSTFIX, "");
        defaults.put(DATA_SCALE, "200");
        defaults.put(DATA_PARTITION, "80");
        defaults.put(DATA_FORMATS, "parquet,avro");
        defaults.put(GENERATOR, "synthetic");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> properties;

    private BenchmarkConfig(Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static BenchmarkConfig defaults() {
        return new BenchmarkConfig(DEFAULTS);
    }

    public static BenchmarkConfig load() {
        return load(Paths.get(DEFAULT_CONFIG_FILE));
    }

    /**
     * Loads the config file at {@code path}, falling back to {@link #defaults()} when the
     * file is missing, unreadable or incomplete.
     */
    public static BenchmarkConfig load(Path path) {
        try {
            return fromMap(readProperties(path));
        } catch (NoSuchFileException e) {
            LOG.warn("Config file {} not found. Use default setting!", path);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("{}. Use default setting!", e.getMessage());
        }
        return defaults();
    }

    /**
     * Builds a config from explicit values. Every recognized key must be present and the
     * numeric keys must parse, otherwise {@link IllegalArgumentException} is thrown.
     */
    public static BenchmarkConfig fromMap(Map<String, String> values) {
        List<String> missing = new ArrayList<>();
        for (String key : DEFAULTS.keySet()) {
            if (!values.containsKey(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing benchmark properties " + missing);
        }

        BenchmarkConfig config = new BenchmarkConfig(values);
        requirePositiveInt(config, DATA_SCALE);
        requirePositiveInt(config, DATA_PARTITION);
        if (config.dataFormats().isEmpty()) {
            throw new IllegalArgumentException("No data format configured in " + DATA_FORMATS);
        }
        String generator = config.generator();
        if (!"synthetic".equals(generator) && !"dsdgen".equals(generator)) {
            throw new IllegalArgumentException("Unknown generator '" + generator + "' for " + GENERATOR);
        }
        return config;
    }

    private static Map<String, String> readProperties(Path path) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            values.put(name, props.getProperty(name).trim());
        }
        return values;
    }

    private static void requirePositiveInt(BenchmarkConfig config, String key) {
        String value = config.get(key);
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer '" + value + "' for " + key);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException("Property " + key + " must be positive, got " + parsed);
        }
    }

    public String get(String key) {
        String value = properties.get(key);
        return value != null ? value : DEFAULTS.get(key);
    }

    public String compressionCodec() {
        return get(COMPRESSION_CODEC);
    }

    public String engineVersion() {
        return get(ENGINE_VERSION);
    }

    public String tpcdsToolDir() {
        return get(TPCDS_TOOL_DIR);
    }

    public String rootDir() {
        return get(FILE_ROOT_DIR);
    }

    public String databasePrefix() {
        return get(DATABASE_PREFIX);
    }

    public String databasePostfix() {
        return get(DATABASE_POSTFIX);
    }

    public int dataScale() {
        return Integer.parseInt(get(DATA_SCALE));
    }

    public int dataPartitions() {
        return Integer.parseInt(get(DATA_PARTITION));
    }

    public String generator() {
        return get(GENERATOR);
    }

    /**
     * Configured formats in declaration order, duplicates removed.
     */
    public List<StorageFormat> dataFormats() {
        return StorageFormat.parseList(get(DATA_FORMATS));
    }

    /**
     * Returns a copy with {@code key} replaced. Used by the command line to override
     * individual values after the file has been resolved.
     */
    public BenchmarkConfig with(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(properties);
        copy.put(key, value);
        return fromMap(copy);
    }

    public Map<String, String> asMap() {
        return properties;
    }

    @Override
    public String toString() {
        return "BenchmarkConfig" + properties;
    }
}
