package org.indexbench.benchmarks;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkRunnerTest {

    @TempDir
    Path dir;

    @Test
    void parsesAllOptions() {
        BenchmarkRunner.RunnerOptions options = BenchmarkRunner.parseArgs(new String[] {
                "--step", "build-index", "--config", "bench.conf", "--formats", "avro", "--verbose"});

        assertThat(options.step).isEqualTo("build-index");
        assertThat(options.configFile).isEqualTo("bench.conf");
        assertThat(options.formats).isEqualTo("avro");
    }

    @Test
    void stepIsRequiredAndHelpStops() {
        assertThat(BenchmarkRunner.parseArgs(new String[] {"--formats", "avro"})).isNull();
        assertThat(BenchmarkRunner.parseArgs(new String[] {"--step", "all", "--help"})).isNull();
        assertThat(BenchmarkRunner.parseArgs(new String[0])).isNull();
    }

    @Test
    void formatsOverrideConfigFile() {
        BenchmarkRunner.RunnerOptions options = BenchmarkRunner.parseArgs(new String[] {
                "--step", "all", "--config", dir.resolve("missing.conf").toString(), "--formats", "avro"});

        BenchmarkConfig config = BenchmarkRunner.resolveConfig(options);

        assertThat(config.dataFormats()).containsExactly(StorageFormat.AVRO);
        assertThat(config.dataScale()).isEqualTo(200);
    }

    @Test
    void unknownStepIsRejected() {
        assertThatThrownBy(() -> BenchmarkRunner.run(null, "index-everything"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index-everything");
    }
}
