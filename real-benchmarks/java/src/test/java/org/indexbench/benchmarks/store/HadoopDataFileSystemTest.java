package org.indexbench.benchmarks.store;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HadoopDataFileSystemTest {

    @TempDir
    Path dir;

    @Test
    void copyKeepsOrConsumesSource() throws IOException {
        Path src = Files.createDirectories(dir.resolve("src"));
        Files.writeString(src.resolve("a.txt"), "hello");
        HadoopDataFileSystem fs = new HadoopDataFileSystem(new Configuration());

        fs.copy(src.toString(), dir.resolve("keep").toString(), false);
        assertThat(src).exists();
        assertThat(Files.readString(dir.resolve("keep").resolve("a.txt"))).isEqualTo("hello");

        fs.copy(src.toString(), dir.resolve("moved").toString(), true);
        assertThat(src).doesNotExist();
        assertThat(Files.readString(dir.resolve("moved").resolve("a.txt"))).isEqualTo("hello");
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() throws IOException {
        Path target = Files.createDirectories(dir.resolve("t"));
        Files.writeString(target.resolve("x"), "x");
        HadoopDataFileSystem fs = new HadoopDataFileSystem(new Configuration());

        assertThat(fs.delete(target.toString(), true)).isTrue();
        assertThat(fs.delete(target.toString(), true)).isFalse();
    }

    @Test
    void copyOfMissingSourceFails() {
        HadoopDataFileSystem fs = new HadoopDataFileSystem(new Configuration());

        assertThatThrownBy(() -> fs.copy(dir.resolve("none").toString(), dir.resolve("dst").toString(), false))
                .isInstanceOf(IOException.class);
    }
}
