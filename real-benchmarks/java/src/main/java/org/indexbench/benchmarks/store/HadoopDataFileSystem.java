package org.indexbench.benchmarks.store;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.FileUtil;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link DataFileSystem} over any Hadoop filesystem. Paths without a scheme resolve
 * against {@code fs.defaultFS}.
 */
public class HadoopDataFileSystem implements DataFileSystem {
    private static final Logger LOG = LoggerFactory.getLogger(HadoopDataFileSystem.class);

    private final Configuration conf;

    public HadoopDataFileSystem(Configuration conf) {
        this.conf = conf;
    }

    FileSystem fileSystem(Path path) throws IOException {
        return path.getFileSystem(conf);
    }

    @Override
    public boolean delete(String path, boolean recursive) throws IOException {
        Path p = new Path(path);
        boolean deleted = fileSystem(p).delete(p, recursive);
        LOG.debug("delete {} (recursive={}): {}", path, recursive, deleted);
        return deleted;
    }

    @Override
    public void copy(String src, String dst, boolean deleteSource) throws IOException {
        Path srcPath = new Path(src);
        Path dstPath = new Path(dst);
        FileSystem srcFs = fileSystem(srcPath);
        FileSystem dstFs = fileSystem(dstPath);
        if (!FileUtil.copy(srcFs, srcPath, dstFs, dstPath, deleteSource, conf)) {
            throw new IOException("Failed to copy " + src + " to " + dst);
        }
        LOG.debug("copied {} to {} (deleteSource={})", src, dst, deleteSource);
    }
}
