package org.indexbench.benchmarks.index;

import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Btree-style index: entries sorted by key and cut into fixed-size leaf pages, followed by a
 * root page holding the first key and file offset of every leaf.
 *
 * Layout:
 * <pre>
 *   MAGIC, VERSION, entryCount, pageSize
 *   leaf*  : count, key[count], rowId[count]
 *   root   : (firstKey, offset)[pageCount]
 *   footer : pageCount, rootOffset
 * </pre>
 */
public class OrderedIndexWriter implements IndexWriter {
    public static final int MAGIC = 0x42545249; // "BTRI"
    public static final int VERSION = 1;
    public static final int DEFAULT_PAGE_SIZE = 256;

    private final int pageSize;

    public OrderedIndexWriter() {
        this(DEFAULT_PAGE_SIZE);
    }

    public OrderedIndexWriter(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    @Override
    public void write(ColumnEntries entries, DataOutputStream out) throws IOException {
        int count = entries.size();
        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        // stable sort keeps row ids ascending within a key
        Arrays.sort(order, Comparator.comparingLong(entries::key));

        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        out.writeInt(count);
        out.writeInt(pageSize);

        int pageCount = (count + pageSize - 1) / pageSize;
        long[] firstKeys = new long[pageCount];
        long[] offsets = new long[pageCount];
        for (int page = 0; page < pageCount; page++) {
            int from = page * pageSize;
            int to = Math.min(count, from + pageSize);
            firstKeys[page] = entries.key(order[from]);
            offsets[page] = out.size();
            out.writeInt(to - from);
            for (int i = from; i < to; i++) {
                out.writeLong(entries.key(order[i]));
            }
            for (int i = from; i < to; i++) {
                out.writeInt(entries.rowId(order[i]));
            }
        }

        long rootOffset = out.size();
        for (int page = 0; page < pageCount; page++) {
            out.writeLong(firstKeys[page]);
            out.writeLong(offsets[page]);
        }
        out.writeInt(pageCount);
        out.writeLong(rootOffset);
    }
}
