package org.indexbench.benchmarks.index;

import java.util.Arrays;

/**
 * Non-null (row position, key) pairs of one column, in scan order.
 */
public final class ColumnEntries {
    private int[] rowIds;
    private long[] keys;
    private int size;

    public ColumnEntries() {
        this(1024);
    }

    public ColumnEntries(int initialCapacity) {
        int capacity = Math.max(16, initialCapacity);
        this.rowIds = new int[capacity];
        this.keys = new long[capacity];
    }

    public void add(int rowId, long key) {
        if (size == keys.length) {
            int capacity = keys.length + (keys.length >> 1);
            rowIds = Arrays.copyOf(rowIds, capacity);
            keys = Arrays.copyOf(keys, capacity);
        }
        rowIds[size] = rowId;
        keys[size] = key;
        size++;
    }

    public int size() {
        return size;
    }

    public int rowId(int i) {
        return rowIds[i];
    }

    public long key(int i) {
        return keys[i];
    }
}
