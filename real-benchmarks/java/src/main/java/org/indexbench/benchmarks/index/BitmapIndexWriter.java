package org.indexbench.benchmarks.index;

import org.roaringbitmap.RoaringBitmap;

import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bitmap index: one Roaring bitmap of row positions per distinct key, keys ascending.
 *
 * Layout: MAGIC, VERSION, distinctCount, then (key, bitmapBytes, bitmap) per key.
 */
public class BitmapIndexWriter implements IndexWriter {
    public static final int MAGIC = 0x424d5049; // "BMPI"
    public static final int VERSION = 1;

    @Override
    public void write(ColumnEntries entries, DataOutputStream out) throws IOException {
        Map<Long, RoaringBitmap> bitmaps = new TreeMap<>();
        for (int i = 0; i < entries.size(); i++) {
            bitmaps.computeIfAbsent(entries.key(i), k -> new RoaringBitmap()).add(entries.rowId(i));
        }

        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        out.writeInt(bitmaps.size());
        for (Map.Entry<Long, RoaringBitmap> entry : bitmaps.entrySet()) {
            RoaringBitmap bitmap = entry.getValue();
            bitmap.runOptimize();
            out.writeLong(entry.getKey());
            out.writeInt(bitmap.serializedSizeInBytes());
            bitmap.serialize(out);
        }
    }
}
