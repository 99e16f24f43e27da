package org.indexbench.benchmarks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index cost results of one benchmark run, keyed by test label in insertion order.
 *
 * Recording an existing label replaces its records but keeps its position. All methods are
 * synchronized so formats may be measured concurrently without reordering the report.
 */
public class ResultAggregator {
    private final Map<String, List<IndexCostRecord>> results = new LinkedHashMap<>();

    public static String testLabel(StorageFormat format) {
        return format.name() + " index cost";
    }

    public synchronized void record(String label, List<IndexCostRecord> records) {
        results.put(label, Collections.unmodifiableList(new ArrayList<>(records)));
    }

    public synchronized Map<String, List<IndexCostRecord>> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * One block per label: a {@code ##label} line followed by a table with a row per index.
     * The output depends only on the recorded values.
     */
    public synchronized String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<IndexCostRecord>> entry : results.entrySet()) {
            sb.append("##").append(entry.getKey()).append('\n');
            renderTable(sb, entry.getValue());
        }
        return sb.toString();
    }

    private static void renderTable(StringBuilder sb, List<IndexCostRecord> records) {
        String[] header = {"Index", "Time (ms)", "Size"};
        int[] widths = new int[header.length];
        for (int i = 0; i < header.length; i++) {
            widths[i] = header[i].length();
        }
        List<String[]> rows = new ArrayList<>();
        for (IndexCostRecord record : records) {
            String[] row = {record.kindLabel, record.formattedBuildTime(), record.size};
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
            rows.add(row);
        }

        appendRow(sb, header, widths);
        sb.append('|');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('|');
        }
        sb.append('\n');
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        sb.append('\n');
    }
}
