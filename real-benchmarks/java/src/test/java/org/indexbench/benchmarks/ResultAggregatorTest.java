package org.indexbench.benchmarks;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private static List<IndexCostRecord> costs(long btreeNanos, long bitmapNanos) {
        return List.of(
                new IndexCostRecord("Btree", btreeNanos, "1.2 MB"),
                new IndexCostRecord("Bitmap", bitmapNanos, "340 KB"));
    }

    @Test
    void rendersLabelsInInsertionOrder() {
        ResultAggregator results = new ResultAggregator();
        results.record("parquet index cost", costs(1_500_000, 250_000));
        results.record("avro index cost", costs(2_000_000, 500_000));

        String report = results.render();

        assertThat(report).isEqualTo(
                "##parquet index cost\n"
                        + "| Index  | Time (ms) | Size   |\n"
                        + "|--------|-----------|--------|\n"
                        + "| Btree  | 1.500     | 1.2 MB |\n"
                        + "| Bitmap | 0.250     | 340 KB |\n"
                        + "##avro index cost\n"
                        + "| Index  | Time (ms) | Size   |\n"
                        + "|--------|-----------|--------|\n"
                        + "| Btree  | 2.000     | 1.2 MB |\n"
                        + "| Bitmap | 0.500     | 340 KB |\n");
    }

    @Test
    void rerecordingReplacesValuesButKeepsPosition() {
        ResultAggregator results = new ResultAggregator();
        results.record("a", costs(1, 1));
        results.record("b", costs(2, 2));
        results.record("a", costs(3, 3));

        assertThat(results.results()).containsOnlyKeys("a", "b");
        assertThat(results.results().keySet()).containsExactly("a", "b");
        assertThat(results.results().get("a").get(0).buildTimeNanos).isEqualTo(3);
    }

    @Test
    void renderingIsDeterministic() {
        ResultAggregator results = new ResultAggregator();
        assertThat(results.render()).isEmpty();

        results.record("parquet index cost", costs(42, 43));

        assertThat(results.render()).isEqualTo(results.render());
        assertThat(results.results()).hasSize(1);
    }

    @Test
    void recordedListIsACopy() {
        ResultAggregator results = new ResultAggregator();
        List<IndexCostRecord> records = new ArrayList<>(costs(1, 2));
        results.record("x", records);
        records.clear();

        assertThat(results.results().get("x")).hasSize(2);
    }

    @Test
    void concurrentInsertionsFollowCompletionOrder() throws Exception {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(7));

        ResultAggregator results = new ResultAggregator();
        List<CountDownLatch> turns = new ArrayList<>();
        for (int i = 0; i <= order.size(); i++) {
            turns.add(new CountDownLatch(1));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int turn = 0; turn < order.size(); turn++) {
                int myTurn = turn;
                int label = order.get(turn);
                futures.add(pool.submit(() -> {
                    turns.get(myTurn).await();
                    results.record("label-" + label, costs(label, label));
                    turns.get(myTurn + 1).countDown();
                    return null;
                }));
            }
            turns.get(0).countDown();
            assertThat(turns.get(order.size()).await(10, TimeUnit.SECONDS)).isTrue();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> expected = new ArrayList<>();
        for (int label : order) {
            expected.add("label-" + label);
        }
        assertThat(results.results().keySet()).containsExactlyElementsOf(expected);
    }

    @Test
    void testLabelNamesFormat() {
        assertThat(ResultAggregator.testLabel(StorageFormat.PARQUET)).isEqualTo("parquet index cost");
        assertThat(new IndexCostRecord("Btree", 1_234_567, "1 KB").formattedBuildTime()).isEqualTo("1.235");
    }
}
