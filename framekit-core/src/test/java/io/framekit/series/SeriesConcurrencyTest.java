package io.framekit.series;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SeriesConcurrencyTest {

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void concurrentWritesThroughViews_shouldNeverLeakIntoOriginal() throws InterruptedException {
        var original = Series.ofLongs("n", new long[64]);
        var threadCount = 8;
        var executor = Executors.newFixedThreadPool(threadCount);
        var startLatch = new CountDownLatch(1);
        var completeLatch = new CountDownLatch(threadCount);
        var leaks = new AtomicInteger();

        for (var t = 0; t < threadCount; t++) {
            final long marker = t + 1;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    var view = original.view();
                    for (var i = 0; i < 64; i++) {
                        view.set(i, marker);
                    }
                    for (var i = 0; i < 64; i++) {
                        if (view.get(i) == null || (Long) view.get(i) != marker) {
                            leaks.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completeLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(completeLatch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(leaks.get()).isZero();
        assertThat(original.sum()).isZero();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void crossedStorageComparisonsAndWrites_shouldAllComplete() throws InterruptedException {
        var first = Series.ofLongs("a", new long[16]);
        var second = first.view();
        var executor = Executors.newFixedThreadPool(4);
        var startLatch = new CountDownLatch(1);
        var completeLatch = new CountDownLatch(4);

        Series[][] comparisons = {{first, second}, {second, first}};
        for (var pair : comparisons) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (var i = 0; i < 20_000; i++) {
                        pair[0].sharesStorageWith(pair[1]);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completeLatch.countDown();
                }
            });
        }
        for (var target : new Series[]{first, second}) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (var i = 0; i < 20_000; i++) {
                        target.set(i % 16, (long) i);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completeLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(completeLatch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(first.sharesStorageWith(second)).isFalse();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void concurrentReadersAndWriter_shouldSeeConsistentLength() throws InterruptedException {
        var series = Series.ofDoubles("d", new double[1_000]);
        var readerCount = 4;
        var executor = Executors.newFixedThreadPool(readerCount + 1);
        var startLatch = new CountDownLatch(1);
        var completeLatch = new CountDownLatch(readerCount + 1);
        var errors = new AtomicInteger();

        executor.submit(() -> {
            try {
                startLatch.await();
                for (var i = 0; i < 1_000; i++) {
                    series.set(i, (double) i);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                completeLatch.countDown();
            }
        });
        for (var t = 0; t < readerCount; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (var i = 0; i < 200; i++) {
                        if (series.values().size() != 1_000 || series.count() != 1_000) {
                            errors.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completeLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(completeLatch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(errors.get()).isZero();
        assertThat(series.sum()).isEqualTo(499_500.0);
    }
}
