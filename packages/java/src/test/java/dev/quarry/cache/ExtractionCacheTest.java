package dev.quarry.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.mime.MimeTypes;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ExtractionCacheTest {
    private static final CacheKey KEY = new CacheKey("ab12cd34");

    private static ExtractionResult result(String content) {
        return ExtractionResult.builder(MimeTypes.PLAIN_TEXT).content(content).build();
    }

    @Nested
    @DisplayName("Memory tier")
    final class Memory {
        private final ExtractionCache cache = new ExtractionCache(CacheSettings.memoryOnly());

        @Test
        void shouldServeSecondLookupFromMemory() throws Exception {
            AtomicInteger loads = new AtomicInteger();

            ExtractionResult first = cache.getOrCompute(KEY, () -> {
                loads.incrementAndGet();
                return result("hello");
            });
            ExtractionResult second = cache.getOrCompute(KEY, () -> {
                loads.incrementAndGet();
                return result("other");
            });

            assertThat(second).isSameAs(first);
            assertThat(loads).hasValue(1);
            assertThat(cache.getIfPresent(KEY)).containsSame(first);
            CacheStats stats = cache.stats();
            assertThat(stats.hits()).isEqualTo(1);
            assertThat(stats.misses()).isEqualTo(1);
            assertThat(stats.entries()).isEqualTo(1);
            assertThat(stats.hitRate()).isEqualTo(0.5);
        }

        @Test
        void shouldComputeOnceForConcurrentCallers() throws Exception {
            int callers = 8;
            AtomicInteger loads = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            try {
                List<Future<ExtractionResult>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return cache.getOrCompute(KEY, () -> {
                            loads.incrementAndGet();
                            try {
                                release.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return result("shared");
                        });
                    }));
                }
                start.countDown();
                Thread.sleep(200);
                release.countDown();

                ExtractionResult expected = futures.get(0).get(5, TimeUnit.SECONDS);
                for (Future<ExtractionResult> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(expected);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(loads).hasValue(1);
            assertThat(cache.stats().misses()).isEqualTo(1);
            assertThat(cache.stats().hits()).isEqualTo(callers - 1);
        }

        @Test
        void shouldNotCacheFailures() throws Exception {
            assertThatThrownBy(() -> cache.getOrCompute(KEY, () -> {
                throw new QuarryException.Parsing("broken input");
            })).isInstanceOf(QuarryException.Parsing.class);

            assertThat(cache.getIfPresent(KEY)).isEmpty();
            assertThat(cache.getOrCompute(KEY, () -> result("recovered")).getContent()).isEqualTo("recovered");
        }

        @Test
        void shouldKeepCountersWhenCleared() throws Exception {
            cache.getOrCompute(KEY, () -> result("x"));
            cache.getOrCompute(KEY, () -> result("y"));

            cache.clear();

            assertThat(cache.getIfPresent(KEY)).isEmpty();
            assertThat(cache.stats().entries()).isZero();
            assertThat(cache.stats().hits()).isEqualTo(1);
            assertThat(cache.stats().misses()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Disk tier")
    final class Disk {

        @Test
        void shouldServeNewInstanceFromDisk(@TempDir Path dir) throws Exception {
            new ExtractionCache(CacheSettings.onDisk(dir)).getOrCompute(KEY, () -> result("persisted"));
            ExtractionCache reopened = new ExtractionCache(CacheSettings.onDisk(dir));

            ExtractionResult loaded = reopened.getOrCompute(KEY, () -> {
                throw new QuarryException.Io("should not extract");
            });

            assertThat(loaded.getContent()).isEqualTo("persisted");
            assertThat(Files.exists(dir.resolve("ab").resolve("ab12cd34.json"))).isTrue();
            CacheStats stats = reopened.stats();
            assertThat(stats.hits()).isEqualTo(1);
            assertThat(stats.misses()).isZero();
            assertThat(stats.diskEntries()).isEqualTo(1);
            assertThat(stats.diskBytes()).isPositive();
        }

        @Test
        void shouldRecoverFromCorruptEntry(@TempDir Path dir) throws Exception {
            Path entry = dir.resolve("ab").resolve("ab12cd34.json");
            Files.createDirectories(entry.getParent());
            Files.writeString(entry, "{not json", StandardCharsets.UTF_8);
            ExtractionCache cache = new ExtractionCache(CacheSettings.onDisk(dir));

            ExtractionResult loaded = cache.getOrCompute(KEY, () -> result("fresh"));

            assertThat(loaded.getContent()).isEqualTo("fresh");
            assertThat(cache.stats().errors()).isEqualTo(1);
            assertThat(cache.stats().misses()).isEqualTo(1);
            assertThat(Files.readString(entry, StandardCharsets.UTF_8)).contains("fresh");
        }

        @Test
        void shouldBoundEntryCount(@TempDir Path dir) throws Exception {
            ExtractionCache cache = new ExtractionCache(
                new CacheSettings(16, CacheSettings.DEFAULT_MAX_AGE, dir, 2));

            for (String hex : List.of("aa01", "bb02", "cc03")) {
                cache.getOrCompute(new CacheKey(hex), () -> result(hex));
                Thread.sleep(20);
            }

            assertThat(cache.stats().diskEntries()).isEqualTo(2);
        }

        @Test
        void shouldEmptyBothTiers(@TempDir Path dir) throws Exception {
            ExtractionCache cache = new ExtractionCache(CacheSettings.onDisk(dir));
            cache.getOrCompute(KEY, () -> result("gone"));

            cache.clear();

            assertThat(cache.stats().diskEntries()).isZero();
            assertThat(cache.stats().entries()).isZero();
        }
    }
}
