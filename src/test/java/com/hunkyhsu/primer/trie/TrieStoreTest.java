package com.hunkyhsu.primer.trie;

import org.junit.jupiter.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TrieStore 单元测试
 *
 * 测试覆盖：
 * 1. 基本的 put/get/remove
 * 2. ValueGuard 持有旧版本
 * 3. 并发读写
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class TrieStoreTest {

    private static final Logger logger = LoggerFactory.getLogger(TrieStoreTest.class);

    private TrieStore store;

    @BeforeEach
    void setUp() {
        store = new TrieStore();
    }

    @Test
    @Order(1)
    @DisplayName("测试：put / get / remove")
    void testBasicOperations() {
        assertTrue(store.get("a", Integer.class).isEmpty());

        store.put("a", 1);
        store.put("ab", "two");
        assertEquals(1, store.get("a", Integer.class).orElseThrow().getValue());
        assertEquals("two", store.get("ab", String.class).orElseThrow().getValue());
        assertTrue(store.get("ab", Integer.class).isEmpty());

        store.remove("a");
        assertTrue(store.get("a", Integer.class).isEmpty());
        assertEquals("two", store.get("ab", String.class).orElseThrow().getValue());

        store.remove("ab");
        assertTrue(store.snapshot().isEmpty());

        logger.info("✅ testBasicOperations passed");
    }

    @Test
    @Order(2)
    @DisplayName("测试：remove 不存在的 key 不产生新版本")
    void testRemoveMissingKey() {
        store.put("a", 1);
        Trie before = store.snapshot();
        store.remove("missing");
        assertSame(before, store.snapshot());

        logger.info("✅ testRemoveMissingKey passed");
    }

    @Test
    @Order(3)
    @DisplayName("测试：ValueGuard 持有读取时的版本")
    void testGuardKeepsSnapshot() {
        store.put("key", "v1");
        ValueGuard<String> guard = store.get("key", String.class).orElseThrow();

        store.put("key", "v2");
        store.remove("key");

        assertEquals("v1", guard.getValue());
        assertEquals(Optional.of("v1"), guard.getSnapshot().get("key", String.class));
        assertTrue(store.get("key", String.class).isEmpty());

        logger.info("✅ testGuardKeepsSnapshot passed");
    }

    @Test
    @Order(4)
    @DisplayName("测试：快照链作为历史版本")
    void testSnapshotHistory() {
        Trie v0 = store.snapshot();
        store.put("x", 1);
        Trie v1 = store.snapshot();
        store.put("x", 2);
        Trie v2 = store.snapshot();

        assertTrue(v0.get("x", Integer.class).isEmpty());
        assertEquals(Optional.of(1), v1.get("x", Integer.class));
        assertEquals(Optional.of(2), v2.get("x", Integer.class));

        TrieStore restored = new TrieStore(v1);
        assertEquals(1, restored.get("x", Integer.class).orElseThrow().getValue());

        logger.info("✅ testSnapshotHistory passed");
    }

    @Test
    @Order(5)
    @DisplayName("测试：并发写入不丢更新")
    void testConcurrentWriters() throws Exception {
        int numThreads = 10;
        int keysPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    for (int j = 0; j < keysPerThread; j++) {
                        store.put("t" + threadId + "-" + j, j);
                        if (j % 2 == 1) {
                            store.remove("t" + threadId + "-" + (j - 1));
                        }
                    }
                } catch (Exception e) {
                    logger.error("Error in thread " + threadId, e);
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(0, errorCount.get(), "No errors should occur");

        for (int i = 0; i < numThreads; i++) {
            for (int j = 0; j < keysPerThread; j++) {
                Optional<ValueGuard<Integer>> guard = store.get("t" + i + "-" + j, Integer.class);
                if (j % 2 == 1) {
                    assertEquals(j, guard.orElseThrow().getValue());
                } else {
                    assertTrue(guard.isEmpty(), "key t" + i + "-" + j + " should be removed");
                }
            }
        }

        logger.info("✅ testConcurrentWriters passed ({} threads)", numThreads);
    }

    @Test
    @Order(6)
    @DisplayName("测试：并发读写")
    void testConcurrentReadersAndWriter() throws Exception {
        store.put("counter", 0);
        int numReaders = 8;
        int updates = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(numReaders + 1);
        CountDownLatch latch = new CountDownLatch(numReaders + 1);
        AtomicInteger errorCount = new AtomicInteger(0);

        executor.submit(() -> {
            try {
                for (int i = 1; i <= updates; i++) {
                    store.put("counter", i);
                }
            } catch (Exception e) {
                logger.error("Error in writer", e);
                errorCount.incrementAndGet();
            } finally {
                latch.countDown();
            }
        });

        for (int r = 0; r < numReaders; r++) {
            executor.submit(() -> {
                try {
                    int last = 0;
                    for (int i = 0; i < updates; i++) {
                        int value = store.get("counter", Integer.class).orElseThrow().getValue();
                        // 单写者递增，读到的值不会回退
                        if (value < last) {
                            errorCount.incrementAndGet();
                        }
                        last = value;
                    }
                } catch (Exception e) {
                    logger.error("Error in reader", e);
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, errorCount.get(), "No errors should occur");
        assertEquals(updates, store.get("counter", Integer.class).orElseThrow().getValue());

        logger.info("✅ testConcurrentReadersAndWriter passed");
    }
}
