package branchledger.common;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLocksTest {

    @Test
    void opposingOrdersDoNotDeadlock() throws Exception {
        KeyedLocks<Long> locks = new KeyedLocks<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        int[] counter = new int[1];
        Runnable ab = () -> run(locks, go, counter, 1L, 2L);
        Runnable ba = () -> run(locks, go, counter, 2L, 1L);
        Future<?> f1 = pool.submit(ab);
        Future<?> f2 = pool.submit(ba);
        go.countDown();
        f1.get(10, TimeUnit.SECONDS);
        f2.get(10, TimeUnit.SECONDS);
        pool.shutdownNow();
        assertEquals(20_000, counter[0]);
    }

    private static void run(KeyedLocks<Long> locks, CountDownLatch go, int[] counter, long first, long second) {
        try {
            go.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        for (int i = 0; i < 10_000; i++) {
            try (KeyedLocks.Held ignored = locks.lockAll(Arrays.asList(first, second))) {
                counter[0]++;
            }
        }
    }

    @Test
    void reentrantForTheSameThread() {
        KeyedLocks<String> locks = new KeyedLocks<>();
        try (KeyedLocks.Held outer = locks.lock("tx-1")) {
            try (KeyedLocks.Held inner = locks.lockAll(Arrays.asList("tx-1", "tx-2"))) {
                assertNotNull(inner);
            }
        }
    }
}
