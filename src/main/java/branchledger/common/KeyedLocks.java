package branchledger.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reentrant lock per key. Multi-key acquisition always goes in natural key order so two
 * callers locking overlapping sets cannot deadlock.
 */
public final class KeyedLocks<K extends Comparable<K>> {

    private final ConcurrentMap<K, ReentrantLock> lockTable = new ConcurrentHashMap<>();

    public Held lock(K key) {
        ReentrantLock l = lockTable.computeIfAbsent(key, k -> new ReentrantLock());
        l.lock();
        return new Held(Collections.singletonList(l));
    }

    public Held lockAll(Iterable<K> keys) {
        TreeSet<K> ordered = new TreeSet<>();
        for (K k : keys) {
            if (k != null) ordered.add(k);
        }
        List<ReentrantLock> acquired = new ArrayList<>(ordered.size());
        for (K key : ordered) {
            ReentrantLock l = lockTable.computeIfAbsent(key, k -> new ReentrantLock());
            l.lock();
            acquired.add(l);
        }
        return new Held(acquired);
    }

    public static final class Held implements AutoCloseable {
        private final List<ReentrantLock> locks;

        private Held(List<ReentrantLock> locks) {
            this.locks = locks;
        }

        @Override
        public void close() {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }
}
