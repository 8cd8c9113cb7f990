package io.ingest4j.temporal;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped in-process locks keyed by (table, natural key).
 */
final class KeyLocks {

    private final ReentrantLock[] stripes;

    KeyLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    ReentrantLock lockFor(String table, NaturalKey key) {
        int h = 31 * table.hashCode() + key.hashCode();
        return stripes[Math.floorMod(h, stripes.length)];
    }
}
