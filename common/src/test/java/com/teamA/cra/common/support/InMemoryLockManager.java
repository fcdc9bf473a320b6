package com.teamA.cra.common.support;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.lock.AdvisoryLockManager;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 키별 ReentrantLock으로 DynamoDB lease를 흉내낸다
 */
public class InMemoryLockManager implements AdvisoryLockManager {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(String key1, String key2, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(DdbKeyFactory.lockPk(key1, key2), k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
