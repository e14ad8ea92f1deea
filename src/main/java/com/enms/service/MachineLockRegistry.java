package com.enms.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per machine. Serializes drift evaluation, retrain
 * start/promotion, model version allocation and A/B decisions for the same
 * machine while leaving different machines fully parallel.
 */
@Component
public class MachineLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String machineId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(machineId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String machineId, Runnable action) {
        withLock(machineId, () -> {
            action.run();
            return null;
        });
    }
}
