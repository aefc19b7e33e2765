package org.muma.tinyredis.store.impl;

import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.store.StorageEngine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存存储，多个连接线程并发访问
 */
public class MemoryStorageEngine implements StorageEngine {

    // 数据存储 (Key -> Data)
    private final Map<String, RedisData<?>> memoryDb = new ConcurrentHashMap<>();

    // 分段锁，避免所有读-改-写命令抢同一把全局锁
    private static final int LOCK_STRIPES = 64;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public MemoryStorageEngine() {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public RedisData<?> get(String key) {
        return memoryDb.get(key);
    }

    @Override
    public void put(String key, RedisData<?> data) {
        memoryDb.put(key, data);
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    @Override
    public Object getLock(String key) {
        return locks[(key.hashCode() & 0x7fffffff) % LOCK_STRIPES];
    }
}
