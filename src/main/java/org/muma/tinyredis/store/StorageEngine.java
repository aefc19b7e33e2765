package org.muma.tinyredis.store;

import org.muma.tinyredis.common.RedisData;

public interface StorageEngine {

    // 基础 KV 操作
    RedisData<?> get(String key);

    void put(String key, RedisData<?> data);

    int size();

    /**
     * 读-改-写类命令 (HSET 等) 用来保证原子性的锁对象
     */
    Object getLock(String key);
}
