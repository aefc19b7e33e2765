package org.muma.tinyredis.common;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hash 值，保持字段插入顺序 (HGETALL 输出稳定)。
 * 所有方法同步，读命令不需要额外加锁。
 */
public class RedisHash {

    private final Map<String, byte[]> fields = new LinkedHashMap<>();

    /**
     * @return 1 表示新字段，0 表示覆盖已有字段
     */
    public synchronized int put(String field, byte[] value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public synchronized byte[] get(String field) {
        return fields.get(field);
    }

    public synchronized int size() {
        return fields.size();
    }

    // 返回拷贝，调用方可以放心遍历
    public synchronized Map<String, byte[]> toMap() {
        return new LinkedHashMap<>(fields);
    }
}
