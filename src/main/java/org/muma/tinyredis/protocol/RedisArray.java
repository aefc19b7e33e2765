package org.muma.tinyredis.protocol;

import java.util.Arrays;
import java.util.Objects;

// 5. 数组 (*)，元素可以嵌套
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public RedisArray {
        Objects.requireNonNull(elements, "elements");
    }

    /**
     * 快速构建一个全部由 BulkString 组成的命令数组，例如 of("SET", "k", "v")
     */
    public static RedisArray of(String... parts) {
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    public int size() {
        return elements.length;
    }

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
