package org.muma.tinyredis.common;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RedisData<T> {

    // 数据类型
    private RedisDataType type;

    // 泛型数据载体 (String 是 byte[], Hash 是 RedisHash 对象)
    private T data;

    public RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    // 避免外部强制转换时报 Unchecked warning，同时做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName()
                + " but found " + (data == null ? "null" : data.getClass().getSimpleName()));
    }
}
