package org.muma.tinyredis.protocol;

// 密封接口，限制实现类
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 显式的类型标签，编解码按它分发
     */
    RespType type();
}
