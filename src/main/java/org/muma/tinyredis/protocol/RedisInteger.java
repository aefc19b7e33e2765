package org.muma.tinyredis.protocol;

// 3. 整数 (:)
public record RedisInteger(long value) implements RedisMessage {

    @Override
    public RespType type() {
        return RespType.INTEGER;
    }
}
