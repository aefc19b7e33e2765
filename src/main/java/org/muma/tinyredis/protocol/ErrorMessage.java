package org.muma.tinyredis.protocol;

import java.util.Objects;

// 2. 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public RespType type() {
        return RespType.ERROR;
    }
}
