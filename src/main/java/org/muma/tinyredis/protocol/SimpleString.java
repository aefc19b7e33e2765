package org.muma.tinyredis.protocol;

import java.util.Objects;

// 1. 简单字符串 (+)，不能包含 CR/LF
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");

    public SimpleString {
        Objects.requireNonNull(content, "content");
    }

    @Override
    public RespType type() {
        return RespType.SIMPLE_STRING;
    }
}
