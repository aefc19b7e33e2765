package org.muma.tinyredis.common;

public enum RedisDataType {
    STRING,
    HASH
}
