package org.muma.tinyredis.command;

import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

/**
 * 命令处理器统一契约：handler(args) -> RedisMessage
 * args 不含命令名本身。
 */
public interface RedisCommand {

    ErrorMessage WRONG_TYPE = new ErrorMessage("WRONGTYPE Operation against a key holding the wrong kind of value");

    // 执行命令，传入存储引擎和参数
    RedisMessage execute(StorageEngine storage, RedisMessage[] args);

    /**
     * 辅助工具：快速构建参数个数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 取第 index 个参数的原始字节，参数必须是非空 BulkString
     */
    default byte[] bytesArg(RedisMessage[] args, int index) {
        if (args[index] instanceof BulkString bulk && !bulk.isNull()) {
            return bulk.content();
        }
        throw new IllegalArgumentException("Protocol error: expected bulk string argument");
    }

    default String stringArg(RedisMessage[] args, int index) {
        bytesArg(args, index);
        return ((BulkString) args[index]).asString();
    }
}
