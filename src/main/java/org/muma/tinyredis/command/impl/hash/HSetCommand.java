package org.muma.tinyredis.command.impl.hash;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.common.RedisDataType;
import org.muma.tinyredis.common.RedisHash;
import org.muma.tinyredis.protocol.RedisInteger;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

public class HSetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        // 标准格式: HSET key field value [field value ...]
        // 参数校验：Key 之后必须是成对的 FV
        if (args.length < 3 || (args.length - 1) % 2 != 0) {
            return errorArgs("hset");
        }

        String key = stringArg(args, 0);
        int createdCount = 0;

        // 查找-创建-写入 必须原子，否则两个连接同时 HSET 新 key 会互相覆盖
        synchronized (storage.getLock(key)) {
            RedisData<?> redisData = storage.get(key);
            RedisHash hash;

            if (redisData == null) {
                hash = new RedisHash();
                storage.put(key, new RedisData<>(RedisDataType.HASH, hash));
            } else {
                if (redisData.getType() != RedisDataType.HASH) {
                    return WRONG_TYPE;
                }
                hash = redisData.getValue(RedisHash.class);
            }

            // 循环处理每一对 field-value
            for (int i = 1; i < args.length; i += 2) {
                createdCount += hash.put(stringArg(args, i), bytesArg(args, i + 1));
            }
        }

        return new RedisInteger(createdCount);
    }
}
