package org.muma.tinyredis.command.impl.hash;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.common.RedisDataType;
import org.muma.tinyredis.common.RedisHash;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

import java.util.Map;

public class HGetAllCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        // HGETALL key
        if (args.length != 1) {
            return errorArgs("hgetall");
        }

        RedisData<?> redisData = storage.get(stringArg(args, 0));
        if (redisData == null) {
            return new RedisArray(new RedisMessage[0]); // 返回空数组
        }
        if (redisData.getType() != RedisDataType.HASH) {
            return WRONG_TYPE;
        }

        Map<String, byte[]> all = redisData.getValue(RedisHash.class).toMap();

        // 构造 RESP 数组: [field1, val1, field2, val2, ...]
        RedisMessage[] result = new RedisMessage[all.size() * 2];
        int i = 0;
        for (Map.Entry<String, byte[]> entry : all.entrySet()) {
            result[i++] = new BulkString(entry.getKey());
            result[i++] = new BulkString(entry.getValue());
        }
        return new RedisArray(result);
    }
}
