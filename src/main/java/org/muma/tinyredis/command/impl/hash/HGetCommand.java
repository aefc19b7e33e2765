package org.muma.tinyredis.command.impl.hash;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.common.RedisDataType;
import org.muma.tinyredis.common.RedisHash;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

public class HGetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        if (args.length != 2) {
            return errorArgs("hget");
        }

        RedisData<?> redisData = storage.get(stringArg(args, 0));
        if (redisData == null) {
            return BulkString.NULL;
        }
        if (redisData.getType() != RedisDataType.HASH) {
            return WRONG_TYPE;
        }

        byte[] value = redisData.getValue(RedisHash.class).get(stringArg(args, 1));
        return new BulkString(value); // value 为 null 时即 Nil
    }
}
