package org.muma.tinyredis.command.impl.string;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.common.RedisDataType;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        if (args.length != 1) {
            return errorArgs("get");
        }

        RedisData<?> data = storage.get(stringArg(args, 0));
        if (data == null) {
            return BulkString.NULL; // Nil
        }
        if (data.getType() != RedisDataType.STRING) {
            return WRONG_TYPE;
        }
        return new BulkString(data.getValue(byte[].class));
    }
}
