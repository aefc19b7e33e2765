package org.muma.tinyredis.command.impl.string;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.common.RedisData;
import org.muma.tinyredis.common.RedisDataType;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.store.StorageEngine;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        // SET key value，不支持 EX/PX (没有过期机制)
        if (args.length != 2) {
            return errorArgs("set");
        }

        String key = stringArg(args, 0);
        byte[] value = bytesArg(args, 1);

        // 直接覆盖，不管原来是什么类型
        storage.put(key, new RedisData<>(RedisDataType.STRING, value));
        return SimpleString.OK;
    }
}
