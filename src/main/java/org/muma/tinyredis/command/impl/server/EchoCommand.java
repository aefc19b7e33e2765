package org.muma.tinyredis.command.impl.server;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        if (args.length != 1) {
            return errorArgs("echo");
        }
        return new BulkString(bytesArg(args, 0));
    }
}
