package org.muma.tinyredis.command.impl.server;

import org.muma.tinyredis.command.RedisCommand;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.store.StorageEngine;

public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisMessage[] args) {
        // PING [message]
        if (args.length == 0) {
            return PONG;
        }
        if (args.length > 1) {
            return errorArgs("ping");
        }
        return new BulkString(bytesArg(args, 0));
    }
}
