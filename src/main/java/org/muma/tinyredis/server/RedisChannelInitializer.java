package org.muma.tinyredis.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.timeout.IdleStateHandler;
import org.muma.tinyredis.command.CommandDispatcher;
import org.muma.tinyredis.protocol.RespDecoder;
import org.muma.tinyredis.protocol.RespEncoder;

import java.util.concurrent.TimeUnit;

/**
 * 每条新连接的 pipeline：[Idle] -> RespDecoder -> RespEncoder -> RedisCommandHandler
 */
public class RedisChannelInitializer extends ChannelInitializer<Channel> {

    private final CommandDispatcher dispatcher;
    private final int idleTimeoutSeconds;

    public RedisChannelInitializer(CommandDispatcher dispatcher, int idleTimeoutSeconds) {
        this.dispatcher = dispatcher;
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        if (idleTimeoutSeconds > 0) {
            pipeline.addLast(new IdleStateHandler(idleTimeoutSeconds, 0, 0, TimeUnit.SECONDS));
        }
        pipeline.addLast(new RespDecoder())
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(dispatcher));
    }
}
