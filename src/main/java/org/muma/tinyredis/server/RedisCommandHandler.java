package org.muma.tinyredis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import org.muma.tinyredis.command.CommandDispatcher;
import org.muma.tinyredis.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例
 * Netty 保证同一 Channel 的事件在同一个 EventLoop 上串行执行，
 * 因此一条连接上的请求严格按到达顺序处理和应答。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        RedisMessage response = dispatcher.dispatch(msg);
        if (response == null) {
            // 非法帧：只记日志，不回包，连接保持
            return;
        }

        ctx.writeAndFlush(response).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write response to {}, closing: {}",
                        ctx.channel().remoteAddress(), future.cause().getMessage());
                future.channel().close();
            }
        });
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.info("Closing idle connection: {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // 帧错误或 IO 错误：协议状态无法恢复，直接关闭连接
        log.warn("Closing connection {} after error: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
