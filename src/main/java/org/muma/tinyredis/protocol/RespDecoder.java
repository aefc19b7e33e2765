package org.muma.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不足时回滚 readerIndex，等下一批字节到达后重新解析。
 * 帧错误 (RespProtocolException) 会被包装成 DecoderException 沿 pipeline 传给 exceptionCaught。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(RespCodec.decode(in));
    }
}
