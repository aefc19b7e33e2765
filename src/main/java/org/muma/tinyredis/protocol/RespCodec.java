package org.muma.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 编解码核心
 * <p>
 * 网络链路 (RespDecoder / RespEncoder) 与 AOF 文件共用这一套逻辑：
 * 1. decode 从 ByteBuf 当前位置读取恰好一个完整单元，不多读。
 * 2. encode 对全部六种类型都有定义，数组递归编码。
 * <p>
 * 数据不足时 decode 不做任何处理，直接让 ByteBuf 抛出异常：
 * ReplayingDecoder 会据此回滚并等待更多数据，普通 ByteBuf 则抛 IndexOutOfBoundsException。
 */
public final class RespCodec {

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    // 与 Redis proto-max-bulk-len 默认值一致
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    private static final int INITIAL_ARRAY_CAPACITY = 16;

    private RespCodec() {
    }

    // ---------------- Decode ----------------

    public static RedisMessage decode(ByteBuf in) {
        // 1. 读取类型标识字节
        byte marker = in.readByte();
        RespType type = RespType.fromMarker(marker);
        if (type == null) {
            throw new RespProtocolException("Unknown RESP type byte: 0x" + Integer.toHexString(marker & 0xFF));
        }

        // 2. 根据类型分发处理
        return switch (type) {
            case SIMPLE_STRING -> new SimpleString(readLine(in));
            case ERROR -> new ErrorMessage(readLine(in));
            case INTEGER -> new RedisInteger(readLong(in));
            case ARRAY -> decodeArray(in);
            case BULK_STRING, NULL_BULK -> decodeBulkString(in);
        };
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static RedisArray decodeArray(ByteBuf in) {
        long count = readLong(in);
        if (count < -1) {
            throw new RespProtocolException("Invalid array length: " + count);
        }
        // 没有 null array 这种类型，*-1 与 *0 一样视为空数组
        if (count <= 0) {
            return new RedisArray(new RedisMessage[0]);
        }
        if (count > Integer.MAX_VALUE) {
            throw new RespProtocolException("Array length too large: " + count);
        }

        // 声明的长度不可信，按已到达的元素逐个扩容
        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, INITIAL_ARRAY_CAPACITY));
        for (long i = 0; i < count; i++) {
            elements.add(decode(in));
        }
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new RespProtocolException("Invalid bulk length: " + length);
        }

        // 按长度读取，内容里出现 CR/LF 也无所谓。数据到齐之前不分配内存
        byte[] content = ByteBufUtil.getBytes(in.readSlice((int) length));

        // 读取末尾的 CRLF
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException("Expected CRLF after bulk string payload");
        }
        return new BulkString(content);
    }

    // 读取一行（到 \r\n 为止），返回不含 CRLF 的内容
    private static String readLine(ByteBuf in) {
        ByteArrayOutputStream line = new ByteArrayOutputStream(32);
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                // 只看不读，下一个字节可能是真正行尾的 CR
                if (in.isReadable() && in.getByte(in.readerIndex()) == LF) {
                    in.skipBytes(1);
                    break;
                }
                line.write(b);
            } else {
                line.write(b);
            }
        }
        return line.toString(StandardCharsets.UTF_8);
    }

    private static long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("Invalid integer line: '" + s + "'", e);
        }
    }

    // ---------------- Encode ----------------

    public static void encode(RedisMessage msg, ByteBuf out) {
        out.writeByte(msg.type().marker());
        if (msg instanceof SimpleString s) {
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            writeNumber(out, a.elements().length);
            for (RedisMessage element : a.elements()) {
                encode(element, out);
            }
        }
    }

    /**
     * 编码为独立的字节数组 (AOF 写入用)
     */
    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(128);
        try {
            encode(msg, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeNumber(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
