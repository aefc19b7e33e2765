package org.muma.tinyredis.protocol;

/**
 * 协议帧错误 (长度非法、类型字节无法识别、缺少 CRLF 等)
 * 帧一旦出错就无法重新同步，持有该流的连接必须关闭。
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
