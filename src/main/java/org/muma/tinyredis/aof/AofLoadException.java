package org.muma.tinyredis.aof;

import java.io.IOException;

/**
 * AOF 重放失败：文件截断或记录损坏。
 * 启动阶段遇到它必须直接退出，不能带着与日志不一致的内存状态对外服务。
 */
public class AofLoadException extends IOException {

    private final long offset;

    public AofLoadException(String message, long offset, Throwable cause) {
        super(message + " (offset " + offset + ")", cause);
        this.offset = offset;
    }

    /**
     * 出错记录在文件中的起始字节位置
     */
    public long getOffset() {
        return offset;
    }
}
