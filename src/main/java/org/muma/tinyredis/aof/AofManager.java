package org.muma.tinyredis.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.tinyredis.config.MiniRedisConfig;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.RespCodec;
import org.muma.tinyredis.protocol.RespProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * AOF 核心管理器
 * 负责生命周期 (UNOPENED -> OPEN -> CLOSED)、命令追加与启动重放。
 * <p>
 * 日志文件就是原始请求数组的 RESP 编码首尾相接，没有头部、分隔符或版本号。
 */
public class AofManager {

    private static final Logger log = LoggerFactory.getLogger(AofManager.class);

    public enum State {
        UNOPENED, OPEN, CLOSED
    }

    private final MiniRedisConfig config;
    private final AofDiskWriter diskWriter;
    private volatile State state = State.UNOPENED;

    public AofManager(MiniRedisConfig config) {
        this(config, new AofDiskWriter(config.getAofPath(), config.getAppendFsync(), config.getAppendFsyncIntervalMs()));
    }

    AofManager(MiniRedisConfig config, AofDiskWriter diskWriter) {
        this.config = config;
        this.diskWriter = diskWriter;
    }

    /**
     * 打开 AOF 文件并启动刷盘任务
     * 失败直接抛出，启动流程应当终止。
     */
    public synchronized void init() throws IOException {
        if (!config.isAppendOnly()) {
            log.info("AOF disabled (appendonly=no), commands will not be persisted.");
            return;
        }
        if (state != State.UNOPENED) {
            throw new IllegalStateException("AOF already initialized, state=" + state);
        }
        diskWriter.open();
        state = State.OPEN;
        log.info("AOF ready: {} ({} bytes)", diskWriter.getPath(), diskWriter.size());
    }

    /**
     * 追加一条写命令 (任意线程调用)
     * 编码后整体写入，与其他 append 以及刷盘互斥。
     */
    public void append(RedisArray command) throws IOException {
        if (!config.isAppendOnly()) return;
        if (state != State.OPEN) {
            throw new IOException("AOF not writable, state=" + state);
        }
        diskWriter.write(RespCodec.encode(command));
    }

    /**
     * 从文件头开始逐条解码，每条记录交给 apply。
     * 重放过程本身不会写日志。
     *
     * @return 重放的记录条数
     * @throws AofLoadException 文件截断或记录损坏
     */
    public int replay(Consumer<RedisMessage> apply) throws IOException {
        if (!config.isAppendOnly()) return 0;
        if (state == State.CLOSED) {
            throw new IllegalStateException("AOF already closed");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(diskWriter.readAll());
        int count = 0;
        try {
            while (buf.isReadable()) {
                int offset = buf.readerIndex();
                RedisMessage record;
                try {
                    record = RespCodec.decode(buf);
                } catch (IndexOutOfBoundsException e) {
                    throw new AofLoadException("AOF truncated in the middle of a record", offset, e);
                } catch (RespProtocolException e) {
                    throw new AofLoadException("Corrupt AOF record: " + e.getMessage(), offset, e);
                }
                apply.accept(record);
                count++;
            }
        } finally {
            buf.release();
        }
        return count;
    }

    /**
     * 当前日志文件字节数
     */
    public long size() throws IOException {
        return diskWriter.size();
    }

    public State getState() {
        return state;
    }

    public boolean isEnabled() {
        return config.isAppendOnly();
    }

    /**
     * 停止刷盘任务并关闭文件，只应在所有连接停止写入之后调用
     */
    public synchronized void shutdown() {
        if (state == State.CLOSED) return;
        state = State.CLOSED;
        diskWriter.close();
    }
}
