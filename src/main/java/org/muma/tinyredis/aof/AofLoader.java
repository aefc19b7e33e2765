package org.muma.tinyredis.aof;

import org.muma.tinyredis.command.CommandDispatcher;
import org.muma.tinyredis.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * AOF 加载器 (Recovery)
 * 负责在启动时重放 AOF 文件，必须在监听端口之前完成。
 */
public class AofLoader {

    private static final Logger log = LoggerFactory.getLogger(AofLoader.class);

    private static final int PROGRESS_EVERY = 100_000;

    private final AofManager aofManager;
    private final CommandDispatcher dispatcher;

    private int replayed;
    private long lastLogTime;

    public AofLoader(AofManager aofManager, CommandDispatcher dispatcher) {
        this.aofManager = aofManager;
        this.dispatcher = dispatcher;
    }

    /**
     * @return 重放的命令条数
     * @throws AofLoadException 日志损坏，调用方应终止启动
     */
    public int load() throws IOException {
        if (!aofManager.isEnabled()) {
            return 0;
        }

        long fileSize = aofManager.size();
        log.info("Start loading AOF (Size: {} bytes)", fileSize);

        long startTime = System.currentTimeMillis();
        replayed = 0;
        lastLogTime = startTime;

        int count = aofManager.replay(this::apply);

        long duration = System.currentTimeMillis() - startTime;
        log.info("AOF loaded successfully. Total commands: {}. Duration: {} ms", count, duration);
        return count;
    }

    private void apply(RedisMessage record) {
        dispatcher.replay(record);
        replayed++;

        // 【进度监控】每 10万 条检查一次，距上次输出超过 2 秒才打印
        if (replayed % PROGRESS_EVERY == 0) {
            long now = System.currentTimeMillis();
            if (now - lastLogTime > 2000) {
                log.info("AOF loading progress: {} commands processed...", replayed);
                lastLogTime = now;
            }
        }
    }
}
