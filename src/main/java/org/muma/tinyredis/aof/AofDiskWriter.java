package org.muma.tinyredis.aof;

import org.muma.tinyredis.config.MiniRedisConfig.AppendFsync;
import org.muma.tinyredis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AOF 物理写入器
 * <p>
 * 1. 调用方线程 -> lock -> FileChannel.write -> OS Cache
 * 2. Fsync 线程 (AOF-Fsync) -> 定时 lock -> force() -> Disk
 * <p>
 * 写入、刷盘、关闭共用一把锁，刷盘永远不会看到写了一半的记录。
 */
public class AofDiskWriter {

    private static final Logger log = LoggerFactory.getLogger(AofDiskWriter.class);

    private final Path path;
    private final AppendFsync fsyncPolicy;
    private final long fsyncIntervalMs;

    private final ReentrantLock lock = new ReentrantLock();
    private FileChannel fileChannel;
    private ScheduledExecutorService fsyncExecutor;
    private boolean closed = false;

    public AofDiskWriter(Path path, AppendFsync fsyncPolicy, long fsyncIntervalMs) {
        this.path = path;
        this.fsyncPolicy = fsyncPolicy;
        this.fsyncIntervalMs = fsyncIntervalMs;
    }

    /**
     * 打开文件 (不存在则创建)，EVERYSEC 策略下启动定时刷盘线程
     */
    public void open() throws IOException {
        lock.lock();
        try {
            if (closed) {
                throw new IOException("AOF writer already closed: " + path);
            }
            if (fileChannel != null) {
                return;
            }
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            this.fileChannel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            log.info("Opened AOF file: {} (fsync={})", path.toAbsolutePath(), fsyncPolicy);
        } finally {
            lock.unlock();
        }

        if (fsyncPolicy == AppendFsync.EVERYSEC) {
            this.fsyncExecutor = Executors.newSingleThreadScheduledExecutor(
                    ThreadUtils.namedThreadFactory("AOF-Fsync")
            );
            this.fsyncExecutor.scheduleWithFixedDelay(this::performFsync,
                    fsyncIntervalMs, fsyncIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * 追加写入一条完整记录
     */
    public void write(byte[] content) throws IOException {
        lock.lock();
        try {
            ensureOpen();
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                fileChannel.write(buf);
            }

            // ALWAYS 策略：同步刷盘
            if (fsyncPolicy == AppendFsync.ALWAYS) {
                fileChannel.force(false);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 把已写入的数据强制落盘
     */
    public void flush() throws IOException {
        lock.lock();
        try {
            ensureOpen();
            fileChannel.force(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在锁内读取整个文件，用于启动时重放
     */
    public byte[] readAll() throws IOException {
        lock.lock();
        try {
            if (!Files.exists(path)) {
                return new byte[0];
            }
            return Files.readAllBytes(path);
        } finally {
            lock.unlock();
        }
    }

    public long size() throws IOException {
        lock.lock();
        try {
            if (fileChannel != null) {
                return fileChannel.size();
            }
            return Files.exists(path) ? Files.size(path) : 0;
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    private void performFsync() {
        try {
            flush();
        } catch (IOException e) {
            log.warn("AOF fsync failed", e);
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("AOF is closed: " + path);
        }
        if (fileChannel == null) {
            throw new IOException("AOF is not open: " + path);
        }
    }

    /**
     * 停止刷盘线程，最后一次 force 后关闭文件。重复调用无副作用。
     */
    public void close() {
        // 先停定时任务，再拿锁关 channel，避免 fsync 与 close 交错
        if (fsyncExecutor != null) {
            fsyncExecutor.shutdown();
            try {
                if (!fsyncExecutor.awaitTermination(fsyncIntervalMs + 1000, TimeUnit.MILLISECONDS)) {
                    fsyncExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                fsyncExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (fileChannel != null) {
                try {
                    fileChannel.force(true);
                    fileChannel.close();
                    log.info("Closed AOF file: {}", path.toAbsolutePath());
                } catch (IOException e) {
                    log.error("Error closing AOF channel", e);
                } finally {
                    fileChannel = null;
                }
            }
        } finally {
            lock.unlock();
        }
    }
}
