package org.muma.tinyredis.aof;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.tinyredis.config.MiniRedisConfig;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.RespCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class AofManagerTest {

    @TempDir
    Path tempDir;

    private MiniRedisConfig config;
    private AofManager manager;

    @BeforeEach
    void setUp() {
        config = new MiniRedisConfig();
        config.setAppendDir(tempDir.toString());
        config.setAppendFilename("appendonly.aof");
        config.setAppendFsync(MiniRedisConfig.AppendFsync.ALWAYS); // 方便测试立即刷盘
        manager = new AofManager(config);
    }

    @AfterEach
    void tearDown() {
        if (manager != null) manager.shutdown();
    }

    private Path aofFile() {
        return tempDir.resolve("appendonly.aof");
    }

    @Test
    void testAppendIsConcatenationInCallOrder() throws IOException {
        manager.init();
        RedisArray first = RedisArray.of("SET", "k1", "v1");
        RedisArray second = RedisArray.of("HSET", "h", "f", "v");

        manager.append(first);
        manager.append(second);

        byte[] expected1 = RespCodec.encode(first);
        byte[] expected2 = RespCodec.encode(second);
        byte[] content = Files.readAllBytes(aofFile());

        assertEquals(expected1.length + expected2.length, content.length);
        assertEquals(new String(expected1, StandardCharsets.UTF_8) + new String(expected2, StandardCharsets.UTF_8),
                new String(content, StandardCharsets.UTF_8));
    }

    @Test
    void testReplayYieldsRecordsInOrderWithoutAppending() throws IOException {
        manager.init();
        manager.append(RedisArray.of("SET", "a", "1"));
        manager.append(RedisArray.of("SET", "b", "line\r\nbreak"));
        manager.append(RedisArray.of("SET", "a", "3"));
        long sizeBefore = manager.size();

        List<RedisMessage> replayed = new ArrayList<>();
        int count = manager.replay(replayed::add);

        assertEquals(3, count);
        assertEquals(List.of(
                RedisArray.of("SET", "a", "1"),
                RedisArray.of("SET", "b", "line\r\nbreak"),
                RedisArray.of("SET", "a", "3")), replayed);
        assertEquals(sizeBefore, manager.size(), "replay must not grow the log");
    }

    @Test
    void testReplayEmptyOrMissingFile() throws IOException {
        List<RedisMessage> replayed = new ArrayList<>();
        assertEquals(0, manager.replay(replayed::add));

        manager.init();
        assertTrue(Files.exists(aofFile()), "init creates the file");
        assertEquals(0, manager.replay(replayed::add));
        assertTrue(replayed.isEmpty());
    }

    @Test
    void testTruncatedLogFailsReplay() throws IOException {
        String good = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n";
        Files.writeString(aofFile(), good + "*3\r\n$3\r\nSET\r\n$1\r\nk");
        manager.init();

        List<RedisMessage> replayed = new ArrayList<>();
        AofLoadException e = assertThrows(AofLoadException.class, () -> manager.replay(replayed::add));

        assertEquals(good.length(), e.getOffset());
        assertEquals(1, replayed.size(), "records before the damage are still applied");
    }

    @Test
    void testCorruptLogFailsReplay() throws IOException {
        Files.writeString(aofFile(), "*1\r\n$4\r\nPING\r\n!garbage\r\n");
        manager.init();

        AofLoadException e = assertThrows(AofLoadException.class, () -> manager.replay(record -> { }));
        assertEquals(14, e.getOffset());
        assertTrue(e.getMessage().contains("Corrupt"));
    }

    @Test
    void testLifecycle() throws IOException {
        assertEquals(AofManager.State.UNOPENED, manager.getState());
        assertThrows(IOException.class, () -> manager.append(RedisArray.of("SET", "k", "v")));

        manager.init();
        assertEquals(AofManager.State.OPEN, manager.getState());
        assertThrows(IllegalStateException.class, () -> manager.init());

        manager.shutdown();
        manager.shutdown();
        assertEquals(AofManager.State.CLOSED, manager.getState());
        assertThrows(IOException.class, () -> manager.append(RedisArray.of("SET", "k", "v")));
        assertThrows(IllegalStateException.class, () -> manager.replay(record -> { }));
    }

    @Test
    void testDisabledAofIsNoop() throws IOException {
        config.setAppendOnly(false);
        manager.init();
        manager.append(RedisArray.of("SET", "k", "v"));

        assertFalse(Files.exists(aofFile()));
        assertEquals(0, manager.replay(record -> fail("nothing to replay")));
    }

    @Test
    void testConcurrentAppendsNeverInterleave() throws Exception {
        config.setAppendFsync(MiniRedisConfig.AppendFsync.EVERYSEC);
        config.setAppendFsyncIntervalMs(5); // 让刷盘与写入频繁交错
        manager.shutdown();
        manager = new AofManager(config);
        manager.init();

        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int id = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    manager.append(RedisArray.of("SET", "key-" + id + "-" + i, "value-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get();
        }
        pool.shutdown();

        List<RedisMessage> replayed = new ArrayList<>();
        assertEquals(threads * perThread, manager.replay(replayed::add));
        for (RedisMessage record : replayed) {
            RedisArray array = assertInstanceOf(RedisArray.class, record);
            assertEquals(3, array.size());
        }
    }
}
