package org.muma.tinyredis.command.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.tinyredis.command.impl.hash.HGetAllCommand;
import org.muma.tinyredis.command.impl.hash.HGetCommand;
import org.muma.tinyredis.command.impl.hash.HSetCommand;
import org.muma.tinyredis.command.impl.string.SetCommand;
import org.muma.tinyredis.protocol.*;
import org.muma.tinyredis.store.StorageEngine;
import org.muma.tinyredis.store.impl.MemoryStorageEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class HashCommandTest {

    private StorageEngine storage;
    private HSetCommand hSet;
    private HGetCommand hGet;
    private HGetAllCommand hGetAll;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        hSet = new HSetCommand();
        hGet = new HGetCommand();
        hGetAll = new HGetAllCommand();
    }

    // --- 辅助方法：构建参数 (不含命令名) ---
    private RedisMessage[] args(String... args) {
        return RedisArray.of(args).elements();
    }

    private long asLong(RedisMessage msg) {
        return assertInstanceOf(RedisInteger.class, msg).value();
    }

    @Test
    void testHSetAndHGet() {
        // 1. 新增字段
        assertEquals(1, asLong(hSet.execute(storage, args("user:1", "name", "root"))));

        // 2. 更新字段
        assertEquals(0, asLong(hSet.execute(storage, args("user:1", "name", "admin"))));

        // 3. 获取字段
        assertEquals(new BulkString("admin"), hGet.execute(storage, args("user:1", "name")));

        // 4. 获取不存在的字段 / key
        assertEquals(BulkString.NULL, hGet.execute(storage, args("user:1", "age")));
        assertEquals(BulkString.NULL, hGet.execute(storage, args("nobody", "age")));
    }

    @Test
    void testHSetMultiplePairs() {
        assertEquals(2, asLong(hSet.execute(storage, args("h", "a", "1", "b", "2"))));
        assertEquals(1, asLong(hSet.execute(storage, args("h", "b", "3", "c", "4"))));
    }

    @Test
    void testHGetAllKeepsInsertionOrder() {
        hSet.execute(storage, args("u1", "k1", "v1"));
        hSet.execute(storage, args("u1", "k2", "v2"));

        RedisArray result = assertInstanceOf(RedisArray.class, hGetAll.execute(storage, args("u1")));
        assertEquals(RedisArray.of("k1", "v1", "k2", "v2"), result);

        RedisArray empty = assertInstanceOf(RedisArray.class, hGetAll.execute(storage, args("missing")));
        assertEquals(0, empty.size());
    }

    @Test
    void testArityAndTypeErrors() {
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'hset' command"),
                hSet.execute(storage, args("h", "f")));
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'hset' command"),
                hSet.execute(storage, args("h", "f", "v", "dangling")));
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'hget' command"),
                hGet.execute(storage, args("h")));

        new SetCommand().execute(storage, args("str", "value"));
        assertInstanceOf(ErrorMessage.class, hSet.execute(storage, args("str", "f", "v")));
        assertInstanceOf(ErrorMessage.class, hGet.execute(storage, args("str", "f")));
        assertInstanceOf(ErrorMessage.class, hGetAll.execute(storage, args("str")));
    }

    @Test
    void testConcurrentHSetOnNewKeyKeepsAllFields() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String field = "f" + t;
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                hSet.execute(storage, args("shared", field, "v"));
            });
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        RedisArray all = (RedisArray) hGetAll.execute(storage, args("shared"));
        assertEquals(threads * 2, all.size());
    }
}
