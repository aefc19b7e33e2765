package org.muma.tinyredis.aof;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.tinyredis.config.MiniRedisConfig.AppendFsync;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AofDiskWriterTest {

    @TempDir
    Path tempDir;

    private AofDiskWriter writer;

    @AfterEach
    void tearDown() {
        if (writer != null) writer.close();
    }

    @Test
    void testWriteRespCommand() throws IOException {
        Path file = tempDir.resolve("nested/dir/test.aof");
        writer = new AofDiskWriter(file, AppendFsync.ALWAYS, 1000);
        writer.open();

        // *3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n
        String respCmd = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n";
        writer.write(respCmd.getBytes(StandardCharsets.UTF_8));

        // ALWAYS 策略下写完立即可见，父目录会被自动创建
        assertEquals(respCmd, Files.readString(file));
        assertEquals(respCmd.length(), writer.size());
    }

    @Test
    void testReopenAppendsToExistingFile() throws IOException {
        Path file = tempDir.resolve("append.aof");
        Files.writeString(file, "*1\r\n$4\r\nPING\r\n");

        writer = new AofDiskWriter(file, AppendFsync.NO, 1000);
        writer.open();
        writer.write("*1\r\n$4\r\nPONG\r\n".getBytes(StandardCharsets.UTF_8));
        writer.close();

        assertEquals("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPONG\r\n", Files.readString(file));
    }

    @Test
    void testEverysecFlushesPeriodicallyUntilClosed() throws Exception {
        Path file = tempDir.resolve("everysec.aof");
        writer = spy(new AofDiskWriter(file, AppendFsync.EVERYSEC, 20));
        writer.open();
        writer.write("*1\r\n$3\r\nGET\r\n".getBytes(StandardCharsets.UTF_8));

        // 后台线程按间隔反复刷盘
        verify(writer, timeout(1000).atLeast(2)).flush();
        assertTrue(Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.getName().startsWith("AOF-Fsync")));

        // 关闭后刷盘任务必须停止
        writer.close();
        clearInvocations(writer);
        Thread.sleep(100);
        verify(writer, never()).flush();
        assertEquals(13, Files.size(file));
    }

    @Test
    void testCloseIsIdempotentAndRejectsWrites() throws IOException {
        Path file = tempDir.resolve("closed.aof");
        writer = new AofDiskWriter(file, AppendFsync.EVERYSEC, 1000);
        writer.open();
        writer.close();
        writer.close();

        IOException e = assertThrows(IOException.class, () -> writer.write(new byte[]{'x'}));
        assertTrue(e.getMessage().contains("closed"));
        assertThrows(IOException.class, () -> writer.flush());
        assertThrows(IOException.class, () -> writer.open());
    }

    @Test
    void testWriteBeforeOpenFails() {
        writer = new AofDiskWriter(tempDir.resolve("never.aof"), AppendFsync.NO, 1000);
        assertThrows(IOException.class, () -> writer.write(new byte[]{'x'}));
    }

    @Test
    void testReadAllOfMissingFileIsEmpty() throws IOException {
        writer = new AofDiskWriter(tempDir.resolve("missing.aof"), AppendFsync.NO, 1000);
        assertEquals(0, writer.readAll().length);
        assertEquals(0, writer.size());
    }
}
