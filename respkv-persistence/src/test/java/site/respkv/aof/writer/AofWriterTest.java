package site.respkv.aof.writer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AofWriter测试")
class AofWriterTest {

    @TempDir
    Path tempDir;

    private static ByteBuffer bytes(final String s) {
        return ByteBuffer.wrap(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("重新打开后在末尾追加")
    void testAppendAfterReopen() throws Exception {
        File file = tempDir.resolve("w.aof").toFile();

        AofWriter first = new AofWriter(file);
        first.write(bytes("abc"));
        first.close();

        AofWriter second = new AofWriter(file);
        assertEquals(3, second.write(bytes("def")));
        second.close();

        assertEquals("abcdef", Files.readString(file.toPath()));
    }

    @Test
    @DisplayName("文件被外部截断后seekToEnd避免产生空洞")
    void testSeekToEnd() throws Exception {
        File file = tempDir.resolve("t.aof").toFile();
        AofWriter writer = new AofWriter(file);
        writer.write(bytes("123456"));
        writer.flush();

        try (java.io.RandomAccessFile raf = new java.io.RandomAccessFile(file, "rw")) {
            raf.setLength(2);
        }
        assertEquals(2, writer.seekToEnd());
        writer.write(bytes("xy"));
        writer.close();

        assertEquals("12xy", Files.readString(file.toPath()));
    }

    @Test
    @DisplayName("关闭后写入抛出IOException，重复关闭无副作用")
    void testClosed() throws Exception {
        AofWriter writer = new AofWriter(tempDir.resolve("c.aof").toFile());
        writer.close();
        writer.close();

        assertThrows(IOException.class, () -> writer.write(bytes("x")));
    }
}
