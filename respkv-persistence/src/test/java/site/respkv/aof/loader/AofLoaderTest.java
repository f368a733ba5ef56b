package site.respkv.aof.loader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import site.respkv.aof.AofLoadException;
import site.respkv.core.command.CommandExecutor;
import site.respkv.datastructure.RedisBytes;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * AofLoader测试类
 */
@DisplayName("AOF加载器测试")
class AofLoaderTest {

    private static final String SET_K1 = "*3\r\n$3\r\nSET\r\n$2\r\nk1\r\n$2\r\nv1\r\n";
    private static final String HSET_H = "*4\r\n$4\r\nHSET\r\n$1\r\nh\r\n$1\r\nf\r\n$1\r\nv\r\n";

    @TempDir
    Path tempDir;

    private File aofFile;
    private CommandExecutor executor;

    @BeforeEach
    void setUp() {
        aofFile = tempDir.resolve("test.aof").toFile();
        executor = mock(CommandExecutor.class);
        when(executor.executeCommand(any(RedisBytes[].class))).thenReturn(true);
    }

    private static RedisBytes[] command(final String... parts) {
        RedisBytes[] result = new RedisBytes[parts.length];
        for (int i = 0; i < parts.length; i++) {
            result[i] = RedisBytes.fromString(parts[i]);
        }
        return result;
    }

    private void writeAofContent(final String content) throws Exception {
        Files.write(aofFile.toPath(), content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("文件操作测试")
    class FileOperationTests {

        @Test
        @DisplayName("不存在的文件不重放任何命令")
        void testNonExistentFile() throws Exception {
            AofLoader loader = new AofLoader(tempDir.resolve("missing.aof").toFile(), true);

            assertEquals(0, loader.load(executor));
            verify(executor, never()).executeCommand(any(RedisBytes[].class));
        }

        @Test
        @DisplayName("空文件不重放任何命令")
        void testEmptyFile() throws Exception {
            writeAofContent("");

            assertEquals(0, new AofLoader(aofFile, true).load(executor));
            verifyNoInteractions(executor);
        }
    }

    @Nested
    @DisplayName("命令重放测试")
    class ReplayTests {

        @Test
        @DisplayName("按文件顺序重放")
        void testReplayInOrder() throws Exception {
            // Given
            writeAofContent(SET_K1 + HSET_H);

            // When
            int applied = new AofLoader(aofFile, true).load(executor);

            // Then
            assertEquals(2, applied);
            InOrder inOrder = inOrder(executor);
            inOrder.verify(executor).executeCommand(eq(command("SET", "k1", "v1")));
            inOrder.verify(executor).executeCommand(eq(command("HSET", "h", "f", "v")));
        }

        @Test
        @DisplayName("非UTF-8字节按原样传给执行器")
        void testBinaryValuePreserved() throws Exception {
            // Given
            byte[] value = {(byte) 0xFF, (byte) 0xFE, 'a'};
            ByteArrayOutputStream content = new ByteArrayOutputStream();
            content.write("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$3\r\n".getBytes(StandardCharsets.US_ASCII));
            content.write(value);
            content.write("\r\n".getBytes(StandardCharsets.US_ASCII));
            Files.write(aofFile.toPath(), content.toByteArray());

            // When
            new AofLoader(aofFile, true).load(executor);

            // Then
            ArgumentCaptor<RedisBytes[]> captor = ArgumentCaptor.forClass(RedisBytes[].class);
            verify(executor).executeCommand(captor.capture());
            assertArrayEquals(value, captor.getValue()[2].getBytes());
        }

        @Test
        @DisplayName("未知命令跳过，后续命令照常重放")
        void testUnknownCommandSkipped() throws Exception {
            writeAofContent("*1\r\n$3\r\nFOO\r\n" + SET_K1);
            when(executor.executeCommand(command("FOO"))).thenReturn(false);

            int applied = new AofLoader(aofFile, true).load(executor);

            assertEquals(1, applied);
            verify(executor).executeCommand(eq(command("SET", "k1", "v1")));
        }
    }

    @Nested
    @DisplayName("损坏文件测试")
    class CorruptionTests {

        @Test
        @DisplayName("末尾不完整时截断到最后一个完整帧")
        void testTruncatedTail() throws Exception {
            // Given: 写入中途崩溃留下半条命令
            writeAofContent(SET_K1 + "*3\r\n$3\r\nSET\r\n$2\r\nk2");

            // When
            int applied = new AofLoader(aofFile, true).load(executor);

            // Then
            assertEquals(1, applied);
            assertEquals(SET_K1.length(), aofFile.length());
            verify(executor, never()).executeCommand(eq(command("SET", "k2", "v2")));
        }

        @Test
        @DisplayName("关闭截断选项时末尾不完整导致加载失败")
        void testTruncatedTailRejected() throws Exception {
            writeAofContent(SET_K1 + "*3\r\n$3\r\nSET");
            long length = aofFile.length();

            assertThrows(AofLoadException.class, () -> new AofLoader(aofFile, false).load(executor));
            assertEquals(length, aofFile.length());
        }

        @Test
        @DisplayName("格式错误的帧导致加载失败")
        void testMalformedFrame() throws Exception {
            writeAofContent(SET_K1 + "*2\r\n$x\r\n");

            AofLoadException e = assertThrows(AofLoadException.class,
                    () -> new AofLoader(aofFile, true).load(executor));
            assertTrue(e.getMessage().contains(String.valueOf(SET_K1.length())));
        }

        @Test
        @DisplayName("不是命令数组的记录导致加载失败")
        void testNonArrayRecord() throws Exception {
            writeAofContent("+OK\r\n");

            assertThrows(AofLoadException.class, () -> new AofLoader(aofFile, true).load(executor));
        }

        @Test
        @DisplayName("空数组记录导致加载失败")
        void testEmptyArrayRecord() throws Exception {
            writeAofContent("*0\r\n");

            assertThrows(AofLoadException.class, () -> new AofLoader(aofFile, true).load(executor));
        }
    }
}
