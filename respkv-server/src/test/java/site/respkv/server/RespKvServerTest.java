package site.respkv.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import site.respkv.aof.AofLoadException;
import site.respkv.aof.writer.AofSyncPolicy;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespReader;
import site.respkv.protocol.SimpleString;
import site.respkv.server.config.RedisServerConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RespKvServer集成测试")
class RespKvServerTest {

    @TempDir
    Path tempDir;

    private RespKvServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private RedisServerConfig config(final Path aofFile) {
        return RedisServerConfig.builder()
                .port(0)
                .bossThreadCount(1)
                .workerThreadCount(2)
                .commandExecutorThreadCount(2)
                .aofFileName(aofFile.toString())
                .appendFsync(AofSyncPolicy.ALWAYS)
                .build();
    }

    /**
     * 简单的阻塞客户端
     */
    private static final class Client implements AutoCloseable {
        private final Socket socket;
        private final OutputStream out;
        private final RespReader reader;

        Client(final int port) throws IOException {
            socket = new Socket("127.0.0.1", port);
            socket.setSoTimeout(5000);
            out = socket.getOutputStream();
            reader = new RespReader(socket.getInputStream());
        }

        Resp call(final String... parts) throws IOException {
            out.write(RespArray.ofCommand(parts).toBytes());
            out.flush();
            return reader.read();
        }

        Resp call(final byte[]... parts) throws IOException {
            Resp[] array = new Resp[parts.length];
            for (int i = 0; i < parts.length; i++) {
                array[i] = BulkString.create(parts[i]);
            }
            out.write(new RespArray(array).toBytes());
            out.flush();
            return reader.read();
        }

        Resp raw(final String data) throws IOException {
            out.write(data.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return reader.read();
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    @Test
    @DisplayName("通过TCP执行命令")
    void testCommandsOverTcp() throws Exception {
        server = new RespKvServer(config(tempDir.resolve("a.aof")));
        server.start();

        try (Client client = new Client(server.getPort())) {
            assertThat(client.call("PING")).isEqualTo(SimpleString.PONG);
            assertThat(client.call("SET", "k", "v")).isEqualTo(SimpleString.OK);
            assertThat(client.call("GET", "k")).isEqualTo(BulkString.fromString("v"));
            assertThat(client.call("HSET", "h", "f", "x")).isEqualTo(SimpleString.OK);
            assertThat(client.call("HGET", "h", "f")).isEqualTo(BulkString.fromString("x"));
            assertThat(client.call("NOPE")).isInstanceOf(Errors.class);
            assertThat(client.raw("PING\r\n")).isEqualTo(SimpleString.PONG);
        }
    }

    @Test
    @DisplayName("重启后从AOF恢复数据，被拒绝的命令不会记录")
    void testDurabilityAcrossRestart() throws Exception {
        Path aofFile = tempDir.resolve("restart.aof");
        server = new RespKvServer(config(aofFile));
        server.start();
        try (Client client = new Client(server.getPort())) {
            client.call("SET", "k", "v");
            client.call("HSET", "h", "f", "x");
            assertThat(client.call("SET", "bad", "v", "EX", "abc")).isInstanceOf(Errors.class);
        }
        server.stop();

        byte[] expected = concat(RespArray.ofCommand("SET", "k", "v").toBytes(),
                RespArray.ofCommand("HSET", "h", "f", "x").toBytes());
        assertThat(Files.readAllBytes(aofFile)).isEqualTo(expected);

        server = new RespKvServer(config(aofFile));
        server.start();
        try (Client client = new Client(server.getPort())) {
            assertThat(client.call("GET", "k")).isEqualTo(BulkString.fromString("v"));
            assertThat(client.call("HGET", "h", "f")).isEqualTo(BulkString.fromString("x"));
            assertThat(client.call("GET", "bad")).isEqualTo(BulkString.NULL);
        }
        server.stop();

        assertThat(Files.readAllBytes(aofFile)).isEqualTo(expected);
    }

    @Test
    @DisplayName("非UTF-8的值重启后逐字节一致")
    void testBinaryValueAcrossRestart() throws Exception {
        Path aofFile = tempDir.resolve("binary.aof");
        byte[] value = {(byte) 0xFF, (byte) 0xFE, 'a'};
        byte[] set = "SET".getBytes(StandardCharsets.US_ASCII);
        byte[] get = "GET".getBytes(StandardCharsets.US_ASCII);
        byte[] key = "bin".getBytes(StandardCharsets.US_ASCII);

        server = new RespKvServer(config(aofFile));
        server.start();
        try (Client client = new Client(server.getPort())) {
            assertThat(client.call(set, key, value)).isEqualTo(SimpleString.OK);
            assertThat(client.call(get, key).asBytes().getBytes()).isEqualTo(value);
        }
        server.stop();

        server = new RespKvServer(config(aofFile));
        server.start();
        try (Client client = new Client(server.getPort())) {
            assertThat(client.call(get, key).asBytes().getBytes()).isEqualTo(value);
        }
    }

    @Test
    @DisplayName("AOF损坏时启动失败")
    void testCorruptAofFailsStartup() throws Exception {
        Path aofFile = tempDir.resolve("corrupt.aof");
        Files.write(aofFile, "?garbage\r\n".getBytes(StandardCharsets.UTF_8));

        RespKvServer broken = new RespKvServer(config(aofFile));

        assertThatThrownBy(broken::start).isInstanceOf(AofLoadException.class);
    }

    @Test
    @DisplayName("格式错误的请求收到错误后连接被关闭")
    void testMalformedRequestClosesConnection() throws Exception {
        server = new RespKvServer(config(tempDir.resolve("m.aof")));
        server.start();

        try (Client client = new Client(server.getPort())) {
            Resp reply = client.raw("*1\r\n$x\r\n");
            assertThat(reply).isInstanceOf(Errors.class);
            assertThat(((Errors) reply).getContent()).startsWith("ERR Protocol error");
            assertThatThrownBy(() -> client.call("PING")).isInstanceOf(IOException.class);
        }
    }

    private static byte[] concat(final byte[] a, final byte[] b) {
        byte[] result = new byte[a.length + b.length];
        System.arraycopy(a, 0, result, 0, a.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
