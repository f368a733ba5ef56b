package site.respkv.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.aof.AofManager;
import site.respkv.core.RedisCoreImpl;
import site.respkv.protocol.handler.RespDecoder;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.server.context.RedisContextImpl;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RespCommandHandler测试")
class RespCommandHandlerTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        RedisContextImpl context = new RedisContextImpl(new RedisCoreImpl(), (AofManager) null);
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new RespCommandHandler(context));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void send(final String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    private String readReply() {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "没有回复");
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    @DisplayName("一帧请求对应一个回复")
    void testRequestReply() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n");
        assertEquals("+OK\r\n", readReply());

        send("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("$1\r\nv\r\n", readReply());

        send("*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n");
        assertEquals("$-1\r\n", readReply());
    }

    @Test
    @DisplayName("同一批数据中的多个请求按顺序回复")
    void testPipelinedOrder() {
        send("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n*1\r\n$3\r\nFOO\r\n");

        assertEquals("+PONG\r\n", readReply());
        assertEquals("$2\r\nhi\r\n", readReply());
        assertEquals("-ERR unknown command 'FOO'\r\n", readReply());
        assertTrue(channel.isActive());
    }

    @Test
    @DisplayName("内联命令")
    void testInlineCommand() {
        send("PING\r\n");

        assertEquals("+PONG\r\n", readReply());
    }

    @Test
    @DisplayName("应用层错误不断开连接")
    void testApplicationErrorKeepsConnection() {
        send("*2\r\n$3\r\nSET\r\n$1\r\nk\r\n");

        assertEquals("-ERR wrong number of arguments for 'set' command\r\n", readReply());
        assertTrue(channel.isActive());
    }

    @Test
    @DisplayName("格式错误的帧回复错误后关闭连接")
    void testMalformedFrameClosesConnection() {
        send("*1\r\n?bad\r\n");

        assertTrue(readReply().startsWith("-ERR Protocol error"));
        assertFalse(channel.isActive());
    }

    @Test
    @DisplayName("协议错误排在之前请求的回复之后")
    void testProtocolErrorAfterPendingReplies() {
        send("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$1\r\na\r\n*1\r\n?bad\r\n");

        assertEquals("+PONG\r\n", readReply());
        assertEquals("$1\r\na\r\n", readReply());
        assertTrue(readReply().startsWith("-ERR Protocol error"));
        assertFalse(channel.isActive());
    }
}
