package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.RespArray;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RespEncoder测试")
class RespEncoderTest {

    private static String writeAndRead(final Object msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        try {
            assertTrue(channel.writeOutbound(msg));
            ByteBuf out = channel.readOutbound();
            try {
                return out.toString(StandardCharsets.UTF_8);
            } finally {
                out.release();
            }
        } finally {
            channel.finishAndReleaseAll();
        }
    }

    @Test
    @DisplayName("编码null批量字符串")
    void testNullBulk() {
        assertEquals("$-1\r\n", writeAndRead(BulkString.NULL));
    }

    @Test
    @DisplayName("编码错误回复")
    void testErrors() {
        assertEquals("-ERR unknown command 'FOO'\r\n", writeAndRead(new Errors("ERR unknown command 'FOO'")));
    }

    @Test
    @DisplayName("编码数组")
    void testArray() {
        assertEquals("*2\r\n$1\r\na\r\n$2\r\nbc\r\n", writeAndRead(RespArray.ofCommand("a", "bc")));
    }
}
