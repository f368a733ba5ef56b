package site.respkv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisBytes测试")
class RedisBytesTest {

    @Test
    @DisplayName("构造函数执行防御性拷贝")
    void testDefensiveCopy() {
        byte[] source = "hello".getBytes();
        RedisBytes bytes = new RedisBytes(source);

        source[0] = 'j';

        assertEquals("hello", bytes.getString());
    }

    @Test
    @DisplayName("null数组抛出异常")
    void testNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RedisBytes(null));
        assertNull(RedisBytes.wrapTrusted(null));
        assertNull(RedisBytes.fromString(null));
    }

    @Test
    @DisplayName("fromString保留原始大小写")
    void testFromStringKeepsCase() {
        RedisBytes lower = RedisBytes.fromString("get");

        assertEquals("get", lower.getString());
        assertNotEquals(RedisBytes.fromString("GET"), lower);
        assertTrue(RedisBytes.fromString("GET").equalsIgnoreCase(lower));
    }

    @Test
    @DisplayName("可作为HashMap的键")
    void testHashKey() {
        Map<RedisBytes, String> map = new HashMap<>();
        map.put(RedisBytes.fromString("key"), "v");

        assertEquals("v", map.get(new RedisBytes("key".getBytes())));
    }

    @Test
    @DisplayName("前缀匹配与截取")
    void testPrefix() {
        RedisBytes pattern = RedisBytes.fromString("user:*");
        RedisBytes prefix = pattern.head(pattern.length() - 1);

        assertTrue(pattern.endsWith('*'));
        assertEquals("user:", prefix.getString());
        assertTrue(RedisBytes.fromString("user:1").startsWith(prefix));
        assertFalse(RedisBytes.fromString("use").startsWith(prefix));
        assertTrue(RedisBytes.fromString("anything").startsWith(RedisBytes.EMPTY));
    }

    @Test
    @DisplayName("多字节字符按字节计长")
    void testUtf8Length() {
        RedisBytes bytes = RedisBytes.fromString("你好");

        assertEquals(6, bytes.length());
        assertEquals("你好", new RedisBytes(bytes.getBytes()).getString());
    }
}
