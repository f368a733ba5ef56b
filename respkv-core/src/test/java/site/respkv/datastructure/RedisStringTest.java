package site.respkv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisString测试")
class RedisStringTest {

    @Test
    @DisplayName("-1表示永不过期")
    void testNeverExpires() {
        RedisString entry = new RedisString(RedisBytes.fromString("v"));

        assertEquals(-1, entry.timeout());
        assertFalse(entry.isExpired(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("到达过期时间即视为过期")
    void testExpiryBoundary() {
        RedisString entry = new RedisString(RedisBytes.fromString("v"), 100);

        assertFalse(entry.isExpired(99));
        assertTrue(entry.isExpired(100));
    }
}
