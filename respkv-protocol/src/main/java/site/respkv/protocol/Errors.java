package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误消息，编码为 {@code -content\r\n}
 *
 * <p>错误文本常常拼接了客户端发来的内容，其中的 \r 和 \n 在构造时替换为空格，
 * 编码结果始终是单独一帧。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(final String content) {
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    /**
     * 将错误消息编码为RESP格式
     *
     * @param byteBuf 目标缓冲区
     */
    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
