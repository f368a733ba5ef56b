package site.respkv.protocol;

import java.io.EOFException;

/**
 * 读取帧时流已结束。
 *
 * <p>与 {@link RespProtocolException} 区分：这是客户端断开的正常路径，
 * 调用方据此关闭连接而不必报警。{@link #isMidFrame()} 表示断开发生在一帧中间。
 *
 * @author respkv
 * @since 1.0.0
 */
public class ConnectionClosedException extends EOFException {

    private final boolean midFrame;

    public ConnectionClosedException(final boolean midFrame) {
        super(midFrame ? "连接在帧中间关闭" : "连接已关闭");
        this.midFrame = midFrame;
    }

    /**
     * @return 流在一帧尚未读完时结束返回true
     */
    public boolean isMidFrame() {
        return midFrame;
    }
}
