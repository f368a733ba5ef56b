package site.respkv.protocol.handler;

import lombok.Getter;
import site.respkv.protocol.Errors;

/**
 * 解码器发现格式错误的帧时向下游发出的用户事件
 *
 * <p>事件与之前解码出的请求走同一条入站路径，下游处理器回复完之前的请求后
 * 再回复此错误并关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public final class ProtocolErrorEvent {

    /** 协议错误详情 */
    private final String detail;

    public ProtocolErrorEvent(final String detail) {
        this.detail = detail;
    }

    public Errors toErrors() {
        return new Errors("ERR Protocol error: " + detail);
    }

    @Override
    public String toString() {
        return "ProtocolErrorEvent(" + detail + ")";
    }
}
