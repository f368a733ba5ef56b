package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * 阻塞式帧读取器：从字节流中读出恰好一帧。
 *
 * <p>读入的字节累积在缓冲区中，交给 {@link Resp#decode(ByteBuf)} 解码，数据不足时继续读取，
 * 与网络解码器共用同一套解析规则。多读到的字节保留给下一次调用。
 *
 * <p>流结束时抛出 {@link ConnectionClosedException}，数据格式错误时抛出
 * {@link RespProtocolException}，调用方据此区分"客户端断开"和"客户端发送了非法数据"。
 *
 * <p>非线程安全，每个流一个实例。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespReader {

    /** 单次读取的块大小 */
    private static final int READ_CHUNK_SIZE = 8 * 1024;

    private final InputStream in;
    private final byte[] chunk = new byte[READ_CHUNK_SIZE];
    private final ByteBuf buffer = Unpooled.buffer(READ_CHUNK_SIZE);

    public RespReader(final InputStream in) {
        this.in = in;
    }

    /**
     * 读取下一帧
     *
     * @return 解码后的值
     * @throws ConnectionClosedException 流已结束
     * @throws RespProtocolException 数据格式错误
     * @throws IOException 其他读取失败
     */
    public Resp read() throws IOException {
        while (true) {
            final Resp resp = Resp.decode(buffer);
            if (resp != null) {
                buffer.discardReadBytes();
                return resp;
            }
            final int n = in.read(chunk);
            if (n == -1) {
                if (buffer.isReadable()) {
                    log.debug("帧中间流结束，剩余 {} 字节", buffer.readableBytes());
                    throw new ConnectionClosedException(true);
                }
                throw new ConnectionClosedException(false);
            }
            buffer.writeBytes(chunk, 0, n);
        }
    }
}
