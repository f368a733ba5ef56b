package site.respkv.aof.writer;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * AOF文件写入接口
 *
 * @author respkv
 * @since 1.0.0
 */
public interface Writer {

    /**
     * 写入缓冲区的全部剩余字节
     *
     * @return 写入的字节数
     */
    int write(ByteBuffer buffer) throws IOException;

    /**
     * 强制刷盘
     */
    void flush() throws IOException;

    /**
     * 将写入位置移到文件当前末尾，文件被外部截断后调用
     *
     * @return 新的写入位置
     */
    long seekToEnd() throws IOException;

    void close() throws IOException;
}
