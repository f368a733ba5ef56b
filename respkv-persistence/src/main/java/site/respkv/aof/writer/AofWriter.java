package site.respkv.aof.writer;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * 基于FileChannel的AOF文件写入器
 *
 * <p>打开或创建文件后定位到末尾追加写入。本身不加锁，由 {@code AofManager} 串行化调用。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class AofWriter implements Writer {

    private final File file;

    private RandomAccessFile raf;

    private FileChannel channel;

    /**
     * 打开AOF文件，不存在时创建
     *
     * @param file AOF文件
     * @throws IOException 打开失败
     */
    public AofWriter(final File file) throws IOException {
        this.file = file;
        try {
            this.raf = new RandomAccessFile(file, "rw");
            this.channel = raf.getChannel();
            this.channel.position(channel.size());
            log.info("AOF文件已打开: {}, 当前大小: {} bytes", file.getAbsolutePath(), channel.size());
        } catch (IOException e) {
            closeQuietly(this.channel);
            closeQuietly(this.raf);
            this.channel = null;
            this.raf = null;
            throw new IOException("初始化AOF Writer时发生错误: " + file.getAbsolutePath(), e);
        }
    }

    private void closeQuietly(final Closeable resource) {
        if (resource != null) {
            try {
                resource.close();
            } catch (IOException e) {
                log.warn("关闭资源时发生错误", e);
            }
        }
    }

    @Override
    public int write(final ByteBuffer buffer) throws IOException {
        ensureOpen();
        int written = 0;
        while (buffer.hasRemaining()) {
            written += channel.write(buffer);
        }
        return written;
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        channel.force(true);
    }

    @Override
    public long seekToEnd() throws IOException {
        ensureOpen();
        final long size = channel.size();
        channel.position(size);
        return size;
    }

    private void ensureOpen() throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("AOF Writer 已关闭: " + file.getName());
        }
    }

    /**
     * 先刷盘再关闭文件，刷盘失败也会关闭文件
     */
    @Override
    public void close() throws IOException {
        if (channel == null) {
            return;
        }
        IOException failure = null;
        try {
            if (channel.isOpen()) {
                log.info("执行最后一次刷盘，当前位置: {}", channel.position());
                channel.force(true);
            }
        } catch (IOException e) {
            failure = e;
        }
        try {
            channel.close();
            raf.close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        } finally {
            channel = null;
            raf = null;
        }
        if (failure != null) {
            throw failure;
        }
        log.info("AOF Writer 已关闭: {}", file.getName());
    }
}
