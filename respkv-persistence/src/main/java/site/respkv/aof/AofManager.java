package site.respkv.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.aof.loader.AofLoader;
import site.respkv.aof.writer.AofSyncPolicy;
import site.respkv.aof.writer.AofWriter;
import site.respkv.aof.writer.Writer;
import site.respkv.core.command.CommandExecutor;
import site.respkv.protocol.RespArray;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AOF 持久化管理器
 *
 * <p>负责命令追加、按策略刷盘、启动重放和关闭。
 *
 * <p>并发约定：追加、定时刷盘和加载共用一把 {@link ReentrantLock}，
 * 追加的记录不会交错，刷盘和重放也不会看到写了一半的记录。
 *
 * <p>文件句柄与定时刷盘任务一起创建，也在 {@link #close()} 中一起释放：
 * 先停止定时任务，再做最后一次刷盘并关闭文件，任何一步失败都不会跳过后续步骤。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@Getter
public class AofManager {

    /** AOF 文件名 */
    private final String fileName;

    private final Writer aofWriter;

    private final AofLoader aofLoader;

    private final AofSyncPolicy syncPolicy;

    private final long flushIntervalMs;

    /** 写入锁，追加、刷盘、加载共用 */
    private final ReentrantLock writeLock = new ReentrantLock();

    /** ByteBuf 分配器，使用 Netty 的池化分配器 */
    private final ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;

    /** EVERYSEC 模式下是否有未刷盘的数据 */
    private final AtomicBoolean hasPendingFlush = new AtomicBoolean(false);

    /** 仅 EVERYSEC 模式创建 */
    private final ScheduledExecutorService flushScheduler;

    private volatile boolean closed;

    /**
     * 打开（或创建）AOF文件并按策略启动刷盘任务
     *
     * @param fileName AOF文件名
     * @param syncPolicy 刷盘策略
     * @param flushIntervalMs EVERYSEC 模式的刷盘间隔
     * @param loadTruncated 加载时末尾不完整是否截断后继续
     * @throws IOException 打开文件失败
     */
    public AofManager(final String fileName, final AofSyncPolicy syncPolicy,
                      final long flushIntervalMs, final boolean loadTruncated) throws IOException {
        this(fileName, new AofWriter(new File(fileName)), new AofLoader(new File(fileName), loadTruncated),
                syncPolicy, flushIntervalMs);
    }

    public AofManager(final String fileName, final Writer aofWriter, final AofLoader aofLoader,
                      final AofSyncPolicy syncPolicy, final long flushIntervalMs) {
        this.fileName = fileName;
        this.aofWriter = aofWriter;
        this.aofLoader = aofLoader;
        this.syncPolicy = syncPolicy;
        this.flushIntervalMs = flushIntervalMs;

        if (syncPolicy == AofSyncPolicy.EVERYSEC) {
            this.flushScheduler = new ScheduledThreadPoolExecutor(1, r -> {
                final Thread thread = new Thread(r);
                thread.setName("AOF-Flush-Scheduler");
                thread.setDaemon(true);
                return thread;
            });
            this.flushScheduler.scheduleAtFixedRate(this::scheduledFlushTask,
                    flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
            log.info("EVERYSEC刷盘模式已启动，刷盘间隔: {}ms", flushIntervalMs);
        } else {
            this.flushScheduler = null;
        }
        log.info("AofManager初始化完成，文件: {}, 刷盘策略: {}", fileName, syncPolicy.getConfigName());
    }

    /**
     * 追加一条命令帧，按原样编码写入
     *
     * @param respArray 原始命令帧
     * @throws IOException 写入失败
     */
    public void append(final RespArray respArray) throws IOException {
        if (respArray == null || respArray.isNull()) {
            throw new IllegalArgumentException("RespArray cannot be null");
        }
        final ByteBuf byteBuf = allocator.buffer();
        try {
            respArray.encode(byteBuf);
            write(byteBuf);
        } finally {
            byteBuf.release();
        }
    }

    /**
     * 追加已编码的命令字节
     *
     * @param commandBytes 命令字节数组
     * @throws IOException 写入失败
     */
    public void appendBytes(final byte[] commandBytes) throws IOException {
        if (commandBytes == null || commandBytes.length == 0) {
            throw new IllegalArgumentException("Command bytes cannot be empty");
        }
        final ByteBuf byteBuf = allocator.buffer(commandBytes.length);
        try {
            byteBuf.writeBytes(commandBytes);
            write(byteBuf);
        } finally {
            byteBuf.release();
        }
    }

    private void write(final ByteBuf byteBuf) throws IOException {
        writeLock.lock();
        try {
            if (closed) {
                throw new IOException("AOF已关闭，无法写入: " + fileName);
            }
            aofWriter.write(byteBuf.nioBuffer());
            if (syncPolicy == AofSyncPolicy.ALWAYS) {
                aofWriter.flush();
            } else if (syncPolicy == AofSyncPolicy.EVERYSEC) {
                hasPendingFlush.set(true);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 强制刷盘
     *
     * @throws IOException 刷盘失败
     */
    public void flush() throws IOException {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            hasPendingFlush.set(false);
            aofWriter.flush();
        } finally {
            writeLock.unlock();
        }
    }

    private void scheduledFlushTask() {
        if (!hasPendingFlush.compareAndSet(true, false)) {
            log.trace("EVERYSEC定时检查，无待刷盘数据");
            return;
        }
        writeLock.lock();
        try {
            if (!closed) {
                aofWriter.flush();
                log.debug("EVERYSEC定时刷盘完成");
            }
        } catch (IOException e) {
            log.error("EVERYSEC定时刷盘失败", e);
            // 下次重试
            hasPendingFlush.set(true);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 重放AOF文件到执行器，重放期间持有写入锁
     *
     * @param executor 命令执行器，不得再追加AOF
     * @return 成功应用的命令数
     * @throws IOException 读取文件失败
     * @throws AofLoadException 文件损坏
     */
    public int load(final CommandExecutor executor) throws IOException {
        writeLock.lock();
        try {
            final int applied = aofLoader.load(executor);
            // 末尾可能被截断，写入位置跟随文件长度
            aofWriter.seekToEnd();
            return applied;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 停止定时刷盘，最后一次刷盘并关闭文件
     *
     * @throws IOException 刷盘或关闭失败，抛出第一个错误
     */
    public void close() throws IOException {
        if (closed) {
            return;
        }
        log.debug("开始关闭AOF管理器...");

        // 1. 停止定时刷盘任务
        if (flushScheduler != null) {
            flushScheduler.shutdown();
            try {
                if (!flushScheduler.awaitTermination(flushIntervalMs, TimeUnit.MILLISECONDS)) {
                    flushScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                flushScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        IOException firstException = null;
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;

            // 2. 最后一次刷盘，与策略无关
            try {
                aofWriter.flush();
            } catch (IOException e) {
                log.error("最后一次刷盘时发生错误", e);
                firstException = e;
            }

            // 3. 关闭文件
            try {
                aofWriter.close();
            } catch (IOException e) {
                log.error("关闭AOF写入器时发生错误", e);
                if (firstException == null) {
                    firstException = e;
                }
            }
        } finally {
            writeLock.unlock();
        }

        if (firstException != null) {
            throw firstException;
        }
        log.info("AOF管理器关闭完成");
    }
}
