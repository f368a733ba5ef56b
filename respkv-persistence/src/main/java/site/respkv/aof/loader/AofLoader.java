package site.respkv.aof.loader;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;
import site.respkv.aof.AofLoadException;
import site.respkv.core.command.CommandExecutor;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespProtocolException;
import site.respkv.protocol.RespTypeException;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * AOF文件加载器
 *
 * <p>启动时从偏移量0按顺序解码每一帧，通过 {@link CommandExecutor} 重放。
 * 重放只重建内存状态，不写AOF也不产生客户端回复。
 *
 * <p>异常处理：
 * <ul>
 *     <li>未知命令：告警并跳过，后续命令照常重放</li>
 *     <li>末尾帧不完整（写入中途崩溃）：告警，按配置截断到最后一个完整帧或中止</li>
 *     <li>格式错误或非命令帧：抛出 {@link AofLoadException}，启动中止</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class AofLoader {

    private final File file;

    /** 末尾不完整时是否截断后继续 */
    private final boolean loadTruncated;

    public AofLoader(final File file, final boolean loadTruncated) {
        this.file = file;
        this.loadTruncated = loadTruncated;
    }

    /**
     * 重放AOF文件
     *
     * @param executor 命令执行器
     * @return 成功应用的命令数
     * @throws IOException 读取或截断文件失败
     * @throws AofLoadException 文件损坏
     */
    public int load(final CommandExecutor executor) throws IOException {
        if (!file.exists() || file.length() == 0) {
            log.info("AOF文件不存在或为空，跳过加载: {}", file.getName());
            return 0;
        }

        final ByteBuf commands = readFileContent();
        try {
            log.info("开始加载AOF文件: {}, 大小: {} bytes", file.getName(), commands.readableBytes());
            final int applied = processCommands(commands, executor);
            log.info("AOF文件加载完成，成功执行 {} 条命令", applied);
            return applied;
        } finally {
            commands.release();
        }
    }

    private ByteBuf readFileContent() throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file, "r");
             FileChannel channel = raf.getChannel()) {
            final long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new AofLoadException("AOF文件过大: " + size + " bytes");
            }
            final ByteBuffer buffer = ByteBuffer.allocate((int) size);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            buffer.flip();
            return Unpooled.wrappedBuffer(buffer);
        }
    }

    private int processCommands(final ByteBuf commands, final CommandExecutor executor) throws IOException {
        int applied = 0;
        while (commands.isReadable()) {
            final int position = commands.readerIndex();
            final Resp frame;
            try {
                frame = Resp.decode(commands);
            } catch (RespProtocolException e) {
                throw new AofLoadException("AOF文件损坏，偏移量 " + position + ": " + e.getMessage(), e);
            }
            if (frame == null) {
                handleTruncatedTail(position, commands.writerIndex());
                break;
            }

            final RedisBytes[] parts = toCommandParts(frame, position);
            if (executor.executeCommand(parts)) {
                applied++;
            } else {
                log.warn("AOF中的未知命令，跳过: {} (偏移量: {})", parts[0], position);
            }
        }
        return applied;
    }

    private RedisBytes[] toCommandParts(final Resp frame, final int position) {
        try {
            final RespArray array = frame.asArray();
            if (array.size() <= 0) {
                throw new AofLoadException("AOF记录不是非空命令数组，偏移量 " + position);
            }
            final Resp[] content = array.getContent();
            final RedisBytes[] parts = new RedisBytes[content.length];
            for (int i = 0; i < content.length; i++) {
                parts[i] = content[i].asBytes();
            }
            return parts;
        } catch (RespTypeException e) {
            throw new AofLoadException("AOF记录格式错误，偏移量 " + position + ": " + e.getMessage(), e);
        }
    }

    /**
     * 处理末尾不完整的帧
     *
     * @param validLength 最后一个完整帧的结束位置
     * @param fileLength 文件长度
     */
    private void handleTruncatedTail(final int validLength, final int fileLength) throws IOException {
        log.warn("AOF文件末尾存在不完整的命令，有效长度: {}, 文件长度: {}", validLength, fileLength);
        if (!loadTruncated) {
            throw new AofLoadException("AOF文件末尾不完整，偏移量 " + validLength);
        }
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.setLength(validLength);
        }
        log.warn("AOF文件已截断到 {} bytes", validLength);
    }
}
