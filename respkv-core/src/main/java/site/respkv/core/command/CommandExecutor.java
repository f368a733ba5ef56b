package site.respkv.core.command;

import site.respkv.datastructure.RedisBytes;

/**
 * 命令执行器接口
 *
 * <p>持久化模块通过此接口重放命令，由服务器模块实现，
 * 避免持久化模块直接依赖命令层。参数按原始字节传递，重放结果与在线执行逐字节一致。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface CommandExecutor {

    /**
     * 执行命令，不记录AOF也不产生客户端回复
     *
     * @param command 命令帧的各元素，元素0为命令名（大小写不敏感）
     * @return 命令被识别并执行返回true，未知命令返回false
     */
    boolean executeCommand(RedisBytes[] command);
}
