package site.respkv.command;

import site.respkv.protocol.Resp;

/**
 * 命令接口
 *
 * <p>一个实例只处理一次请求：先 {@link #setContext(Resp[])} 校验并提取参数，再 {@link #handle()} 执行。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface Command {

    CommandType getType();

    /**
     * 校验参数形状与个数并提取参数
     *
     * @param array 完整的命令帧内容，元素0为命令名
     * @throws CommandException 参数个数或取值不合法
     */
    void setContext(Resp[] array);

    /**
     * 执行命令
     *
     * @return 回复值
     */
    Resp handle();

    /**
     * 是否修改数据，修改数据的命令执行成功后写入AOF
     */
    boolean isWriteCommand();
}
