package site.respkv;

import lombok.extern.slf4j.Slf4j;
import site.respkv.aof.writer.AofSyncPolicy;
import site.respkv.server.RedisServer;
import site.respkv.server.RespKvServer;
import site.respkv.server.config.RedisServerConfig;

@Slf4j
public class RedisServerLauncher {

    static final String USAGE = "用法: respkv [--host <地址>] [--port <端口>] [--aof-file <文件>]"
            + " [--appendfsync always|everysec|no] [--no-aof]";

    public static void main(final String[] args) throws Exception {
        final RedisServerConfig config;
        try {
            config = parseArgs(args);
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            log.error(USAGE);
            System.exit(1);
            return;
        }

        final RedisServer redisServer = new RespKvServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "respkv-shutdown"));

        redisServer.start();
    }

    /**
     * 解析命令行参数，未指定的项取默认值
     *
     * @param args 命令行参数
     * @return 配置
     * @throws IllegalArgumentException 未知参数、缺少取值或取值非法
     */
    static RedisServerConfig parseArgs(final String[] args) {
        final RedisServerConfig config = RedisServerConfig.defaultConfig();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host":
                    config.setHost(valueOf(args, ++i, "--host"));
                    break;
                case "--port":
                    final String port = valueOf(args, ++i, "--port");
                    try {
                        config.setPort(Integer.parseInt(port));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("端口号不是整数: " + port, e);
                    }
                    break;
                case "--aof-file":
                    config.setAofFileName(valueOf(args, ++i, "--aof-file"));
                    break;
                case "--appendfsync":
                    config.setAppendFsync(AofSyncPolicy.fromName(valueOf(args, ++i, "--appendfsync")));
                    break;
                case "--no-aof":
                    config.setAofEnabled(false);
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + args[i]);
            }
        }
        return config;
    }

    private static String valueOf(final String[] args, final int index, final String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " 缺少取值");
        }
        return args[index];
    }
}
