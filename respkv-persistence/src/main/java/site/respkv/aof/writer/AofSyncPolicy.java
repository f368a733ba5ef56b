package site.respkv.aof.writer;

import java.util.Locale;

/**
 * AOF刷盘策略，与 Redis appendfsync 配置项同名
 *
 * @author respkv
 * @since 1.0.0
 */
public enum AofSyncPolicy {
    /** 不主动刷盘，由操作系统决定，关闭时仍会刷盘 */
    NO("no"),

    /** 每次追加后立即刷盘 */
    ALWAYS("always"),

    /** 按固定间隔刷盘，崩溃时最多丢失一个间隔的数据 */
    EVERYSEC("everysec");

    private final String configName;

    AofSyncPolicy(final String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * 按配置名查找，大小写不敏感
     *
     * @param name always、everysec 或 no
     * @return 对应的策略
     * @throws IllegalArgumentException 未知名称
     */
    public static AofSyncPolicy fromName(final String name) {
        if (name != null) {
            final String lower = name.toLowerCase(Locale.ROOT);
            for (final AofSyncPolicy policy : values()) {
                if (policy.configName.equals(lower)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("未知的appendfsync策略: " + name);
    }
}
