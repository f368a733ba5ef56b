package site.respkv.protocol;

import lombok.Getter;

/**
 * RESP值的类型标签，对应线路格式的首字节标识符。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    private final char marker;

    RespType(final char marker) {
        this.marker = marker;
    }

    /**
     * 根据标识字节查找类型
     *
     * @param b 标识字节
     * @return 对应的类型，无法识别时返回null
     */
    public static RespType fromMarker(final byte b) {
        switch (b) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            default:
                return null;
        }
    }
}
