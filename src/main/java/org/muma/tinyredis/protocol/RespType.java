package org.muma.tinyredis.protocol;

/**
 * RESP2 数据类型
 * 每种类型由首字节 (marker) 唯一确定，NULL_BULK 与 BULK_STRING 共用 '$'，靠长度 -1 区分。
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    NULL_BULK('$'),
    ARRAY('*');

    // marker -> 类型 的分发表，只覆盖 ASCII
    private static final RespType[] BY_MARKER = new RespType[128];

    static {
        BY_MARKER['+'] = SIMPLE_STRING;
        BY_MARKER['-'] = ERROR;
        BY_MARKER[':'] = INTEGER;
        BY_MARKER['$'] = BULK_STRING;
        BY_MARKER['*'] = ARRAY;
    }

    private final byte marker;

    RespType(char marker) {
        this.marker = (byte) marker;
    }

    public byte marker() {
        return marker;
    }

    /**
     * 根据首字节查找类型
     *
     * @return 对应类型；无法识别时返回 null
     */
    public static RespType fromMarker(byte b) {
        if (b < 0) {
            return null;
        }
        return BY_MARKER[b];
    }
}
