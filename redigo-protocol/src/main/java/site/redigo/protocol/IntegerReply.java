package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * 整数回复：":1000\r\n"，取值范围为有符号64位。
 *
 * <p>常用小整数通过{@link #valueOf(long)}复用缓存实例。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class IntegerReply extends Resp {
    /** 缓存范围下限 */
    private static final int CACHE_LOW = -10;

    /** 缓存范围上限 */
    private static final int CACHE_HIGH = 127;

    private static final IntegerReply[] CACHE = new IntegerReply[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new IntegerReply(i + CACHE_LOW);
        }
    }

    /** 整数值 */
    private final long value;

    private IntegerReply(final long value) {
        this.value = value;
    }

    /**
     * 工厂方法：常用值返回缓存实例，其他值创建新实例
     *
     * @param value 整数值
     * @return IntegerReply 实例
     */
    public static IntegerReply valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new IntegerReply(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeDecimal(byteBuf, value);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "IntegerReply(" + value + ")";
    }
}
