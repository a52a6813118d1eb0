package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * RESP回复基础类
 *
 * <p>所有RESP数据类型的公共父类，定义统一的编码接口和共享的工具方法。
 * 变体集合是封闭的：
 * <ul>
 *     <li>{@link StatusReply} - "+OK\r\n"</li>
 *     <li>{@link ErrorReply} - "-ERR message\r\n"</li>
 *     <li>{@link IntegerReply} - ":1000\r\n"</li>
 *     <li>{@link BulkReply} - "$6\r\nfoobar\r\n"</li>
 *     <li>{@link NullBulkReply} - "$-1\r\n"</li>
 *     <li>{@link MultiBulkReply} - "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"</li>
 *     <li>{@link EmptyMultiBulkReply} - "*0\r\n"</li>
 * </ul>
 *
 * <p>只有{@link MultiBulkReply}可以作为客户端发来的命令。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = {'\r', '\n'};

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    private static final int MAX_CACHED_NUMBER = 255;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes();
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes();
        }
    }

    /**
     * 写入十进制整数，常用小整数走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeDecimal(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes());
        }
    }

    /**
     * 将当前回复按规范编码写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 编码为独立的字节数组
     *
     * @return 完整的线上字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }
}
