package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.redigo.datastructure.RedisBytes;

/**
 * 批量字符串回复："$6\r\nfoobar\r\n"
 *
 * <p>内容二进制安全。空值请使用{@link NullBulkReply}。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class BulkReply extends Resp {
    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** 字符串内容 */
    private final RedisBytes content;

    public BulkReply(final RedisBytes content) {
        if (content == null) {
            throw new IllegalArgumentException("BulkReply内容不能为null，空值请使用NullBulkReply");
        }
        this.content = content;
    }

    public static BulkReply fromString(final String str) {
        return new BulkReply(RedisBytes.fromString(str));
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        writeBulk(byteBuf, content);
    }

    /**
     * 写入单个批量字符串，供多批量回复复用
     *
     * @param byteBuf 目标缓冲区
     * @param content 内容
     */
    static void writeBulk(final ByteBuf byteBuf, final RedisBytes content) {
        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeDecimal(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content.getString();
    }
}
