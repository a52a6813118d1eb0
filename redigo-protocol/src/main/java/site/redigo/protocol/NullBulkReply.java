package site.redigo.protocol;

import io.netty.buffer.ByteBuf;

/**
 * 空批量回复："$-1\r\n"
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class NullBulkReply extends Resp {
    public static final NullBulkReply INSTANCE = new NullBulkReply();

    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    private NullBulkReply() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_BYTES);
    }

    @Override
    public String toString() {
        return "NullBulkReply";
    }
}
