package site.redigo.protocol;

import io.netty.buffer.ByteBuf;

/**
 * 空多批量回复："*0\r\n"
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class EmptyMultiBulkReply extends Resp {
    public static final EmptyMultiBulkReply INSTANCE = new EmptyMultiBulkReply();

    private static final byte[] EMPTY_BYTES = "*0\r\n".getBytes();

    private EmptyMultiBulkReply() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(EMPTY_BYTES);
    }

    @Override
    public String toString() {
        return "EmptyMultiBulkReply";
    }
}
