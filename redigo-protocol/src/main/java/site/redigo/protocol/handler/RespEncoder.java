package site.redigo.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.BulkReply;
import site.redigo.protocol.MultiBulkReply;
import site.redigo.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>把{@link Resp}回复编码为线上字节。非{@link Resp}消息（例如已经编码好的
 * {@link ByteBuf}）原样向下传递。
 *
 * <p>编码前按回复类型预估大小并一次性扩容，减少ByteBuf的扩容次数。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(out);
        if (log.isTraceEnabled()) {
            log.trace("编码RESP回复: {} ({} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }

    /**
     * 估算RESP消息编码后的大小
     *
     * @param msg RESP消息对象
     * @return 估算的编码大小（字节数）
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkReply) {
            return ((BulkReply) msg).getContent().length() + 16;
        }
        if (msg instanceof MultiBulkReply) {
            int totalSize = 16;
            for (final RedisBytes arg : ((MultiBulkReply) msg).getArgs()) {
                totalSize += arg.length() + 16;
            }
            return totalSize;
        }
        return 64;
    }
}
