package site.redigo.protocol.parser;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;

/**
 * 连接级的协议解析任务（生产者）
 *
 * <p>把socket上的字节流解析为有序的{@link Payload}序列，交给管道中后面的消费者。
 * 要求通道关闭{@code AUTO_READ}，由消费者通过{@code ctx.read()}按需索取：
 * <ul>
 *     <li>每次索取最多产出一个单元，消费者处理完之前不会产出下一个</li>
 *     <li>缓冲区里凑不出完整单元时才向socket请求更多数据，
 *     消费者忙碌时不再读socket，形成背压</li>
 * </ul>
 *
 * <p>传输错误结束序列，并且只产出一次最终的错误单元：
 * <ul>
 *     <li>对端半关闭：先交付缓冲区中已完整的单元，然后产出{@link EOFException}</li>
 *     <li>读失败：产出对应的{@link IOException}</li>
 *     <li>通道关闭：产出{@link ClosedChannelException}</li>
 * </ul>
 *
 * <p>解析过程中的意外异常在这里被捕获并记录，只停止本连接的解析并关闭本连接，
 * 消费者仍然会收到通道关闭产生的最终单元。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespParserHandler extends ChannelDuplexHandler {

    private final RespParser parser = new RespParser();

    /** 尚未解析的输入 */
    private ByteBuf cumulation;

    /** 消费者已索取、尚未交付的单元 */
    private boolean demanded;

    /** 防止同一执行器上的消费者在回调中重入 */
    private boolean producing;

    private boolean inputShutdown;

    private boolean faulted;

    private boolean terminated;

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        cumulation = ctx.alloc().buffer();
    }

    @Override
    public void handlerRemoved(final ChannelHandlerContext ctx) {
        if (cumulation != null) {
            cumulation.release();
            cumulation = null;
        }
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
        if (!(msg instanceof ByteBuf)) {
            ctx.fireChannelRead(msg);
            return;
        }
        final ByteBuf in = (ByteBuf) msg;
        try {
            if (!terminated && !faulted) {
                cumulation.writeBytes(in);
            }
        } finally {
            in.release();
        }
        produce(ctx);
    }

    /**
     * 消费者索取下一个单元
     */
    @Override
    public void read(final ChannelHandlerContext ctx) {
        demanded = true;
        produce(ctx);
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            inputShutdown = true;
            produce(ctx);
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof IOException) {
            log.debug("连接 {} 读取失败: {}", ctx.channel().remoteAddress(), cause.getMessage());
            terminate(ctx, cause);
            return;
        }
        log.error("连接 {} 的协议解析出现未预期异常", ctx.channel().remoteAddress(), cause);
        fault(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) {
        terminate(ctx, new ClosedChannelException());
        ctx.fireChannelInactive();
    }

    private void produce(final ChannelHandlerContext ctx) {
        if (producing || terminated || faulted) {
            return;
        }
        producing = true;
        try {
            while (demanded) {
                final Payload payload = parser.parse(cumulation);
                if (payload == null) {
                    if (inputShutdown) {
                        terminate(ctx, new EOFException("connection closed by peer"));
                        return;
                    }
                    cumulation.discardSomeReadBytes();
                    ctx.read();
                    return;
                }
                demanded = false;
                ctx.fireChannelRead(payload);
            }
        } catch (RuntimeException e) {
            log.error("连接 {} 的协议解析任务异常终止", ctx.channel().remoteAddress(), e);
            fault(ctx);
        } finally {
            producing = false;
        }
    }

    private void fault(final ChannelHandlerContext ctx) {
        faulted = true;
        if (cumulation != null) {
            cumulation.clear();
        }
        ctx.close();
    }

    private void terminate(final ChannelHandlerContext ctx, final Throwable cause) {
        if (terminated) {
            return;
        }
        terminated = true;
        demanded = false;
        if (cumulation != null) {
            cumulation.clear();
        }
        ctx.fireChannelRead(Payload.ofError(cause));
    }
}
