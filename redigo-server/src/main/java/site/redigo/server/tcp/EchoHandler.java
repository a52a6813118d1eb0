package site.redigo.server.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;
import site.redigo.server.connection.Connection;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 行回显处理器，把客户端发来的每一行原样写回。
 *
 * <p>与{@link site.redigo.server.handler.RespHandler}共用同一套连接生命周期，
 * 用于在不涉及RESP协议的情况下验证服务器的接入与关闭流程。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class EchoHandler implements Handler {

    /** 单行最大长度 */
    static final int MAX_LINE_LENGTH = 64 * 1024;

    private final Set<Connection> activeConnections = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean closing = new AtomicBoolean();

    @Override
    public Future<Void> handle(final Channel channel, final EventExecutorGroup executor) {
        final Promise<Void> done = GlobalEventExecutor.INSTANCE.newPromise();
        if (closing.get()) {
            channel.close();
            done.trySuccess(null);
            return done;
        }
        final Connection client = new Connection(channel);
        activeConnections.add(client);
        if (closing.get()) {
            activeConnections.remove(client);
            channel.close();
            done.trySuccess(null);
            return done;
        }
        channel.pipeline()
                .addLast("guard", new ConnectionTaskGuard(done))
                .addLast("framer", new LineBasedFrameDecoder(MAX_LINE_LENGTH, false, false))
                .addLast(executor, "echo", new EchoSession(client));
        return done;
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        log.info("处理器正在关闭...");
        for (final Connection client : activeConnections) {
            client.close();
        }
    }

    public int getActiveConnectionCount() {
        return activeConnections.size();
    }

    private final class EchoSession extends ChannelInboundHandlerAdapter {

        private final Connection client;

        private boolean finished;

        EchoSession(final Connection client) {
            this.client = client;
        }

        @Override
        public void handlerAdded(final ChannelHandlerContext ctx) {
            if (!ctx.channel().isOpen()) {
                closeClient();
                return;
            }
            ctx.read();
        }

        @Override
        public void handlerRemoved(final ChannelHandlerContext ctx) {
            closeClient();
        }

        @Override
        public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
            if (!(msg instanceof ByteBuf)) {
                ReferenceCountUtil.release(msg);
                return;
            }
            final ByteBuf line = (ByteBuf) msg;
            try {
                if (!finished) {
                    client.write(ByteBufUtil.getBytes(line));
                }
            } finally {
                line.release();
            }
        }

        @Override
        public void channelReadComplete(final ChannelHandlerContext ctx) {
            if (!finished) {
                ctx.read();
            }
        }

        @Override
        public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) {
            if (evt instanceof ChannelInputShutdownEvent) {
                log.info("连接已关闭: {}", client.getRemoteAddress());
                closeClient();
                return;
            }
            ctx.fireUserEventTriggered(evt);
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            closeClient();
        }

        @Override
        public void channelUnregistered(final ChannelHandlerContext ctx) {
            // 会话结束后不再把事件转回事件循环
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.warn("连接 {} 异常: {}", client.getRemoteAddress(), cause.getMessage());
            closeClient();
        }

        private void closeClient() {
            if (finished) {
                return;
            }
            finished = true;
            activeConnections.remove(client);
            client.close();
        }
    }
}
