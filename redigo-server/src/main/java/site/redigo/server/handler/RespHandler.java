package site.redigo.server.handler;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;
import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.ErrorReply;
import site.redigo.protocol.MultiBulkReply;
import site.redigo.protocol.Resp;
import site.redigo.protocol.handler.RespEncoder;
import site.redigo.protocol.parser.Payload;
import site.redigo.protocol.parser.RespParserHandler;
import site.redigo.server.connection.Connection;
import site.redigo.server.database.Database;
import site.redigo.server.tcp.ConnectionTaskGuard;
import site.redigo.server.tcp.Handler;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RESP请求处理器。
 *
 * <p>为每个连接安装解析任务、编码器和命令分发器，按顺序消费解析单元：
 * <ul>
 *   <li>传输错误：注销并关闭连接，通知存储引擎，结束</li>
 *   <li>格式错误：回复错误信息，写失败则关闭连接，否则继续</li>
 *   <li>空单元或非多批量消息：记录日志后继续</li>
 *   <li>多批量消息：交给存储引擎执行并写回结果</li>
 * </ul>
 *
 * <p>一个回复写完后才向解析任务索取下一个单元，连接内的请求严格串行。
 *
 * <p>连接任务在通道注销、管道上的处理器全部移除之后才算结束，见{@link ConnectionTaskGuard}。
 *
 * <p>{@link #close()}之后拒绝新连接，并尽力关闭所有已登记的连接。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespHandler implements Handler {

    /** 存储引擎没有给出回复时的默认错误 */
    private static final ErrorReply UNKNOWN_ERROR = new ErrorReply("ERR unknown");

    private final Database database;

    /** 活跃连接注册表 */
    private final Set<Connection> activeConnections = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean closing = new AtomicBoolean();

    public RespHandler(final Database database) {
        if (database == null) {
            throw new IllegalArgumentException("Database不能为null");
        }
        this.database = database;
    }

    @Override
    public Future<Void> handle(final Channel channel, final EventExecutorGroup executor) {
        final Promise<Void> done = GlobalEventExecutor.INSTANCE.newPromise();
        if (closing.get()) {
            rejectConnection(channel, done);
            return done;
        }

        final Connection client = new Connection(channel);
        activeConnections.add(client);
        // close()可能在登记前刚好遍历完注册表
        if (closing.get()) {
            activeConnections.remove(client);
            rejectConnection(channel, done);
            return done;
        }

        channel.pipeline()
                .addLast("guard", new ConnectionTaskGuard(done))
                .addLast("parser", new RespParserHandler())
                .addLast("encoder", new RespEncoder())
                .addLast(executor, "dispatcher", new CommandDispatcher(client));
        log.debug("连接 {} 已登记，当前活跃连接数: {}", client.getRemoteAddress(), activeConnections.size());
        return done;
    }

    private static void rejectConnection(final Channel channel, final Promise<Void> done) {
        log.debug("处理器正在关闭，拒绝连接 {}", channel.remoteAddress());
        channel.close();
        done.trySuccess(null);
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        log.info("处理器正在关闭...");
        for (final Connection client : activeConnections) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("关闭连接 {} 失败", client.getRemoteAddress(), e);
            }
        }
        database.shutdown();
    }

    public boolean isClosing() {
        return closing.get();
    }

    public int getActiveConnectionCount() {
        return activeConnections.size();
    }

    /**
     * 单个连接的命令分发器，运行在命令执行线程上。
     *
     * <p>Netty保证同一连接的事件总在同一个执行器线程上处理，因此这里的状态无需同步。
     */
    private final class CommandDispatcher extends ChannelInboundHandlerAdapter {

        private final Connection client;

        private boolean started;

        private boolean finished;

        CommandDispatcher(final Connection client) {
            this.client = client;
        }

        @Override
        public void handlerAdded(final ChannelHandlerContext ctx) {
            if (!ctx.channel().isOpen()) {
                closeClient();
                return;
            }
            if (ctx.channel().isActive()) {
                startReading(ctx);
            }
        }

        @Override
        public void handlerRemoved(final ChannelHandlerContext ctx) {
            closeClient();
        }

        @Override
        public void channelActive(final ChannelHandlerContext ctx) {
            startReading(ctx);
            ctx.fireChannelActive();
        }

        private void startReading(final ChannelHandlerContext ctx) {
            if (!started) {
                started = true;
                ctx.read();
            }
        }

        @Override
        public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
            if (!(msg instanceof Payload)) {
                log.warn("连接 {} 收到未知消息类型: {}", client.getRemoteAddress(), msg.getClass().getName());
                ReferenceCountUtil.release(msg);
                return;
            }
            if (finished) {
                return;
            }
            try {
                dispatch(ctx, (Payload) msg);
            } catch (RuntimeException e) {
                log.error("连接 {} 的请求处理异常终止", client.getRemoteAddress(), e);
                closeClient();
            }
        }

        private void dispatch(final ChannelHandlerContext ctx, final Payload payload) {
            final Throwable error = payload.getError();
            if (error != null) {
                if (payload.isTransportError()) {
                    closeClient();
                    log.info("连接已关闭: {}", client.getRemoteAddress());
                    return;
                }
                client.write(new ErrorReply(error.getMessage())).addListener((ChannelFutureListener) f -> {
                    if (f.isSuccess()) {
                        ctx.read();
                        return;
                    }
                    log.info("连接已关闭: {} ({})", client.getRemoteAddress(), f.cause().getMessage());
                    ctx.executor().execute(this::closeClient);
                });
                return;
            }

            final Resp data = payload.getData();
            if (data == null) {
                log.error("空的解析单元");
                ctx.read();
                return;
            }
            if (!(data instanceof MultiBulkReply)) {
                log.error("需要多批量消息");
                ctx.read();
                return;
            }

            final Resp result = execute(((MultiBulkReply) data).getArgs());
            final ChannelFuture future = client.write(result != null ? result : UNKNOWN_ERROR);
            future.addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    log.debug("连接 {} 回复写出失败: {}", client.getRemoteAddress(), f.cause().getMessage());
                }
                ctx.read();
            });
        }

        private Resp execute(final List<RedisBytes> args) {
            try {
                return database.execute(client, args);
            } catch (RuntimeException e) {
                log.warn("连接 {} 的命令执行失败: {}", client.getRemoteAddress(), e.getMessage(), e);
                return new ErrorReply("ERR " + e.getMessage());
            }
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            if (!finished) {
                ctx.fireChannelInactive();
            }
        }

        @Override
        public void channelUnregistered(final ChannelHandlerContext ctx) {
            if (!finished) {
                ctx.fireChannelUnregistered();
            }
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.error("连接 {} 异常", client.getRemoteAddress(), cause);
            closeClient();
        }

        private void closeClient() {
            if (finished) {
                return;
            }
            finished = true;
            activeConnections.remove(client);
            try {
                client.close();
            } finally {
                database.onConnectionClosed(client);
            }
        }
    }
}
