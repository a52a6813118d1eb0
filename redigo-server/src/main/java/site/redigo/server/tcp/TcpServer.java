package site.redigo.server.tcp;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redigo.server.config.ServerConfig;
import site.redigo.sync.WaitGroup;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 基于Netty的TCP服务器。
 *
 * <p>生命周期：
 * <ul>
 *   <li>{@link #bind()}：创建事件循环组并监听配置的地址</li>
 *   <li>{@link #serve()}：接收连接并交给{@link Handler}，直到监听关闭且所有连接任务结束</li>
 *   <li>{@link #shutdown()}：发出关闭通知，监督线程随后关闭监听并关闭处理器</li>
 * </ul>
 *
 * <p>每个接受的连接在接收线程上计入{@link WaitGroup}，处理器返回的future完成时释放，
 * 所以{@link #serve()}返回时不会有仍在运行的连接任务。
 *
 * <p>根据操作系统选择Epoll/KQueue/NIO实现。连接通道关闭{@code AUTO_READ}，由处理器按需读取；
 * 开启{@code ALLOW_HALF_CLOSURE}，对端半关闭以事件通知处理器。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class TcpServer {

    /** 连接任务结束的通知，由接收线程创建 */
    private static final AttributeKey<Promise<Void>> HANDLER_DONE = AttributeKey.valueOf("redigo.handlerDone");

    /** 标记连接已交给处理器 */
    private static final AttributeKey<Boolean> HANDLED = AttributeKey.valueOf("redigo.handled");

    /** 事件循环组优雅关闭的超时时间 */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    @Getter
    private final ServerConfig config;

    private final Handler handler;

    /** 仍在运行的连接任务 */
    private final WaitGroup activeConnections = new WaitGroup();

    /** 唯一的关闭通知 */
    private final CountDownLatch shutdownSignal = new CountDownLatch(1);

    /** serve()结束、资源释放完毕 */
    private final CountDownLatch terminated = new CountDownLatch(1);

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private EventExecutorGroup commandExecutor;

    private volatile Channel serverChannel;

    /** 等待关闭通知的监督线程，serve()结束时中断 */
    private volatile Thread supervisor;

    public TcpServer(final ServerConfig config, final Handler handler) {
        if (config == null || handler == null) {
            throw new IllegalArgumentException("config和handler不能为null");
        }
        config.validate();
        this.config = config;
        this.handler = handler;
    }

    /**
     * 监听并服务，直到进程收到SIGINT/SIGTERM/SIGHUP。
     *
     * <p>信号通过JVM关闭钩子捕获：钩子只发出一次关闭通知，并等待服务器排空后再让JVM退出。
     *
     * @param config 服务器配置
     * @param handler 连接处理器
     * @throws InterruptedException 等待期间被中断
     */
    public static void listenAndServeWithSignal(final ServerConfig config, final Handler handler)
            throws InterruptedException {
        final TcpServer server = new TcpServer(config, handler);
        server.bind();

        final Thread signalHook = new Thread(() -> {
            log.info("收到关闭信号");
            server.shutdown();
            try {
                if (!server.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("等待服务器关闭超时");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "redigo-signal");
        Runtime.getRuntime().addShutdownHook(signalHook);

        server.serve();

        try {
            Runtime.getRuntime().removeShutdownHook(signalHook);
        } catch (IllegalStateException e) {
            log.debug("JVM正在关闭，保留关闭钩子");
        }
    }

    /**
     * 创建事件循环组并绑定监听地址。
     *
     * @throws InterruptedException 等待绑定时被中断
     */
    public void bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("服务器已经绑定: " + localAddress());
        }
        initializeEventLoopGroups();
        initializeCommandExecutor();

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .handler(new AcceptCounter())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final Promise<Void> done = ch.attr(HANDLER_DONE).get();
                        ch.attr(HANDLED).set(Boolean.TRUE);
                        handler.handle(ch, commandExecutor).addListener(f -> done.trySuccess(null));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getBind(), config.getPort()).sync().channel();
        } catch (Exception e) {
            log.error("监听 {} 失败: {}", config.getAddress(), e.getMessage());
            releaseResources();
            throw e;
        }
        log.info("开始监听 {}", localAddress());
    }

    /**
     * 接收连接直到监听关闭，然后等待所有连接任务结束。
     *
     * <p>返回前再次关闭监听与处理器（可重复调用），并释放所有线程资源。
     *
     * @throws InterruptedException 等待期间被中断
     */
    public void serve() throws InterruptedException {
        final Channel listener = serverChannel;
        if (listener == null) {
            throw new IllegalStateException("服务器尚未绑定");
        }
        final Thread watcher = new Thread(this::awaitShutdownSignal, "redigo-shutdown");
        watcher.setDaemon(true);
        supervisor = watcher;
        watcher.start();
        try {
            listener.closeFuture().sync();
            log.info("监听已关闭，等待 {} 个连接任务结束", activeConnections.getCount());
            activeConnections.await();
        } finally {
            // 监听在没有关闭通知的情况下关闭时，监督线程仍在等待
            watcher.interrupt();
            closeListenerAndHandler();
            releaseResources();
            terminated.countDown();
            log.info("服务器已关闭");
        }
    }

    /**
     * 请求关闭服务器，可以重复调用。
     */
    public void shutdown() {
        if (shutdownSignal.getCount() > 0) {
            log.info("请求关闭服务器");
        }
        shutdownSignal.countDown();
    }

    /**
     * 等待{@link #serve()}结束并释放资源。
     *
     * @return 在超时前结束返回true
     * @throws InterruptedException 等待期间被中断
     */
    public boolean awaitTermination(final long timeout, final TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /**
     * 实际监听的地址，绑定端口0时用于获取系统分配的端口。
     */
    public InetSocketAddress localAddress() {
        final Channel listener = serverChannel;
        return listener == null ? null : (InetSocketAddress) listener.localAddress();
    }

    /**
     * 仍在运行的连接任务数。
     */
    public int getActiveConnectionCount() {
        return activeConnections.getCount();
    }

    Channel getServerChannel() {
        return serverChannel;
    }

    Thread getSupervisor() {
        return supervisor;
    }

    private void awaitShutdownSignal() {
        try {
            shutdownSignal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        log.info("服务器正在关闭...");
        closeListenerAndHandler();
    }

    private void closeListenerAndHandler() {
        final Channel listener = serverChannel;
        if (listener != null) {
            listener.close().syncUninterruptibly();
        }
        handler.close();
    }

    private void releaseResources() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (commandExecutor != null) {
            commandExecutor.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("redigo-cmd"));
    }

    /**
     * 位于监听通道的管道中、接收器之前，在接收线程上为每个新连接计数。
     */
    private final class AcceptCounter extends ChannelInboundHandlerAdapter {

        @Override
        public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
            final Channel child = (Channel) msg;
            log.info("接受连接 {}", child.remoteAddress());

            activeConnections.add(1);
            final Promise<Void> done = GlobalEventExecutor.INSTANCE.newPromise();
            done.addListener(f -> activeConnections.done());
            child.attr(HANDLER_DONE).set(done);
            // 没能交给处理器（例如注册失败）的连接在关闭时释放计数
            child.closeFuture().addListener(f -> {
                if (child.attr(HANDLED).get() == null) {
                    done.trySuccess(null);
                }
            });
            ctx.fireChannelRead(msg);
        }
    }
}
