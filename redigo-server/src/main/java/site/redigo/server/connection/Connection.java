package site.redigo.server.connection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.ReferenceCountUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redigo.protocol.Resp;
import site.redigo.sync.WaitGroup;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeUnit;

/**
 * 服务端视角的一个客户端连接。
 *
 * <p>包装一个已接受的{@link Channel}，所有写操作经过同一把锁串行提交，
 * 并登记到进行中写操作的{@link WaitGroup}，Netty完成写出后释放。
 * {@link #close()}先禁止新的写入，再最多等待{@value #CLOSE_WAIT_SECONDS}秒
 * 让已登记的写操作完成，然后无论写操作是否完成都关闭通道。
 *
 * <p>对象身份就是连接注册表中的键，因此不重写equals/hashCode。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class Connection {

    /** 关闭前等待进行中写操作的最长时间 */
    static final long CLOSE_WAIT_SECONDS = 10;

    private final Channel channel;

    /** 关闭前等待写操作的时间，单位毫秒 */
    private final long closeWaitMillis;

    private final WaitGroup waitingWrites = new WaitGroup();

    private final Object lock = new Object();

    /** 受lock保护 */
    private boolean closing;

    /** 远端地址，仅用于日志 */
    @Getter
    private final String remoteAddress;

    public Connection(final Channel channel) {
        this(channel, CLOSE_WAIT_SECONDS, TimeUnit.SECONDS);
    }

    Connection(final Channel channel, final long closeWait, final TimeUnit unit) {
        if (channel == null) {
            throw new IllegalArgumentException("channel不能为null");
        }
        this.channel = channel;
        this.closeWaitMillis = unit.toMillis(closeWait);
        this.remoteAddress = String.valueOf(channel.remoteAddress());
    }

    /**
     * 写出一条回复。
     *
     * @param reply 回复
     * @return 写操作的future；连接已开始关闭时返回以{@link ClosedChannelException}失败的future
     */
    public ChannelFuture write(final Resp reply) {
        return submit(reply);
    }

    /**
     * 写出已经编码好的字节。
     *
     * @param bytes 字节内容
     * @return 写操作的future
     */
    public ChannelFuture write(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return channel.newSucceededFuture();
        }
        return submit(Unpooled.wrappedBuffer(bytes));
    }

    private ChannelFuture submit(final Object msg) {
        final ChannelFuture future;
        synchronized (lock) {
            if (closing) {
                ReferenceCountUtil.release(msg);
                return channel.newFailedFuture(new ClosedChannelException());
            }
            waitingWrites.add(1);
            try {
                future = channel.writeAndFlush(msg);
            } catch (RuntimeException e) {
                waitingWrites.done();
                throw e;
            }
        }
        future.addListener(f -> waitingWrites.done());
        return future;
    }

    /**
     * 关闭连接，只有第一次调用生效。
     *
     * <p>会阻塞等待进行中的写操作，不要在通道自己的事件循环上调用；
     * 在事件循环上调用时跳过等待，直接关闭。
     */
    public void close() {
        synchronized (lock) {
            if (closing) {
                return;
            }
            closing = true;
        }
        final boolean inEventLoop = channel.eventLoop().inEventLoop();
        if (inEventLoop) {
            if (waitingWrites.getCount() > 0) {
                log.warn("在事件循环上关闭连接 {}，不等待 {} 个进行中的写操作", remoteAddress, waitingWrites.getCount());
            }
        } else {
            awaitWrites();
        }
        final ChannelFuture closeFuture = channel.close();
        if (!inEventLoop) {
            closeFuture.awaitUninterruptibly();
        }
    }

    private void awaitWrites() {
        try {
            if (!waitingWrites.await(closeWaitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("连接 {} 等待写操作超时({}ms)，强制关闭", remoteAddress, closeWaitMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("连接 {} 等待写操作时被中断", remoteAddress);
        }
    }

    public boolean isClosing() {
        synchronized (lock) {
            return closing;
        }
    }

    /**
     * 进行中的写操作数量，主要用于测试与诊断。
     */
    public int getPendingWrites() {
        return waitingWrites.getCount();
    }

    @Override
    public String toString() {
        return "Connection(" + remoteAddress + ")";
    }
}
