package site.redigo.server.tcp;

import io.netty.channel.ChannelHandlerAdapter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.util.concurrent.Promise;

/**
 * 连接任务的结束点，必须是管道中的第一个处理器，并运行在通道自己的事件循环上。
 *
 * <p>通道注销时Netty从尾到头依次移除处理器，所以这里的{@link #handlerRemoved}
 * 是该连接在管道上的最后一个回调。此时之前所有处理器都已执行完毕，
 * 不会再向事件循环或命令执行器提交任务，才能把连接任务标记为结束。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class ConnectionTaskGuard extends ChannelHandlerAdapter {

    private final Promise<Void> done;

    public ConnectionTaskGuard(final Promise<Void> done) {
        this.done = done;
    }

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        // 通道已经注销，管道不会再被销毁
        if (!ctx.channel().isRegistered()) {
            done.trySuccess(null);
        }
    }

    @Override
    public void handlerRemoved(final ChannelHandlerContext ctx) {
        done.trySuccess(null);
    }
}
