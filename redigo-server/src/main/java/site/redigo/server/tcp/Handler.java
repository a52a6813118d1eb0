package site.redigo.server.tcp;

import io.netty.channel.Channel;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;

/**
 * 连接处理器：服务器把每个已接受的连接交给它。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Handler {

    /**
     * 接管一个已接受的连接。
     *
     * <p>在通道的事件循环上调用。处理器负责安装自己的管道并在连接结束时关闭通道。
     *
     * @param channel 已接受的通道，{@code AUTO_READ}已关闭
     * @param executor 执行命令的线程池，为null时使用通道自己的事件循环
     * @return 本连接的处理任务结束时完成的future
     */
    Future<Void> handle(Channel channel, EventExecutorGroup executor);

    /**
     * 停止处理器：拒绝新的连接，尽力关闭所有活跃连接。可以重复调用。
     */
    void close();
}
