package site.redigo.server.tcp;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConnectionTaskGuard 测试")
class ConnectionTaskGuardTest {

    @Test
    @DisplayName("后面的处理器都移除之后才结束连接任务")
    void testCompletesAfterLaterHandlersRemoved() {
        final Promise<Void> done = GlobalEventExecutor.INSTANCE.newPromise();
        final List<Boolean> doneWhenRemoved = new ArrayList<>();
        final EmbeddedChannel channel = new EmbeddedChannel();
        channel.pipeline()
                .addLast("guard", new ConnectionTaskGuard(done))
                .addLast("session", new ChannelInboundHandlerAdapter() {
                    @Override
                    public void handlerRemoved(final ChannelHandlerContext ctx) {
                        doneWhenRemoved.add(done.isDone());
                    }
                });
        assertThat(done.isDone()).isFalse();

        channel.close();
        channel.runPendingTasks();

        assertThat(doneWhenRemoved).containsExactly(false);
        assertThat(done.isDone()).isTrue();
    }
}
