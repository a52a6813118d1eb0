package site.redigo.server.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EchoHandler 测试")
class EchoHandlerTest {

    private EchoHandler handler;

    private EmbeddedChannel channel;

    private Future<Void> done;

    @BeforeEach
    void setUp() {
        handler = new EchoHandler();
        channel = new EmbeddedChannel();
        channel.config().setAutoRead(false);
        done = handler.handle(channel, null);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private String readOutbound() {
        final ByteBuf buf = channel.readOutbound();
        if (buf == null) {
            return null;
        }
        try {
            return buf.toString(CharsetUtil.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    @DisplayName("逐行回显")
    void testEchoLines() {
        channel.writeInbound(Unpooled.copiedBuffer("hello\nwor", CharsetUtil.UTF_8));
        assertThat(readOutbound()).isEqualTo("hello\n");
        assertThat(readOutbound()).isNull();

        channel.writeInbound(Unpooled.copiedBuffer("ld\r\n", CharsetUtil.UTF_8));
        assertThat(readOutbound()).isEqualTo("world\r\n");
    }

    @Test
    @DisplayName("对端关闭后结束连接任务")
    void testPeerEof() {
        assertThat(handler.getActiveConnectionCount()).isEqualTo(1);

        channel.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
        channel.runPendingTasks();

        assertThat(channel.isOpen()).isFalse();
        assertThat(done.isDone()).isTrue();
        assertThat(handler.getActiveConnectionCount()).isZero();
    }

    @Test
    @DisplayName("关闭处理器后拒绝新连接")
    void testClose() {
        handler.close();
        channel.runPendingTasks();

        assertThat(channel.isOpen()).isFalse();
        assertThat(done.isDone()).isTrue();

        final EmbeddedChannel late = new EmbeddedChannel();
        assertThat(handler.handle(late, null).isDone()).isTrue();
        assertThat(late.isOpen()).isFalse();
        late.finishAndReleaseAll();
    }
}
