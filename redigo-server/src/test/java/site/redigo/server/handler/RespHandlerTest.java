package site.redigo.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.MultiBulkReply;
import site.redigo.server.connection.Connection;
import site.redigo.server.database.Database;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RespHandler 测试")
class RespHandlerTest {

    private static final String PING = "*1\r\n$4\r\nPING\r\n";

    @Mock
    private Database database;

    private RespHandler handler;

    private EmbeddedChannel channel;

    private Future<Void> done;

    @BeforeEach
    void setUp() {
        handler = new RespHandler(database);
        channel = newChannel();
        done = handler.handle(channel, null);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static EmbeddedChannel newChannel() {
        final EmbeddedChannel ch = new EmbeddedChannel();
        ch.config().setAutoRead(false);
        return ch;
    }

    private void send(final String wire) {
        channel.writeInbound(Unpooled.copiedBuffer(wire, CharsetUtil.UTF_8));
    }

    private String readReply() {
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

    private void echoArguments() {
        when(database.execute(any(Connection.class), anyList()))
                .thenAnswer(inv -> new MultiBulkReply(inv.<List<RedisBytes>>getArgument(1)));
    }

    @Test
    @DisplayName("构造参数校验")
    void testNullDatabase() {
        assertThatThrownBy(() -> new RespHandler(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("命令处理")
    class CommandTests {

        @Test
        @DisplayName("多批量命令交给存储引擎执行并写回结果")
        void testExecuteCommand() {
            echoArguments();
            send("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n");

            assertThat(readReply()).isEqualTo("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n");
            verify(database).execute(any(Connection.class),
                    eq(List.of(RedisBytes.fromString("ECHO"), RedisBytes.fromString("hi"))));
        }

        @Test
        @DisplayName("同一连接的多条命令按顺序回复")
        void testPipelinedCommandsInOrder() {
            echoArguments();
            send("*1\r\n$1\r\na\r\n*1\r\n$1\r\nb\r\n*1\r\n$1\r\nc\r\n");

            assertThat(readReply()).isEqualTo("*1\r\n$1\r\na\r\n");
            assertThat(readReply()).isEqualTo("*1\r\n$1\r\nb\r\n");
            assertThat(readReply()).isEqualTo("*1\r\n$1\r\nc\r\n");
            assertThat(readReply()).isNull();
        }

        @Test
        @DisplayName("存储引擎返回null时回复 -ERR unknown")
        void testNullResult() {
            when(database.execute(any(Connection.class), anyList())).thenReturn(null);
            send(PING);

            assertThat(readReply()).isEqualTo("-ERR unknown\r\n");
        }

        @Test
        @DisplayName("存储引擎抛出异常时回复错误，连接保持")
        void testEngineFailure() {
            when(database.execute(any(Connection.class), anyList()))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenAnswer(inv -> new MultiBulkReply(inv.<List<RedisBytes>>getArgument(1)));

            send(PING + PING);

            assertThat(readReply()).isEqualTo("-ERR boom\r\n");
            assertThat(readReply()).isEqualTo(PING);
            assertThat(channel.isOpen()).isTrue();
        }
    }

    @Nested
    @DisplayName("异常输入")
    class MalformedInputTests {

        @Test
        @DisplayName("格式错误回复错误信息后继续处理")
        void testFormatError() {
            echoArguments();
            send("*abc\r\n" + PING);

            assertThat(readReply()).isEqualTo("-protocol error: *abc\r\n");
            assertThat(readReply()).isEqualTo(PING);
            assertThat(channel.isOpen()).isTrue();
        }

        @Test
        @DisplayName("非多批量消息被忽略")
        void testNonMultiBulkIgnored() {
            echoArguments();
            send("+OK\r\n:1\r\n" + PING);

            assertThat(readReply()).isEqualTo(PING);
            assertThat(readReply()).isNull();
            verify(database, times(1)).execute(any(Connection.class), anyList());
        }

        @Test
        @DisplayName("无法识别的类型字节被忽略")
        void testEmptyPayloadIgnored() {
            echoArguments();
            send("hello\r\n" + PING);

            assertThat(readReply()).isEqualTo(PING);
            assertThat(readReply()).isNull();
        }
    }

    @Nested
    @DisplayName("连接生命周期")
    class LifecycleTests {

        @Test
        @DisplayName("对端关闭后注销连接并通知存储引擎")
        void testPeerEof() {
            assertThat(handler.getActiveConnectionCount()).isEqualTo(1);

            channel.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
            channel.runPendingTasks();

            assertThat(channel.isOpen()).isFalse();
            assertThat(done.isDone()).isTrue();
            assertThat(handler.getActiveConnectionCount()).isZero();
            verify(database).onConnectionClosed(any(Connection.class));
        }

        @Test
        @DisplayName("通道关闭后连接任务结束，只通知一次")
        void testChannelClosed() {
            channel.close();
            channel.runPendingTasks();

            assertThat(channel.pipeline().get("dispatcher")).isNull();
            assertThat(channel.pipeline().get("guard")).isNull();
            assertThat(done.isDone()).isTrue();
            assertThat(handler.getActiveConnectionCount()).isZero();
            verify(database, times(1)).onConnectionClosed(any(Connection.class));
        }

        @Test
        @DisplayName("关闭处理器：关闭活跃连接，拒绝新连接")
        void testCloseHandler() {
            handler.close();
            handler.close();
            channel.runPendingTasks();

            assertThat(handler.isClosing()).isTrue();
            assertThat(channel.isOpen()).isFalse();
            assertThat(done.isDone()).isTrue();
            verify(database, times(1)).shutdown();

            final EmbeddedChannel late = newChannel();
            final Future<Void> lateDone = handler.handle(late, null);
            assertThat(lateDone.isDone()).isTrue();
            assertThat(late.isOpen()).isFalse();
            assertThat(handler.getActiveConnectionCount()).isZero();
            verify(database, never()).execute(any(Connection.class), anyList());
            late.finishAndReleaseAll();
        }
    }
}
