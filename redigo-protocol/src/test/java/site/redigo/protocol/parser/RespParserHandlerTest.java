package site.redigo.protocol.parser;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.redigo.protocol.MultiBulkReply;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RespParserHandler 按需产出与终止语义测试
 *
 * @author hnfy258
 * @since 1.0.0
 */
@DisplayName("协议解析任务测试")
class RespParserHandlerTest {

    private EmbeddedChannel channel;

    private ReadCounter readCounter;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        channel.config().setAutoRead(false);
        readCounter = new ReadCounter();
        // 出站的read()从尾部经过解析任务再到readCounter
        channel.pipeline().addLast(readCounter, new RespParserHandler());
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void receive(final String s) {
        channel.writeInbound(Unpooled.copiedBuffer(s, StandardCharsets.UTF_8));
    }

    private Payload next() {
        channel.read();
        return channel.readInbound();
    }

    private static String firstArg(final Payload payload) {
        return ((MultiBulkReply) payload.getData()).getArgs().get(0).getString();
    }

    @Test
    @DisplayName("未索取时不产出")
    void testNoDemandNoOutput() {
        receive("*1\r\n$4\r\nPING\r\n");
        assertNull(channel.readInbound());
    }

    @Test
    @DisplayName("每次索取最多产出一个单元")
    void testOneUnitPerDemand() {
        receive("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nINFO\r\n");

        channel.read();
        final Payload first = channel.readInbound();
        assertEquals("PING", firstArg(first));
        assertNull(channel.readInbound());

        assertEquals("INFO", firstArg(next()));
        assertNull(next());
    }

    @Test
    @DisplayName("缓冲区不足时才向socket请求数据")
    void testReadsSocketOnlyWhenNeeded() {
        receive("*1\r\n$4\r\nPING\r\n");
        assertEquals("PING", firstArg(next()));
        assertEquals(0, readCounter.count);

        channel.read();
        assertEquals(1, readCounter.count);
        assertNull(channel.readInbound());
    }

    @Test
    @DisplayName("已索取的单元在数据到达后交付")
    void testPendingDemandSatisfiedByArrival() {
        channel.read();
        assertNull(channel.readInbound());

        receive("*1\r\n$4\r\nPI");
        assertNull(channel.readInbound());
        receive("NG\r\n");
        assertEquals("PING", firstArg(channel.readInbound()));
    }

    @Test
    @DisplayName("格式错误不终止序列")
    void testFormatErrorContinues() {
        receive("*abc\r\n*1\r\n$4\r\nPING\r\n");
        final Payload error = next();
        assertInstanceOf(ProtocolFormatException.class, error.getError());
        assertFalse(error.isTransportError());
        assertEquals("PING", firstArg(next()));
    }

    @Test
    @DisplayName("对端半关闭：先交付已缓冲的单元，再产出EOF")
    void testEofAfterBufferedUnits() {
        receive("*1\r\n$4\r\nPING\r\n*1\r\n$4\r\nPI");
        channel.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);

        assertEquals("PING", firstArg(next()));
        final Payload eof = next();
        assertInstanceOf(EOFException.class, eof.getError());
        assertTrue(eof.isTransportError());

        // 最终单元只产出一次
        assertNull(next());
        channel.close();
        assertNull(channel.readInbound());
    }

    @Test
    @DisplayName("通道关闭产出ClosedChannelException")
    void testCloseProducesClosedChannel() {
        channel.close();
        final Payload payload = channel.readInbound();
        assertNotNull(payload);
        assertInstanceOf(ClosedChannelException.class, payload.getError());
        assertTrue(payload.isTransportError());
    }

    @Test
    @DisplayName("读失败产出对应的IOException")
    void testReadFailure() {
        final IOException failure = new IOException("Connection reset by peer");
        channel.pipeline().fireExceptionCaught(failure);

        final Payload payload = channel.readInbound();
        assertSame(failure, payload.getError());

        receive("*1\r\n$4\r\nPING\r\n");
        assertNull(next());
    }

    @Test
    @DisplayName("意外异常关闭连接，消费者仍收到最终单元")
    void testUnexpectedFaultClosesConnection() {
        channel.pipeline().fireExceptionCaught(new IllegalStateException("boom"));

        assertFalse(channel.isOpen());
        // channelInactive由事件循环稍后触发
        channel.runPendingTasks();
        final Payload payload = channel.readInbound();
        assertNotNull(payload);
        assertInstanceOf(ClosedChannelException.class, payload.getError());
        assertNull(channel.readInbound());
    }

    private static final class ReadCounter extends ChannelOutboundHandlerAdapter {
        private int count;

        @Override
        public void read(final ChannelHandlerContext ctx) throws Exception {
            count++;
            super.read(ctx);
        }
    }
}
