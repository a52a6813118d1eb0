package site.redigo.protocol.parser;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;
import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.BulkReply;
import site.redigo.protocol.EmptyMultiBulkReply;
import site.redigo.protocol.ErrorReply;
import site.redigo.protocol.IntegerReply;
import site.redigo.protocol.MultiBulkReply;
import site.redigo.protocol.NullBulkReply;
import site.redigo.protocol.Resp;
import site.redigo.protocol.StatusReply;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;

/**
 * RESP流式解析器
 *
 * <p>在一个不断累积的输入缓冲区上增量解析RESP消息，不需要预先知道消息边界。
 * 每次{@link #parse(ByteBuf)}只消费完整的行或完整的消息体，半行或半个消息体
 * 留在缓冲区中等待更多数据，已完成的部分保存在{@link ParseState}中。
 *
 * <p>状态机：
 * <ul>
 *     <li>等待消息头 --'*'--> 收集元素(N) --> 完成</li>
 *     <li>等待消息头 --'$'--> 读取消息体 --> 完成</li>
 *     <li>等待消息头 --其他--> 单行消息，立即完成</li>
 * </ul>
 *
 * <p>读取规则：
 * <ul>
 *     <li>"行"以 {@code \n} 结束，且必须以 {@code \r\n} 结束</li>
 *     <li>消息体按长度整块读取（长度 + 2字节结束符），内容中的
 *     {@code \r}、{@code \n}、{@code \0} 原样保留</li>
 *     <li>消息之间或元素之间的空行被忽略（"$0"消息体的结束符就是这样一行）</li>
 * </ul>
 *
 * <p>格式错误时返回携带{@link ProtocolFormatException}的单元，重置状态，
 * 并从下一行继续解析。如果错误发生在消息体中间，后续字节可能被错误解读，
 * 这里不做额外的重新同步。
 *
 * <p>非线程安全：每个连接独占一个实例，只由该连接的解析任务调用。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespParser {

    /** 批量字符串最大长度 512MB */
    static final long PROTO_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 多批量最大元素个数 */
    static final int PROTO_MAX_MULTIBULK_LEN = 1024 * 1024;

    /** 未找到换行符时允许缓冲的最大行长度 */
    static final int MAX_LINE_LENGTH = 64 * 1024;

    private final ParseState state = new ParseState();

    /**
     * 解析下一个单元
     *
     * @param in 累积的输入缓冲区，已消费的字节会推进读索引
     * @return 下一个解析单元；数据不足以组成完整单元时返回null
     */
    public Payload parse(final ByteBuf in) {
        while (true) {
            final boolean bodyPending = state.bulkLen > 0;
            final Payload payload;
            try {
                final byte[] msg = bodyPending ? readBody(in) : readLine(in);
                if (msg == null) {
                    return null;
                }
                payload = bodyPending ? onBody(msg) : onLine(msg);
            } catch (ProtocolFormatException e) {
                log.debug("RESP格式错误，重置解析状态: {}", e.getMessage());
                state.reset();
                return Payload.ofError(e);
            }
            if (payload != null) {
                return payload;
            }
        }
    }

    /**
     * 当前是否处于一条消息的中间，主要用于诊断
     */
    public boolean isMidMessage() {
        return state.readingMultiLine || state.bulkLen > 0;
    }

    private byte[] readLine(final ByteBuf in) {
        final int start = in.readerIndex();
        final int lf = in.indexOf(start, in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                in.skipBytes(in.readableBytes());
                throw new ProtocolFormatException("protocol error: line too long");
            }
            return null;
        }
        final byte[] msg = new byte[lf - start + 1];
        in.readBytes(msg);
        if (msg.length < 2 || msg[msg.length - 2] != '\r') {
            throw formatError(msg);
        }
        return msg;
    }

    private byte[] readBody(final ByteBuf in) {
        final int length = (int) state.bulkLen + 2;
        if (in.readableBytes() < length) {
            return null;
        }
        final byte[] msg = new byte[length];
        in.readBytes(msg);
        if (msg[length - 2] != '\r' || msg[length - 1] != '\n') {
            throw formatError(msg);
        }
        state.bulkLen = 0;
        return msg;
    }

    private Payload onBody(final byte[] msg) {
        state.args.add(RedisBytes.wrapTrusted(Arrays.copyOf(msg, msg.length - 2)));
        return completeIfFinished();
    }

    private Payload onLine(final byte[] msg) {
        if (msg.length == 2) {
            return null;
        }
        if (state.readingMultiLine) {
            return readElement(msg);
        }
        switch (msg[0]) {
            case '*':
                return parseMultiBulkHeader(msg);
            case '$':
                return parseBulkHeader(msg);
            case '+':
                return Payload.of(new StatusReply(text(msg, 1)));
            case '-':
                return Payload.of(new ErrorReply(text(msg, 1)));
            case ':':
                return Payload.of(IntegerReply.valueOf(parseNumber(msg)));
            default:
                log.debug("无法识别的RESP类型标识: {}", msg[0] & 0xFF);
                return Payload.EMPTY;
        }
    }

    private Payload parseMultiBulkHeader(final byte[] msg) {
        final long count = parseNumber(msg);
        if (count < 0 || count > PROTO_MAX_MULTIBULK_LEN) {
            throw formatError(msg);
        }
        if (count == 0) {
            state.reset();
            return Payload.of(EmptyMultiBulkReply.INSTANCE);
        }
        state.msgType = '*';
        state.readingMultiLine = true;
        state.expectedArgsCount = (int) count;
        state.args = new ArrayList<>((int) Math.min(count, 1024));
        return null;
    }

    private Payload parseBulkHeader(final byte[] msg) {
        final long length = parseNumber(msg);
        if (length == -1) {
            return Payload.of(NullBulkReply.INSTANCE);
        }
        if (length == 0) {
            return Payload.of(new BulkReply(RedisBytes.EMPTY));
        }
        if (length < -1 || length > PROTO_MAX_BULK_LEN) {
            throw formatError(msg);
        }
        state.msgType = '$';
        state.readingMultiLine = true;
        state.expectedArgsCount = 1;
        state.args = new ArrayList<>(1);
        state.bulkLen = length;
        return null;
    }

    private Payload readElement(final byte[] msg) {
        if (msg[0] == '$') {
            final long length = parseNumber(msg);
            if (length > PROTO_MAX_BULK_LEN) {
                throw formatError(msg);
            }
            if (length <= 0) {
                // 多批量中的空值记为空参数
                state.args.add(RedisBytes.EMPTY);
                state.bulkLen = 0;
            } else {
                state.bulkLen = length;
            }
        } else {
            state.args.add(RedisBytes.wrapTrusted(Arrays.copyOf(msg, msg.length - 2)));
        }
        return completeIfFinished();
    }

    private Payload completeIfFinished() {
        if (!state.finished()) {
            return null;
        }
        final Resp result = state.msgType == '*'
                ? new MultiBulkReply(state.args)
                : new BulkReply(state.args.get(0));
        state.reset();
        return Payload.of(result);
    }

    private static long parseNumber(final byte[] msg) {
        try {
            return Long.parseLong(text(msg, 1));
        } catch (NumberFormatException e) {
            throw formatError(msg);
        }
    }

    private static ProtocolFormatException formatError(final byte[] msg) {
        return new ProtocolFormatException("protocol error: " + text(msg, 0));
    }

    /**
     * 去掉行尾的 \r\n（或单独的 \n）后解码为字符串
     */
    private static String text(final byte[] msg, final int from) {
        int end = msg.length;
        if (end > from && msg[end - 1] == '\n') {
            end--;
        }
        if (end > from && msg[end - 1] == '\r') {
            end--;
        }
        return new String(msg, from, Math.max(0, end - from), StandardCharsets.UTF_8);
    }
}
