package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.redigo.datastructure.RedisBytes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 多批量回复
 *
 * <p>由若干批量字符串组成的数组，是客户端命令的唯一合法形式：
 * "*2\r\n$3\r\nGET\r\n$3\r\nkey\r\n"。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class MultiBulkReply extends Resp {
    /** 参数列表（不可变） */
    private final List<RedisBytes> args;

    public MultiBulkReply(final List<RedisBytes> args) {
        if (args == null) {
            throw new IllegalArgumentException("参数列表不能为null");
        }
        this.args = Collections.unmodifiableList(args);
    }

    /**
     * 由字符串构造，主要用于测试与客户端命令拼装
     *
     * @param args 参数
     * @return 多批量回复
     */
    public static MultiBulkReply of(final String... args) {
        final RedisBytes[] bytes = new RedisBytes[args.length];
        for (int i = 0; i < args.length; i++) {
            bytes[i] = RedisBytes.fromString(args[i]);
        }
        return new MultiBulkReply(Arrays.asList(bytes));
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('*');
        writeDecimal(byteBuf, args.size());
        byteBuf.writeBytes(CRLF);
        for (final RedisBytes arg : args) {
            BulkReply.writeBulk(byteBuf, arg);
        }
    }

    @Override
    public String toString() {
        return "MultiBulkReply" + args;
    }
}
