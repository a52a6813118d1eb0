package site.redigo.protocol.parser;

import lombok.Getter;
import site.redigo.protocol.Resp;

import java.io.IOException;

/**
 * 解析单元：一条完整线上消息的解析结果。
 *
 * <p>通常只有{@code data}和{@code error}之一非空。遇到无法识别的类型字节时
 * 两者都为空，由消费方当作异常情况记录后跳过。
 *
 * <p>错误分两类：
 * <ul>
 *   <li>传输错误（{@link IOException}）- 连接已不可用，这是序列的最后一个单元
 *   <li>格式错误（{@link ProtocolFormatException}）- 仅当前消息无效，序列继续
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public final class Payload {
    /** 既无数据也无错误的单元 */
    public static final Payload EMPTY = new Payload(null, null);

    private final Resp data;

    private final Throwable error;

    private Payload(final Resp data, final Throwable error) {
        this.data = data;
        this.error = error;
    }

    public static Payload of(final Resp data) {
        return new Payload(data, null);
    }

    public static Payload ofError(final Throwable error) {
        return new Payload(null, error);
    }

    public boolean isTransportError() {
        return error instanceof IOException;
    }

    @Override
    public String toString() {
        return error != null ? "Payload(error=" + error + ")" : "Payload(data=" + data + ")";
    }
}
