package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 状态回复："+OK\r\n"
 *
 * <p>与{@link ErrorReply}一样，状态文本必须保持单行，构造时把 {@code \r} 和 {@code \n} 替换为空格，
 * null 视为空文本。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class StatusReply extends Resp {
    public static final StatusReply OK = new StatusReply("OK");

    private final String status;

    public StatusReply(final String status) {
        this.status = status == null ? "" : status.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(status.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "StatusReply(" + status + ")";
    }
}
