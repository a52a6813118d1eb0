package site.redigo.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误回复
 *
 * <p>用于向客户端传递服务器端的错误信息，格式为 "-Error message\r\n"。
 * 错误文本必须保持单行，构造时会把其中的 {@code \r} 和 {@code \n} 替换为空格，
 * 否则客户端会把剩余部分当作下一条回复。
 *
 * <ul>
 *     <li>示例："-ERR unknown"</li>
 *     <li>示例："-protocol error: *abc"</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class ErrorReply extends Resp {
    /** 错误消息内容 */
    private final String message;

    /**
     * 创建错误回复实例
     *
     * @param message 错误消息内容
     */
    public ErrorReply(final String message) {
        this.message = message == null ? "" : message.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(message.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "ErrorReply(" + message + ")";
    }
}
