package site.redigo.protocol.parser;

/**
 * 协议格式错误：行结束符错误、长度或数量不是数字、非法的负数等。
 *
 * <p>格式错误只影响当前消息：解析器会产出一个携带该异常的{@link Payload}，
 * 重置解析状态并从下一行继续。它不是{@link java.io.IOException}，
 * 以便与传输错误区分。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class ProtocolFormatException extends RuntimeException {

    public ProtocolFormatException(final String message) {
        super(message);
    }
}
