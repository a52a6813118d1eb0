package site.redigo.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节串。
 *
 * <p>用于承载RESP协议中的批量字符串与命令参数。内容可以包含任意字节（包括
 * {@code \r}、{@code \n}、{@code \0}），相等性按字节内容判断。
 *
 * <p>线程安全性：本类不可变，线程安全。字符串表示延迟计算并缓存。
 *
 * @author hnfy258
 * @since 1.0
 */
public final class RedisBytes {

    /**
     * 字符串编码解码使用的字符集。
     */
    private static final Charset CHARSET = StandardCharsets.UTF_8;

    /**
     * 预分配的空字节串实例。
     */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /**
     * 存储的字节数组（不可变）。
     */
    private final byte[] bytes;

    /**
     * 预计算的哈希值。
     */
    private final int hashCode;

    /**
     * 延迟初始化的字符串值。
     */
    private volatile String stringValue;

    /**
     * 创建不可变字节串，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝包装。
     *
     * <p><b>警告</b>：调用者必须保证参数数组在实例生命周期内不被修改！
     * 仅用于协议解析等内部受信任场景。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        if (trustedBytes.length == 0) {
            return EMPTY;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 由UTF-8字符串创建字节串。
     *
     * @param str 源字符串
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取底层字节数组的副本。
     *
     * @return 字节数组的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，仅用于只读的编码与网络写出。
     *
     * <p><strong>警告：</strong>调用者不得修改返回的数组！
     *
     * @return 字节数组的直接引用
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 以UTF-8解码的字符串表示。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length);

        // 小数据显示可打印预览，不可打印字节转义为\xNN
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        } else {
            sb.append(", type=binary");
        }

        sb.append("]");
        return sb.toString();
    }
}
