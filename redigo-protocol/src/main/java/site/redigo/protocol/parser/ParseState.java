package site.redigo.protocol.parser;

import site.redigo.datastructure.RedisBytes;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个连接的解析中间状态，只由该连接的解析任务修改。
 *
 * <p>不变式：{@code args.size() <= expectedArgsCount}；
 * 当且仅当{@code expectedArgsCount > 0 && args.size() == expectedArgsCount}时消息完整。
 * 每条消息完成或出错后通过{@link #reset()}回到初始值。
 *
 * @author hnfy258
 * @since 1.0.0
 */
final class ParseState {
    /** 是否处于多段消息（'*' 或 '$'）的中间 */
    boolean readingMultiLine;

    /** 期望的参数个数 */
    int expectedArgsCount;

    /** 当前消息的类型字节 */
    byte msgType;

    /** 已收集的参数 */
    List<RedisBytes> args = new ArrayList<>();

    /** 待读取的消息体字节数，0表示当前没有待读的消息体 */
    long bulkLen;

    boolean finished() {
        return expectedArgsCount > 0 && args.size() == expectedArgsCount;
    }

    void reset() {
        readingMultiLine = false;
        expectedArgsCount = 0;
        msgType = 0;
        args = new ArrayList<>();
        bulkLen = 0;
    }
}
