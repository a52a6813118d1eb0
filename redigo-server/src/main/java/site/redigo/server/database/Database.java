package site.redigo.server.database;

import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.Resp;
import site.redigo.server.connection.Connection;

import java.util.List;

/**
 * 存储引擎接口。
 *
 * <p>请求处理器只通过这三个方法与存储引擎交互。{@link #execute}会在命令执行线程上
 * 被多个连接并发调用，并发安全由实现自行保证。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Database {

    /**
     * 执行一条命令。
     *
     * @param client 发出命令的连接
     * @param args 命令及参数，第一个元素是命令名
     * @return 回复；返回null时客户端收到 "-ERR unknown"
     */
    Resp execute(Connection client, List<RedisBytes> args);

    /**
     * 连接关闭后的回调，用于清理与该连接相关的状态。
     *
     * @param client 已关闭的连接
     */
    void onConnectionClosed(Connection client);

    /**
     * 关闭存储引擎。
     */
    void shutdown();
}
