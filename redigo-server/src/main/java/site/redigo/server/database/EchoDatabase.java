package site.redigo.server.database;

import lombok.extern.slf4j.Slf4j;
import site.redigo.datastructure.RedisBytes;
import site.redigo.protocol.EmptyMultiBulkReply;
import site.redigo.protocol.MultiBulkReply;
import site.redigo.protocol.Resp;
import site.redigo.server.connection.Connection;

import java.util.List;

/**
 * 回显存储引擎：把收到的命令参数原样作为多批量回复返回。
 *
 * <p>不保存任何数据，用于在没有真正存储引擎时端到端地跑通服务器。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class EchoDatabase implements Database {

    @Override
    public Resp execute(final Connection client, final List<RedisBytes> args) {
        if (args.isEmpty()) {
            return EmptyMultiBulkReply.INSTANCE;
        }
        if (log.isDebugEnabled()) {
            log.debug("回显命令 {} 来自 {}", args.get(0).getString(), client.getRemoteAddress());
        }
        return new MultiBulkReply(args);
    }

    @Override
    public void onConnectionClosed(final Connection client) {
        log.debug("连接已关闭: {}", client.getRemoteAddress());
    }

    @Override
    public void shutdown() {
        log.info("EchoDatabase已关闭");
    }
}
