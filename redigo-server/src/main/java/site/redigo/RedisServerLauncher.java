package site.redigo;

import lombok.extern.slf4j.Slf4j;
import site.redigo.server.config.ConfigLoader;
import site.redigo.server.config.ServerConfig;
import site.redigo.server.database.EchoDatabase;
import site.redigo.server.handler.RespHandler;
import site.redigo.server.tcp.TcpServer;

import java.nio.file.Paths;

/**
 * 服务器启动入口。
 *
 * <p>配置来源：命令行第一个参数指定的文件；没有参数时使用工作目录下的
 * {@code redis.conf}（存在的话），否则使用默认配置。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RedisServerLauncher {

    private static final String DEFAULT_CONFIG_FILE = "redis.conf";

    public static void main(final String[] args) {
        try {
            final ServerConfig config = args.length > 0
                    ? ConfigLoader.load(Paths.get(args[0]))
                    : ConfigLoader.loadOrDefault(Paths.get(DEFAULT_CONFIG_FILE));
            log.info("服务器配置: {}", config);
            TcpServer.listenAndServeWithSignal(config, new RespHandler(new EchoDatabase()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("服务器运行被中断", e);
        } catch (Exception e) {
            log.error("服务器启动失败", e);
            System.exit(1);
        }
    }
}
