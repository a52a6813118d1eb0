package site.redigo.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * 服务器配置。
 *
 * <p>采用Builder模式创建，未设置的字段使用默认值：
 * <ul>
 *   <li>网络配置：监听地址、端口、连接队列与缓冲区大小
 *   <li>线程配置：接收线程、I/O线程、命令执行线程的数量
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class ServerConfig {

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <ul>
     *   <li>127.0.0.1：仅本机访问
     *   <li>0.0.0.0：允许所有网络访问
     * </ul>
     */
    @Builder.Default
    private String bind = "0.0.0.0";

    /**
     * 服务器监听端口，0表示由系统分配。
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** 接收连接的线程数 */
    @Builder.Default
    private int bossThreadCount = 1;

    /** 处理网络I/O的线程数 */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行线程数。
     *
     * <p>默认为1，所有连接的命令串行执行。
     */
    @Builder.Default
    private int commandExecutorThreadCount = 1;

    public static ServerConfig defaultConfig() {
        return ServerConfig.builder().build();
    }

    /**
     * "host:port"形式的监听地址，用于日志。
     */
    public String getAddress() {
        return bind + ":" + port;
    }

    /**
     * 校验配置的有效性。
     *
     * @throws IllegalArgumentException 如果配置无效
     */
    public void validate() {
        if (bind == null || bind.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内: " + port);
        }
        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
    }
}
