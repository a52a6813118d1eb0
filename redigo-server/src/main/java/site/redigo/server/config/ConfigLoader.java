package site.redigo.server.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * redis.conf风格的配置文件加载器。
 *
 * <p>每行一个 {@code key value}，{@code #}开头的行是注释，键不区分大小写。
 * 支持的键：
 * <ul>
 *   <li>{@code bind} - 监听地址</li>
 *   <li>{@code port} - 监听端口</li>
 *   <li>{@code tcp-backlog} - 连接队列大小</li>
 *   <li>{@code so-rcvbuf} / {@code so-sndbuf} - 套接字缓冲区大小</li>
 *   <li>{@code boss-threads} / {@code io-threads} / {@code command-threads} - 线程数</li>
 * </ul>
 * 未知的键记录警告后忽略。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * 文件存在时加载，否则返回默认配置。
     *
     * @param file 配置文件路径
     * @return 服务器配置
     * @throws IOException 读取文件失败
     */
    public static ServerConfig loadOrDefault(final Path file) throws IOException {
        if (Files.isRegularFile(file)) {
            return load(file);
        }
        log.info("配置文件 {} 不存在，使用默认配置", file);
        return ServerConfig.defaultConfig();
    }

    /**
     * 加载配置文件。
     *
     * @param file 配置文件路径
     * @return 校验过的服务器配置
     * @throws IOException 读取文件失败
     * @throws IllegalArgumentException 配置项的值无效
     */
    public static ServerConfig load(final Path file) throws IOException {
        final ServerConfig config = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        log.info("已加载配置文件 {}", file);
        return config;
    }

    static ServerConfig parse(final List<String> lines) {
        final ServerConfig config = ServerConfig.defaultConfig();
        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            final String[] parts = line.split("\\s+", 2);
            final String key = parts[0].toLowerCase(Locale.ROOT);
            if (parts.length < 2) {
                throw new IllegalArgumentException("第" + (i + 1) + "行缺少配置值: " + key);
            }
            apply(config, key, parts[1].trim(), i + 1);
        }
        config.validate();
        return config;
    }

    private static void apply(final ServerConfig config, final String key, final String value, final int lineNo) {
        switch (key) {
            case "bind":
                // 多个地址时只使用第一个
                config.setBind(value.split("\\s+")[0]);
                break;
            case "port":
                config.setPort(parseInt(key, value, lineNo));
                break;
            case "tcp-backlog":
                config.setBacklogSize(parseInt(key, value, lineNo));
                break;
            case "so-rcvbuf":
                config.setReceiveBufferSize(parseInt(key, value, lineNo));
                break;
            case "so-sndbuf":
                config.setSendBufferSize(parseInt(key, value, lineNo));
                break;
            case "boss-threads":
                config.setBossThreadCount(parseInt(key, value, lineNo));
                break;
            case "io-threads":
                config.setWorkerThreadCount(parseInt(key, value, lineNo));
                break;
            case "command-threads":
                config.setCommandExecutorThreadCount(parseInt(key, value, lineNo));
                break;
            default:
                log.warn("忽略未知配置项(第{}行): {}", lineNo, key);
        }
    }

    private static int parseInt(final String key, final String value, final int lineNo) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("第" + lineNo + "行配置项 " + key + " 的值不是有效整数: " + value, e);
        }
    }
}
