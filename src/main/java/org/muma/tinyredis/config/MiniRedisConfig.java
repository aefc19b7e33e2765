package org.muma.tinyredis.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class MiniRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniRedisConfig.class);
    private static final MiniRedisConfig INSTANCE = new MiniRedisConfig();

    public static final String DEFAULT_CONFIG_FILE = "redis.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int idleTimeoutSeconds = 0; // 0 = 不超时

    // --- Persistence (AOF) ---
    private boolean appendOnly = true;
    private AppendFsync appendFsync = AppendFsync.EVERYSEC;
    private long appendFsyncIntervalMs = 1000;
    private String appendDir = ".";
    private String appendFilename = "database.aof";

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Enums ---
    public enum AppendFsync {
        ALWAYS, EVERYSEC, NO
    }

    /**
     * 测试和内嵌场景直接 new 一份独立配置，进程入口使用 getInstance()
     */
    public MiniRedisConfig() {
    }

    public static MiniRedisConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 进程启动时的完整加载流程：
     * 先找 --config 指定的文件，再依次叠加 文件 -> 环境变量 -> 命令行。
     */
    public void initialize(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        applyEnvOverrides(System.getenv());
        parseArgs(args);
        log.info("MiniRedisConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring argument without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parsePort(args[++i]);
                case "--aof-file" -> this.appendFilename = args[++i];
                case "--aof-dir" -> this.appendDir = args[++i];
                case "--appendfsync" -> this.appendFsync = parseFsync(args[++i], this.appendFsync);
                default -> log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker-threads", this.workerThreads);
        this.idleTimeoutSeconds = getInt(props, "server.idle-timeout-seconds", this.idleTimeoutSeconds);

        // 2. Persistence
        loadPersistenceConfig(props);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("REDIS_PORT");
        if (envPort != null) {
            this.port = parsePort(envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envAof = env.get("REDIS_AOF_FILE");
        if (envAof != null) {
            this.appendFilename = envAof;
            log.info("AOF file overridden by ENV: {}", this.appendFilename);
        }
    }

    private void loadPersistenceConfig(Properties props) {
        String aof = getString(props, "appendonly", appendOnly ? "yes" : "no");
        this.appendOnly = "yes".equalsIgnoreCase(aof);

        this.appendFsync = parseFsync(getString(props, "appendfsync", appendFsync.name()), this.appendFsync);

        String interval = getString(props, "appendfsync-interval-ms", String.valueOf(appendFsyncIntervalMs));
        try {
            long ms = Long.parseLong(interval.trim());
            if (ms <= 0) {
                log.warn("appendfsync-interval-ms must be positive, got {}. Keeping {}.", ms, appendFsyncIntervalMs);
            } else {
                this.appendFsyncIntervalMs = ms;
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid appendfsync-interval-ms '{}', using default {}.", interval, appendFsyncIntervalMs);
        }

        this.appendDir = getString(props, "appenddirname", this.appendDir);
        this.appendFilename = getString(props, "appendfilename", this.appendFilename);
    }

    private AppendFsync parseFsync(String value, AppendFsync fallback) {
        try {
            return AppendFsync.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid appendfsync value '{}', using {}.", value, fallback);
            return fallback;
        }
    }

    private int parsePort(String value) {
        int p = Integer.parseInt(value.trim());
        if (p < 0 || p > 65535) {
            throw new IllegalArgumentException("Port out of range: " + p);
        }
        return p;
    }

    /**
     * AOF 文件完整路径
     */
    public Path getAofPath() {
        return Paths.get(appendDir, appendFilename);
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? Integer.parseInt(val.trim()) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", aof=" + appendOnly + ", fsync=" + appendFsync
                + ", aofFile=" + getAofPath() + "}";
    }
}
