package org.muma.tinyredis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.tinyredis.aof.AofLoader;
import org.muma.tinyredis.aof.AofManager;
import org.muma.tinyredis.command.CommandDispatcher;
import org.muma.tinyredis.command.CommandRegistry;
import org.muma.tinyredis.config.MiniRedisConfig;
import org.muma.tinyredis.server.RedisChannelInitializer;
import org.muma.tinyredis.store.StorageEngine;
import org.muma.tinyredis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

public class MiniRedisServer {

    private static final Logger log = LoggerFactory.getLogger(MiniRedisServer.class);

    private static final long SHUTDOWN_QUIET_MS = 100;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final MiniRedisConfig config;

    private AofManager aofManager;
    private StorageEngine storage;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private boolean stopped = false;

    public MiniRedisServer(MiniRedisConfig config) {
        this.config = config;
    }

    /**
     * 启动顺序：打开 AOF -> 初始化存储与注册表 -> 重放 AOF -> 监听端口。
     * 任一步失败都会释放已分配的资源并抛出，调用方应退出进程。
     */
    public synchronized void start() throws IOException, InterruptedException {
        // 1. 打开 AOF
        aofManager = new AofManager(config);
        aofManager.init();

        // 2. 初始化存储与命令表 (之后只读)
        storage = new MemoryStorageEngine();
        CommandDispatcher dispatcher = new CommandDispatcher(CommandRegistry.defaults(), storage, aofManager);

        // 3. 【关键】AOF 恢复数据 (Replay)，必须在 Netty 启动前完成
        try {
            new AofLoader(aofManager, dispatcher).load();
        } catch (IOException e) {
            aofManager.shutdown();
            throw e;
        }

        // 4. 监听端口
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.INFO))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new RedisChannelInitializer(dispatcher, config.getIdleTimeoutSeconds()));

        log.info("Starting Mini-Redis server on port {}", config.getPort());
        ChannelFuture future = bootstrap.bind(config.getPort()).await();
        if (!future.isSuccess()) {
            stop();
            throw new IOException("Failed to listen on port " + config.getPort(), future.cause());
        }
        serverChannel = future.channel();
        log.info("Mini-Redis started successfully, listening on {}", serverChannel.localAddress());
    }

    /**
     * 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public AofManager getAofManager() {
        return aofManager;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    /**
     * 优雅关闭：先停止接收新连接，等所有连接线程退出后再关闭 AOF，
     * 避免关闭文件与正在进行的 append 竞争。
     */
    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        log.info("Shutting down Mini-Redis...");

        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        if (aofManager != null) {
            aofManager.shutdown();
        }
        log.info("Mini-Redis stopped.");
    }

    public static void main(String[] args) {
        // 1. 初始化配置并解析参数
        MiniRedisConfig config = MiniRedisConfig.getInstance();
        config.initialize(args);

        MiniRedisServer server = new MiniRedisServer(config);
        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            System.exit(1);
        }

        // 记得 shutdown hook 关闭 AOF
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "Shutdown-Hook"));

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            server.stop();
        }
    }
}
