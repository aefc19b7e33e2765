package org.muma.tinyredis.command;

import org.muma.tinyredis.aof.AofManager;
import org.muma.tinyredis.protocol.BulkString;
import org.muma.tinyredis.protocol.ErrorMessage;
import org.muma.tinyredis.protocol.RedisArray;
import org.muma.tinyredis.protocol.RedisMessage;
import org.muma.tinyredis.protocol.SimpleString;
import org.muma.tinyredis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * 命令分发：校验请求形状 -> 查注册表 -> (写命令) 追加 AOF -> 执行处理器
 * <p>
 * 线上请求走 dispatch，启动重放走 replay，两者共用同一套查找与执行逻辑，
 * 区别只在于 replay 永远不写 AOF。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    /**
     * 需要写入 AOF 的命令。注册表本身不区分读写，这里必须显式列出。
     */
    public static final Set<String> PERSISTED_COMMANDS = Set.of("SET", "HSET");

    // 未知命令回复空的简单字符串 "+\r\n"，连接保持
    static final SimpleString UNKNOWN_COMMAND_REPLY = new SimpleString("");

    private static final long SLOW_COMMAND_MS = 10;

    private final CommandRegistry registry;
    private final StorageEngine storage;
    private final AofManager aofManager;

    public CommandDispatcher(CommandRegistry registry, StorageEngine storage, AofManager aofManager) {
        this.registry = registry;
        this.storage = storage;
        this.aofManager = aofManager;
    }

    /**
     * 处理一条线上请求
     *
     * @return 要回写给客户端的响应；请求形状非法时返回 null，表示什么都不回
     */
    public RedisMessage dispatch(RedisMessage request) {
        String commandName = commandName(request);
        if (commandName == null) {
            return null;
        }

        RedisCommand command = registry.lookup(commandName);
        if (command == null) {
            log.info("Unknown command: {}", commandName);
            return UNKNOWN_COMMAND_REPLY;
        }

        if (PERSISTED_COMMANDS.contains(commandName)) {
            try {
                aofManager.append((RedisArray) request);
            } catch (IOException e) {
                // 持久化降级，但请求照常执行
                log.warn("Failed to append {} to AOF, continuing without durability: {}", commandName, e.getMessage());
            }
        }

        return execute(commandName, command, arguments((RedisArray) request));
    }

    /**
     * 重放一条 AOF 记录，不写 AOF，不产生网络输出
     */
    public void replay(RedisMessage record) {
        String commandName = commandName(record);
        if (commandName == null) {
            return;
        }

        RedisCommand command = registry.lookup(commandName);
        if (command == null) {
            log.error("Unknown command in AOF, skipped: {}", commandName);
            return;
        }

        RedisMessage result = execute(commandName, command, arguments((RedisArray) record));
        if (result instanceof ErrorMessage error) {
            log.warn("Replayed command {} returned error: {}", commandName, error.content());
        }
    }

    /**
     * 请求必须是非空数组，且首元素是非空 BulkString
     *
     * @return 大写的命令名；形状不合法时返回 null
     */
    private String commandName(RedisMessage request) {
        if (!(request instanceof RedisArray array)) {
            log.warn("Invalid request, expected array but got {}", request.type());
            return null;
        }
        if (array.size() == 0) {
            log.warn("Invalid request, expected array length > 0");
            return null;
        }
        if (!(array.elements()[0] instanceof BulkString name) || name.isNull()) {
            log.warn("Invalid request, command name must be a bulk string");
            return null;
        }
        return name.asString().toUpperCase(Locale.ROOT);
    }

    private RedisMessage[] arguments(RedisArray request) {
        RedisMessage[] elements = request.elements();
        return Arrays.copyOfRange(elements, 1, elements.length);
    }

    private RedisMessage execute(String commandName, RedisCommand command, RedisMessage[] args) {
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args);

            // 记录慢日志
            long duration = (System.nanoTime() - startTime) / 1_000_000;
            if (duration > SLOW_COMMAND_MS) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }
            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数类型错误)
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal error");
        }
    }
}
