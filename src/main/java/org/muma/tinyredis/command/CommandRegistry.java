package org.muma.tinyredis.command;

import org.muma.tinyredis.command.impl.hash.HGetAllCommand;
import org.muma.tinyredis.command.impl.hash.HGetCommand;
import org.muma.tinyredis.command.impl.hash.HSetCommand;
import org.muma.tinyredis.command.impl.server.EchoCommand;
import org.muma.tinyredis.command.impl.server.PingCommand;
import org.muma.tinyredis.command.impl.string.GetCommand;
import org.muma.tinyredis.command.impl.string.SetCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表：大写命令名 -> 处理器
 * 构造完成后只读，连接线程并发查找无需加锁。
 */
public class CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, RedisCommand> commandMap;

    public CommandRegistry(Map<String, RedisCommand> commands) {
        Map<String, RedisCommand> normalized = new HashMap<>();
        commands.forEach((name, command) -> normalized.put(name.toUpperCase(Locale.ROOT), command));
        this.commandMap = Map.copyOf(normalized);
    }

    /**
     * 内置命令集，按数据结构分类注册
     */
    public static CommandRegistry defaults() {
        Map<String, RedisCommand> commands = new HashMap<>();
        registerGenericCommands(commands);
        registerStringCommands(commands);
        registerHashCommands(commands);

        CommandRegistry registry = new CommandRegistry(commands);
        log.info("CommandRegistry initialized. Total commands registered: {}", registry.size());
        return registry;
    }

    private static void registerGenericCommands(Map<String, RedisCommand> commands) {
        commands.put("PING", new PingCommand());
        commands.put("ECHO", new EchoCommand());
    }

    private static void registerStringCommands(Map<String, RedisCommand> commands) {
        commands.put("SET", new SetCommand());
        commands.put("GET", new GetCommand());
    }

    private static void registerHashCommands(Map<String, RedisCommand> commands) {
        commands.put("HSET", new HSetCommand());
        commands.put("HGET", new HGetCommand());
        commands.put("HGETALL", new HGetAllCommand());
    }

    /**
     * @param upperName 已经转为大写的命令名
     * @return 处理器；未注册时返回 null
     */
    public RedisCommand lookup(String upperName) {
        return commandMap.get(upperName);
    }

    public int size() {
        return commandMap.size();
    }
}
