package org.muma.tinyredis.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程工厂与管理工具
 */
public final class ThreadUtils {

    private static final Logger log = LoggerFactory.getLogger(ThreadUtils.class);

    private ThreadUtils() {
    }

    /**
     * 后台守护线程工厂，线程名形如 prefix-1, prefix-2
     */
    public static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true); // 默认后台线程，防止阻塞 JVM 关闭
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Uncaught exception in thread {}", thread.getName(), e));
            return t;
        };
    }
}
