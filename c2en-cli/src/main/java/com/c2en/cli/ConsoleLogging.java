package com.c2en.cli;

import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

/**
 * 命令行日志配置：把 com.c2en 下的日志以 {@code [INFO] 消息} 的形式写到错误流
 */
final class ConsoleLogging {

    private static final String ROOT_LOGGER = "com.c2en";

    /** 持有引用，避免 Logger 被回收后配置丢失 */
    private static final Logger ROOT = Logger.getLogger(ROOT_LOGGER);

    private ConsoleLogging() {}

    /**
     * 安装处理器。verbose 时输出 FINE 及以上，否则只输出 WARNING 及以上。
     */
    static void install(PrintStream err, boolean verbose) {
        for (Handler handler : ROOT.getHandlers()) {
            ROOT.removeHandler(handler);
            handler.close();
        }
        Level level = verbose ? Level.FINE : Level.WARNING;
        Handler handler = err == System.err ? new ConsoleHandler() : new FlushingStreamHandler(err);
        handler.setFormatter(new LevelPrefixFormatter());
        handler.setLevel(level);
        ROOT.addHandler(handler);
        ROOT.setLevel(level);
        ROOT.setUseParentHandlers(false);
    }

    /** FINE 及以下显示为 INFO，其余按级别名显示 */
    static final class LevelPrefixFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String label = record.getLevel().intValue() <= Level.INFO.intValue()
                    ? "INFO"
                    : record.getLevel().intValue() >= Level.SEVERE.intValue() ? "ERROR" : "WARNING";
            return "[" + label + "] " + formatMessage(record) + System.lineSeparator();
        }
    }

    private static final class FlushingStreamHandler extends StreamHandler {
        FlushingStreamHandler(PrintStream stream) {
            super(stream, new LevelPrefixFormatter());
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }

        @Override
        public synchronized void close() {
            // 不关闭外部传入的流
            flush();
        }
    }
}
