package com.lagoonlang.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 日志配置：根 logger 只保留一个输出到 stderr 的 handler，stdout 留给编译输出。
 */
final class LoggingSetup {

    private LoggingSetup() {}

    static void configure(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.INFO;
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }
}
