package traversal;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Single-line console logging for tests. Override the level with
 * -Djava.util.logging.ConsoleHandler.level=FINE to see per-case detail.
 */
final class LoggingControl {

    private LoggingControl() {
    }

    static void setupCleanLogging(final Level defaultLevel) {
        String logLevel = System.getProperty("java.util.logging.ConsoleHandler.level");
        Level level = (logLevel != null) ? Level.parse(logLevel) : defaultLevel;

        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level);
        consoleHandler.setFormatter(new Formatter() {
            @Override
            public String format(LogRecord record) {
                return record.getLevel() + " " + record.getLoggerName() + ": " + record.getMessage() + "\n";
            }
        });

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(level);
    }

    static void setupCleanLogging() {
        setupCleanLogging(Level.WARNING);
    }
}
