package configstore.application.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class LogConfig {
    /**
     * Quiets everything below WARNING, unless verbose output was asked for.
     */
    public static void init(final boolean verbose) {
        final Level level = verbose ? Level.INFO : Level.WARNING;
        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(level);
        for (final Handler h : rootLogger.getHandlers()) {
            h.setLevel(level);
        }
    }
}
