package org.opensearch.snapshotmanager.testutils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.errorprone.annotations.MustBeClosed;
import lombok.Getter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;

/**
 * Captures the formatted messages and levels logged to one logger.  Use in a try-with-resources block.
 */
public class CloseableLogSetup implements AutoCloseable {

    @Getter
    List<String> logEvents = Collections.synchronizedList(new ArrayList<>());

    @Getter
    List<Level> logLevels = Collections.synchronizedList(new ArrayList<>());

    AbstractAppender testAppender;

    org.apache.logging.log4j.core.Logger internalLogger;

    @MustBeClosed
    public CloseableLogSetup(String loggerName) {
        testAppender = new AbstractAppender(loggerName, null, null, false, null) {
            @Override
            public void append(LogEvent event) {
                logEvents.add(event.getMessage().getFormattedMessage());
                logLevels.add(event.getLevel());
            }
        };
        testAppender.start();

        internalLogger = (org.apache.logging.log4j.core.Logger) LogManager.getLogger(loggerName);
        internalLogger.setLevel(Level.ALL);
        internalLogger.setAdditive(false);
        internalLogger.addAppender(testAppender);
    }

    public boolean contains(String message) {
        synchronized (logEvents) {
            return logEvents.contains(message);
        }
    }

    @Override
    public void close() {
        internalLogger.removeAppender(testAppender);
        testAppender.stop();
    }
}
