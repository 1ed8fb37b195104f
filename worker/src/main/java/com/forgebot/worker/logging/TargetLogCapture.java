package com.forgebot.worker.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Collects every log line emitted while one Target is processed.
 *
 * Opening a capture puts {@code targetId} into the MDC and attaches an
 * appender to the root logger that keeps only events carrying that id.
 * Closing it detaches the appender and removes the MDC key. Use with
 * try-with-resources on the thread that processes the Target:
 * <pre>
 *   try (TargetLogCapture capture = TargetLogCapture.start(target.getId())) {
 *       ...
 *       stateMachine.finish(target, capture.logs());
 *   }
 * </pre>
 * When Logback is not the SLF4J backend the capture only manages the MDC
 * key and {@link #logs()} returns an empty string.
 */
public final class TargetLogCapture implements AutoCloseable {

    public static final String MDC_KEY = "targetId";

    private static final String PATTERN = "%d{ISO8601} %-5level %logger{36} - %msg%n";

    private final Buffer buffer;
    private final Logger root;

    private TargetLogCapture(Buffer buffer, Logger root) {
        this.buffer = buffer;
        this.root   = root;
    }

    public static TargetLogCapture start(UUID targetId) {
        String id = String.valueOf(targetId);
        MDC.put(MDC_KEY, id);

        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return new TargetLogCapture(null, null);
        }

        PatternLayout layout = new PatternLayout();
        layout.setContext(context);
        layout.setPattern(PATTERN);
        layout.start();

        Buffer buffer = new Buffer(id, layout);
        buffer.setContext(context);
        buffer.setName("target-" + id);
        buffer.start();

        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.addAppender(buffer);
        return new TargetLogCapture(buffer, root);
    }

    /** Lines captured so far. */
    public String logs() {
        return buffer == null ? "" : buffer.contents();
    }

    @Override
    public void close() {
        if (buffer != null) {
            root.detachAppender(buffer);
            buffer.stop();
        }
        MDC.remove(MDC_KEY);
    }

    private static final class Buffer extends AppenderBase<ILoggingEvent> {

        private final String        targetId;
        private final PatternLayout layout;
        private final StringBuilder lines = new StringBuilder();

        Buffer(String targetId, PatternLayout layout) {
            this.targetId = targetId;
            this.layout   = layout;
        }

        // doAppend() is synchronized, so append() never runs concurrently
        @Override
        protected void append(ILoggingEvent event) {
            if (targetId.equals(event.getMDCPropertyMap().get(MDC_KEY))) {
                lines.append(layout.doLayout(event));
            }
        }

        synchronized String contents() {
            return lines.toString();
        }
    }
}
