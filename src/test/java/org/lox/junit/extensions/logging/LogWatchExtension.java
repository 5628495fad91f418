package org.lox.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs a WARN or ERROR event that is not permitted by an {@link AllowLog}
 * on the test method or class.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<AllowLog> allows = new ArrayList<>();
        context.getTestClass().ifPresent(c -> allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class))));
        context.getTestMethod().ifPresent(m -> allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class))));

        List<String> unexpected = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (allows.stream().noneMatch(a -> permits(a, event))) {
                unexpected.add(String.format("[%s] %s - %s", event.level, event.loggerName, event.message));
            }
        }
        if (!unexpected.isEmpty()) {
            throw new AssertionError("Unexpected logs:\n  " + String.join("\n  ", unexpected));
        }
    }

    private static boolean permits(AllowLog allow, CapturedEvent event) {
        return event.level.isGreaterOrEqual(toLogback(allow.level()))
                && Pattern.matches(allow.loggerPattern(), event.loggerName)
                && Pattern.matches(allow.messagePattern(), event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Turbo filters also see disabled-level checks with a null format; only record real events.
            if (format != null && level.isGreaterOrEqual(Level.WARN)) {
                events.add(new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage()));
            }
            return FilterReply.NEUTRAL;
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {}
}
