package org.javai.commonmark.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Log4j2 appender that records what one logger writes, for assertions in tests.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender logs = LogCaptorAppender.capture(MentionParser.class)) {
 *     parser.parse("@nobody");
 *     assertThat(logs.messages(Level.DEBUG)).anyMatch(msg -> msg.contains("declined"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	public record CapturedEvent(Level level, String message) {
	}

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final Level previousLevel;
	private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, Level previousLevel) {
		super("LogCaptor-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.previousLevel = previousLevel;
	}

	/**
	 * Captures everything the logger of {@code loggerClass} writes at debug level and above.
	 */
	public static LogCaptorAppender capture(Class<?> loggerClass) {
		return capture(loggerClass, Level.DEBUG);
	}

	public static LogCaptorAppender capture(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		if (!loggerConfig.getName().equals(loggerName)) {
			loggerConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, loggerConfig);
		}

		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender(context, loggerConfig, previousLevel);
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(new CapturedEvent(event.getLevel(), event.getMessage().getFormattedMessage()));
	}

	public List<CapturedEvent> events() {
		return List.copyOf(events);
	}

	public List<String> messages() {
		return events.stream().map(CapturedEvent::message).toList();
	}

	public List<String> messages(Level level) {
		return events.stream()
				.filter(e -> e.level() == level)
				.map(CapturedEvent::message)
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		loggerConfig.setLevel(previousLevel);
		context.updateLoggers();
		events.clear();
	}
}
