package mstate.cluster;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;

/** Collects the events logged to one logger while attached. */
class LogCapture extends AppenderSkeleton implements AutoCloseable {

	private final Logger logger;
	private final List<LoggingEvent> events = new ArrayList<LoggingEvent>();

	LogCapture(Class<?> clazz) {
		this.logger = Logger.getLogger(clazz);
		this.logger.addAppender(this);
	}

	@Override
	protected synchronized void append(LoggingEvent event) {
		events.add(event);
	}

	synchronized boolean hasWarning(String fragment) {
		for(LoggingEvent e : events)
			if(e.getLevel().equals(Level.WARN) &&
					String.valueOf(e.getMessage()).contains(fragment)) return true;
		return false;
	}

	@Override
	public void close() {
		logger.removeAppender(this);
	}

	@Override
	public boolean requiresLayout() {
		return false;
	}
}
