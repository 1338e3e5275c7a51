package ca.gc.cra.cadence.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cadence.application.query.TrackQuery;
import ca.gc.cra.cadence.testutil.RecordingMetricsPort;
import ca.gc.cra.cadence.testutil.ScriptedResolver;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingPipelineListenerTest {
  private Logger logger;
  private Level previousLevel;
  private ListAppender<ILoggingEvent> appender;
  private RecordingMetricsPort metrics;
  private LoggingPipelineListener listener;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingPipelineListener.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    metrics = new RecordingMetricsPort();
    listener = new LoggingPipelineListener(metrics);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
  }

  @Test
  void logsResolverRegistrationWithWeightAndTimeout() {
    ScriptedResolver resolver = new ScriptedResolver("local", 42, Duration.ofMillis(1500));

    listener.resolverAdded(resolver);
    listener.resolverRemoved(resolver);

    assertEquals(2, appender.list.size());
    String added = appender.list.get(0).getFormattedMessage();
    assertTrue(added.contains("type=resolverAdded"), added);
    assertTrue(added.contains("resolver=local"), added);
    assertTrue(added.contains("weight=42"), added);
    assertTrue(added.contains("timeoutMs=1500"), added);
    assertEquals(1, metrics.count("pipelineEvents.resolverAdded"));
    assertEquals(1, metrics.count("pipelineEvents.resolverRemoved"));
  }

  @Test
  void logsDispatchAtDebugWithCurrentResolver() {
    TrackQuery query = TrackQuery.of("Portishead", "Roads", null);
    query.setCurrentResolver(new ScriptedResolver("web", 5));

    listener.resolving(query);

    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.DEBUG, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("query=" + query.id()));
    assertTrue(event.getFormattedMessage().contains("resolver=web"));
    assertTrue(event.getFormattedMessage().contains("attempt=1"));
  }

  @Test
  void countsIdleUnderCustomPrefix() {
    LoggingPipelineListener custom = new LoggingPipelineListener(metrics, "  search  ");
    custom.idle();
    listener.idle();

    assertEquals(1, metrics.count("search.idle"));
    assertEquals(1, metrics.count("pipelineEvents.idle"));
    assertEquals(Level.INFO, appender.list.get(0).getLevel());
  }
}
