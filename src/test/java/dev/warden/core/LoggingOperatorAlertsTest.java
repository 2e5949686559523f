/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.warden.api.ErrorCode;
import dev.warden.util.TokenBucketRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingOperatorAlertsTest {
  private Logger wardenLogger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setup() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    wardenLogger = context.getLogger("warden");
    appender = new ListAppender<>();
    appender.start();
    wardenLogger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    wardenLogger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void burstsAreRateLimitedButAlwaysCounted() {
    Metrics metrics = new Metrics(false);
    OperatorAlerts alerts =
        new LoggingOperatorAlerts(new TokenBucketRateLimiter(1, 0.001), metrics);

    for (int i = 0; i < 5; i++) {
      alerts.alert(ErrorCode.EFFECT_FAILED, "mute.expire", "provider down");
    }

    assertEquals(1, alertLines());
    assertEquals(5L, metrics.alerts(ErrorCode.EFFECT_FAILED));
  }

  @Test
  void distinctOperationsAreLimitedSeparately() {
    Metrics metrics = new Metrics(false);
    OperatorAlerts alerts =
        new LoggingOperatorAlerts(new TokenBucketRateLimiter(1, 0.001), metrics);

    alerts.alert(ErrorCode.EFFECT_FAILED, "mute.expire", "a");
    alerts.alert(ErrorCode.EFFECT_FAILED, "ban.expire", "b");
    alerts.alert(ErrorCode.INCONSISTENT_RECORD, "mute.expire", "c");

    assertEquals(3, alertLines());
  }

  @Test
  void failuresWithCauseAreLoggedAsErrors() {
    OperatorAlerts alerts =
        new LoggingOperatorAlerts(new TokenBucketRateLimiter(5, 1.0), new Metrics(false));

    alerts.alert(
        ErrorCode.CONNECTION_LOST, "mute.issue", "store down", new IllegalStateException("boom"));

    ILoggingEvent event = appender.list.get(appender.list.size() - 1);
    assertEquals(Level.ERROR, event.getLevel());
    assertNotNull(event.getThrowableProxy());
    assertTrue(event.getFormattedMessage().contains("code=CONNECTION_LOST"));
    assertTrue(event.getFormattedMessage().contains("op=mute.issue"));
  }

  private long alertLines() {
    return appender.list.stream()
        .filter(e -> e.getFormattedMessage().startsWith("(warden) ALERT"))
        .count();
  }
}
