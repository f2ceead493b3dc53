package ca.gc.cra.dnstap.infrastructure.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dnstap.application.error.MalformedPayloadException;
import ca.gc.cra.dnstap.application.error.PublishFailedException;
import ca.gc.cra.dnstap.domain.dnstap.MessageType;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ErrorReportLoggerTest {
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level previousLevel;

  @BeforeEach
  void attach() {
    logger = (Logger) LoggerFactory.getLogger(ErrorReportLogger.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detach() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
  }

  @Test
  void logsPublishFailuresAtWarnAndPayloadFailuresAtDebug() throws Exception {
    BoundedErrorSink sink = new BoundedErrorSink(8);
    ErrorReportLogger reportLogger = new ErrorReportLogger(sink);
    sink.report(new PublishFailedException("dnstap.full", MessageType.CLIENT_QUERY, new IOException("down")));
    sink.report(new MalformedPayloadException("bad").withContext("dnstap.full", MessageType.AUTH_RESPONSE));
    reportLogger.close();

    assertEquals(2, appender.list.size());
    ILoggingEvent publish = appender.list.stream()
        .filter(e -> e.getLevel() == Level.WARN).findFirst().orElseThrow();
    assertTrue(publish.getFormattedMessage().contains("failed to post event, tag: dnstap.full"));
    ILoggingEvent payload = appender.list.stream()
        .filter(e -> e.getLevel() == Level.DEBUG).findFirst().orElseThrow();
    assertTrue(payload.getFormattedMessage().contains("AUTH_RESPONSE"));
    assertEquals(0, sink.size());
  }
}
