package com.questrail.gatt.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.error.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jGattObservabilitySinkTest
{
    private final Slf4jGattObservabilitySink sink = new Slf4jGattObservabilitySink();

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private boolean additive;

    @BeforeEach
    void attachAppender()
    {
        logger = (Logger) LoggerFactory.getLogger(Slf4jGattObservabilitySink.class);
        appender = new ListAppender<>();
        additive = logger.isAdditive();
        logger.setAdditive(false);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender()
    {
        logger.detachAppender(appender);
        logger.setAdditive(additive);
        appender.stop();
    }

    @Test
    void successfulLoadLogsSummaryAtInfo()
    {
        sink.onRegistryLoaded(new RegistryLoadEvent(Instant.now(), "classpath:x.yaml", 21, 9, 180, false));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals("GATT registry loaded from classpath:x.yaml: 21 characteristics, 9 decoders, 180 aliases",
                event.getFormattedMessage());
    }

    @Test
    void degradedLoadWarns()
    {
        sink.onRegistryLoaded(new RegistryLoadEvent(Instant.now(), "classpath:x.yaml", 9, 9, 70, true));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("WITHOUT specification data"));
    }

    @Test
    void decodeFailureNamesCharacteristicAndKind()
    {
        sink.onDecodeFailure(new DecodeFailureEvent(Instant.now(), CharacteristicUuid.ofShort(0x2A19),
                "Battery Level", ErrorKind.INSUFFICIENT_DATA, "need 1 bytes, got 0"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("GATT decode failed for 0x2A19 (Battery Level): INSUFFICIENT_DATA need 1 bytes, got 0",
                event.getFormattedMessage());
    }

    @Test
    void errorKeepsCause()
    {
        IOException cause = new IOException("gone");
        sink.onError(new GattErrorEvent(Instant.now(), "source unavailable", cause));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("GATT Error: source unavailable", event.getFormattedMessage());
        assertNotNull(event.getThrowableProxy());
        assertEquals("gone", event.getThrowableProxy().getMessage());
    }
}
