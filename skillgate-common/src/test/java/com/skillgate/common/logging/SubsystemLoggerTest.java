package com.skillgate.common.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    private final ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            // capture MDC while the subsystem key is still set
            event.prepareForDeferredProcessing();
            super.append(event);
        }
    };
    private Logger skillsLogger;

    @BeforeEach
    void attach() {
        skillsLogger = (Logger) LoggerFactory.getLogger("skillgate.skills");
        appender.start();
        skillsLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        skillsLogger.detachAppender(appender);
    }

    @Test
    void formatsMetadata() {
        SubsystemLogger log = SubsystemLogger.create("skills");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("skillName", "chef");
        meta.put("count", 3);

        assertEquals("[skills] tool excluded {skillName=chef, count=3}", log.formatMessage("tool excluded", meta));
        assertEquals("[skills] plain", log.formatMessage("plain", Map.of()));
    }

    @Test
    void emitsWithSubsystemMdc() {
        SubsystemLogger.create("skills").warn("excluded", Map.of("toolName", "exec"));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals("[skills] excluded {toolName=exec}", event.getFormattedMessage());
        assertEquals("skills", event.getMDCPropertyMap().get("subsystem"));
    }

    @Test
    void childLoggerNestsName() {
        SubsystemLogger child = SubsystemLogger.create("skills").child("tier");
        assertEquals("skills/tier", child.getSubsystem());

        child.info("resolved");
        // child events reach the parent logger through additivity
        assertEquals("[skills/tier] resolved", appender.list.get(0).getFormattedMessage());
        assertEquals("skillgate.skills.tier", appender.list.get(0).getLoggerName());
    }

    @Test
    void traceIsDroppedBelowLoggerLevel() {
        SubsystemLogger log = SubsystemLogger.create("skills");
        log.trace("hidden");
        log.debug("shown");

        assertEquals(1, appender.list.size());
        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
        assertEquals("[skills] shown", appender.list.get(0).getFormattedMessage());
    }
}
