package com.skillgate.common.delivery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryContextTest {

    @Test
    void normalizeTrimsAndLowercasesKnownChannels() {
        DeliveryContext normalized = DeliveryContext.normalize(
                new DeliveryContext(" Telegram ", " 42 ", "", null, " 7338489031 ", "  "));

        assertEquals(new DeliveryContext("telegram", "42", null, null, "7338489031", null), normalized);
    }

    @Test
    void unknownChannelKeepsCase() {
        assertEquals("MyBridge", DeliveryContext.normalize(DeliveryContext.of(" MyBridge ", "1")).channel());
    }

    @Test
    void normalizeEmptyIsNull() {
        assertNull(DeliveryContext.normalize(new DeliveryContext(" ", null, "", null, null, "")));
        assertNull(DeliveryContext.normalize(null));
    }

    @Test
    void mergePrefersPrimary() {
        DeliveryContext merged = DeliveryContext.merge(
                new DeliveryContext("discord", null, null, "thread-1", null, null),
                new DeliveryContext("telegram", "chat-9", "bot", null, "55", "Ana"));

        assertEquals(new DeliveryContext("discord", "chat-9", "bot", "thread-1", "55", "Ana"), merged);
        assertEquals(DeliveryContext.of("slack", "1"), DeliveryContext.merge(null, DeliveryContext.of("slack", "1")));
    }

    @Test
    void userIdentity() {
        assertEquals("telegram_7338489031", DeliveryContext.of("telegram", "7338489031").userIdentity());
        assertNull(DeliveryContext.of("telegram", " ").userIdentity());
        assertNull(DeliveryContext.of(null, "1").userIdentity());
    }

    @Test
    void routingKey() {
        assertEquals("telegram|chat|bot|",
                DeliveryContext.key(new DeliveryContext("telegram", "chat", "bot", null, null, null)));
        assertNull(DeliveryContext.key(DeliveryContext.of("telegram", "1")));
    }
}
