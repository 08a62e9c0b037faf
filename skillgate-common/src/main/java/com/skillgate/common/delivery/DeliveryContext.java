package com.skillgate.common.delivery;

import java.util.Locale;
import java.util.Set;

/**
 * Where a session's replies are delivered and who sent the triggering
 * message. {@code channel} + {@code senderId} form the platform identity used
 * for user tier resolution and per-user skill memory.
 *
 * @param channel    messaging channel id (telegram, discord, ...)
 * @param to         delivery target on that channel
 * @param accountId  bot/account id when a channel has several
 * @param threadId   thread or topic id
 * @param senderId   platform id of the sender
 * @param senderName display name of the sender
 */
public record DeliveryContext(
        String channel,
        String to,
        String accountId,
        String threadId,
        String senderId,
        String senderName) {

    private static final Set<String> KNOWN_CHANNELS = Set.of(
            "telegram", "whatsapp", "discord", "slack", "signal",
            "imessage", "googlechat", "msteams", "webchat");

    public static DeliveryContext of(String channel, String senderId) {
        return new DeliveryContext(channel, null, null, null, senderId, null);
    }

    /**
     * Trim every field, blank to null, and canonicalize known channel ids to
     * lower case. Returns null when nothing is left.
     */
    public static DeliveryContext normalize(DeliveryContext context) {
        if (context == null)
            return null;
        String channel = normalizeChannel(context.channel());
        String to = clean(context.to());
        String accountId = clean(context.accountId());
        String threadId = clean(context.threadId());
        String senderId = clean(context.senderId());
        String senderName = clean(context.senderName());
        if (channel == null && to == null && accountId == null && threadId == null
                && senderId == null && senderName == null) {
            return null;
        }
        return new DeliveryContext(channel, to, accountId, threadId, senderId, senderName);
    }

    /**
     * Field-wise merge, preferring {@code primary}.
     */
    public static DeliveryContext merge(DeliveryContext primary, DeliveryContext fallback) {
        DeliveryContext p = normalize(primary);
        DeliveryContext f = normalize(fallback);
        if (p == null)
            return f;
        if (f == null)
            return p;
        return normalize(new DeliveryContext(
                firstNonNull(p.channel(), f.channel()),
                firstNonNull(p.to(), f.to()),
                firstNonNull(p.accountId(), f.accountId()),
                firstNonNull(p.threadId(), f.threadId()),
                firstNonNull(p.senderId(), f.senderId()),
                firstNonNull(p.senderName(), f.senderName())));
    }

    /**
     * Routing key {@code channel|to|accountId|threadId}, or null without a
     * channel and target.
     */
    public static String key(DeliveryContext context) {
        DeliveryContext n = normalize(context);
        if (n == null || n.channel() == null || n.to() == null)
            return null;
        return n.channel() + "|" + n.to() + "|"
                + (n.accountId() != null ? n.accountId() : "") + "|"
                + (n.threadId() != null ? n.threadId() : "");
    }

    /**
     * Platform identity {@code {channel}_{senderId}}, or null when either part
     * is missing.
     */
    public String userIdentity() {
        String c = clean(channel);
        String s = clean(senderId);
        if (c == null || s == null)
            return null;
        return c + "_" + s;
    }

    private static String normalizeChannel(String raw) {
        String trimmed = clean(raw);
        if (trimmed == null)
            return null;
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return KNOWN_CHANNELS.contains(lower) ? lower : trimmed;
    }

    private static String clean(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
