package com.elssolution.unlockwatch.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders the unlock notification and hands it to the channel.
 * Both timestamps in the message come from the same instant, shown in the configured zone.
 */
@Slf4j
@Component
public class Notifier {

    /** Used when the zone database has no entry for the configured zone. */
    static final ZoneId FALLBACK_ZONE = ZoneOffset.ofHours(7);

    private static final DateTimeFormatter ISO_LIKE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    static final String LABEL_UNLOCKED = "Tài khoản đã mở khoá";
    static final String LABEL_BANNED = "Tài khoản bị cấm";

    private final NotificationChannel channel;
    private final ZoneId zone;
    private final int rawLimit;

    public Notifier(NotificationChannel channel,
                    @Value("${watch.notify.zone:Asia/Ho_Chi_Minh}") String zoneId,
                    @Value("${watch.notify.rawLimit:500}") int rawLimit) {
        this.channel = channel;
        this.zone = resolveZone(zoneId);
        this.rawLimit = Math.max(0, rawLimit);
    }

    public ZoneId zone() { return zone; }

    public String render(String account, boolean unlocked, Instant checkedAt) {
        return render(account, unlocked, checkedAt, null);
    }

    /** Same as {@link #render(String, boolean, Instant)} plus a raw payload block when {@code raw} is non-null. */
    public String render(String account, boolean unlocked, Instant checkedAt, String raw) {
        ZonedDateTime at = checkedAt.atZone(zone);
        StringBuilder msg = new StringBuilder()
                .append("🔔 *THÔNG BÁO*\n")
                .append("📝 *Nội dung:* 🔎 *KIỂM TRA GARENA*\n")
                .append("📛 *Tên tài khoản:* `").append(codeSafe(account)).append("`\n")
                .append("📌 *Trạng thái:* *").append(unlocked ? LABEL_UNLOCKED : LABEL_BANNED).append("*\n")
                .append("⏱️ `").append(ISO_LIKE.format(at)).append("`\n")
                .append("🕒 *Thời gian:* ").append(DAY_FIRST.format(at)).append("\n");
        if (raw != null && rawLimit > 0) {
            msg.append("```\n").append(truncate(raw.replace("```", "'''"), rawLimit)).append("\n```\n");
        }
        return msg.toString();
    }

    /** Never throws: a failing channel is reported in the result and the caller moves on. */
    public DeliveryResult deliver(String subscriberId, String message) {
        try {
            DeliveryResult r = channel.send(subscriberId, message);
            return r != null ? r : DeliveryResult.failed("channel returned no result");
        } catch (Exception e) {
            log.warn("Delivery to {} threw: {}", subscriberId, e.toString());
            return DeliveryResult.failed(e.toString());
        }
    }

    static ZoneId resolveZone(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) return FALLBACK_ZONE;
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            log.warn("Zone '{}' not available ({}), using {}", zoneId, e.getMessage(), FALLBACK_ZONE);
            return FALLBACK_ZONE;
        }
    }

    private static String codeSafe(String s) {
        return s == null ? "" : s.replace("`", "'");
    }

    private static String truncate(String s, int limit) {
        return s.length() <= limit ? s : s.substring(0, limit) + "…";
    }
}
