package com.elssolution.unlockwatch.integration.telegram;

import com.elssolution.unlockwatch.notify.DeliveryResult;
import com.elssolution.unlockwatch.notify.NotificationChannel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Telegram Bot API {@code sendMessage}: delivers notifications (Markdown) and command replies (plain text).
 * The bot token is mandatory; the application refuses to start without it.
 */
@Slf4j
@Component
public class TelegramChannel implements NotificationChannel {

    @Value("${telegram.botToken:}")                    private String botToken;
    @Value("${telegram.apiBase:https://api.telegram.org}") private String apiBase;

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    @PostConstruct
    void init() {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalStateException("telegram.botToken (TG_BOT_TOKEN) is not set");
        }
        log.info("Telegram channel ready: api={}", apiBase);
    }

    /** Full URL of a Bot API method, e.g. {@code sendMessage}. */
    String methodUrl(String method) {
        String base = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        return base + "/bot" + botToken + "/" + method;
    }

    @Override
    public DeliveryResult send(String chatId, String markdownText) {
        return sendOne(chatId, markdownText, true);
    }

    public DeliveryResult reply(String chatId, String plainText) {
        return sendOne(chatId, plainText, false);
    }

    private DeliveryResult sendOne(String chatId, String text, boolean markdown) {
        try {
            String body = "chat_id=" + url(chatId)
                    + (markdown ? "&parse_mode=Markdown" : "")
                    + "&text=" + url(text);
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(methodUrl("sendMessage")))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .timeout(Duration.ofSeconds(20))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                log.warn("Telegram send failed ({}): {}", resp.statusCode(), resp.body());
                return DeliveryResult.failed("HTTP " + resp.statusCode() + ": " + resp.body());
            }
            log.info("Telegram sent to {} ({})", chatId, resp.statusCode());
            return DeliveryResult.delivered();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted");
        } catch (Exception e) {
            log.warn("Telegram send exception to {}: {}", chatId, e.toString());
            return DeliveryResult.failed(e.toString());
        }
    }

    private static String url(String s) { return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8); }
}
