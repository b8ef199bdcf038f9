package com.elssolution.unlockwatch.integration.telegram;

import com.elssolution.unlockwatch.service.CommandService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Long-polls {@code getUpdates} and routes chat commands to {@link CommandService}.
 * Replies go back to the chat the command came from.
 */
@Slf4j
@Component
public class TelegramCommandPoller {

    private final TelegramChannel channel;
    private final CommandService commands;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    @Value("${telegram.commands.enabled:true}")          private boolean enabled;
    @Value("${telegram.commands.pollTimeoutSeconds:25}") private int pollTimeoutSeconds;

    /** Next update id to ask for; everything below it is acknowledged. */
    private volatile long offset = 0;

    public TelegramCommandPoller(TelegramChannel channel, CommandService commands, ScheduledExecutorService scheduler) {
        this.channel = channel;
        this.commands = commands;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("Telegram command polling disabled");
            return;
        }
        if (pollTimeoutSeconds < 0) pollTimeoutSeconds = 0;
        scheduler.scheduleWithFixedDelay(this::pollOnceSafe, 2, 1, TimeUnit.SECONDS);
        log.info("Telegram command polling started: longPoll={}s", pollTimeoutSeconds);
    }

    private void pollOnceSafe() {
        try {
            pollOnce();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("getUpdates failed: {}", e.toString());
        }
    }

    /** One long-poll round trip. Returns how many updates were consumed. */
    int pollOnce() throws IOException, InterruptedException {
        String allowed = URLEncoder.encode("[\"message\"]", StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(channel.methodUrl("getUpdates")
                        + "?timeout=" + pollTimeoutSeconds
                        + "&offset=" + offset
                        + "&allowed_updates=" + allowed))
                .timeout(Duration.ofSeconds(pollTimeoutSeconds + 10L))
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            log.warn("getUpdates HTTP {}: {}", resp.statusCode(), resp.body());
            return 0;
        }
        return handleUpdates(objectMapper.readTree(resp.body()));
    }

    int handleUpdates(JsonNode root) {
        if (root == null || !root.path("ok").asBoolean(false)) return 0;
        int n = 0;
        for (JsonNode update : root.path("result")) {
            long id = update.path("update_id").asLong(-1);
            if (id >= offset) offset = id + 1;
            n++;

            JsonNode message = update.path("message");
            String text = message.path("text").asText(null);
            JsonNode chat = message.path("chat").path("id");
            if (text == null || chat.isMissingNode()) continue;

            String chatId = chat.asText();
            try {
                CommandService.Reply reply = commands.handle(chatId, text);
                if (reply == null) continue;
                if (reply.markdown()) channel.send(chatId, reply.text());
                else                  channel.reply(chatId, reply.text());
            } catch (RuntimeException e) {
                // one bad command must not block the rest of the batch
                log.warn("Command '{}' from chat {} failed: {}", text, chatId, e.toString());
            }
        }
        return n;
    }

    long offset() { return offset; }
}
