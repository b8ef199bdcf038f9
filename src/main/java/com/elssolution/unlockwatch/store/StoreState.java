package com.elssolution.unlockwatch.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the bot persists: chats and their accounts, the shared endpoint
 * credentials, the "already notified as unlocked" cache and the raw-payload flag.
 * Field names on disk stay compatible with the bot's original data.json.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreState {

    public static final int DEFAULT_INTERVAL_MINUTES = 5;

    @JsonProperty("chats")
    private Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    @JsonProperty("api")
    private EndpointConfig endpoint = new EndpointConfig();

    /** account -> true once a notification went out; absent/false = not confirmed yet */
    @JsonProperty("last_seen_unlocked")
    private Map<String, Boolean> accountState = new LinkedHashMap<>();

    @JsonProperty("include_raw")
    private boolean includeRaw;

    public static StoreState empty() {
        return new StoreState();
    }

    /** Replaces nulls coming from a hand-edited file with empty defaults. */
    StoreState normalize() {
        if (subscribers == null) subscribers = new LinkedHashMap<>();
        if (endpoint == null) endpoint = new EndpointConfig();
        if (accountState == null) accountState = new LinkedHashMap<>();
        subscribers.values().removeIf(s -> s == null);
        subscribers.values().forEach(Subscriber::normalize);
        accountState.values().removeIf(v -> v == null);
        endpoint.normalize();
        return this;
    }

    public StoreState copy() {
        StoreState c = new StoreState();
        subscribers.forEach((id, s) -> c.subscribers.put(id, s.copy()));
        c.endpoint = endpoint.copy();
        c.accountState = new LinkedHashMap<>(accountState);
        c.includeRaw = includeRaw;
        return c;
    }

    @JsonIgnore
    public boolean isUnlocked(String account) {
        return Boolean.TRUE.equals(accountState.get(account));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Subscriber {
        private List<String> accounts = new ArrayList<>();

        @JsonProperty("interval_min")
        private int intervalMinutes = DEFAULT_INTERVAL_MINUTES;

        void normalize() {
            if (accounts == null) accounts = new ArrayList<>();
            accounts.removeIf(a -> a == null || a.isBlank());
            if (intervalMinutes < 1) intervalMinutes = DEFAULT_INTERVAL_MINUTES;
        }

        public Subscriber copy() {
            return new Subscriber(new ArrayList<>(accounts), intervalMinutes);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EndpointConfig {
        private String url = "";
        private String token = "";

        void normalize() {
            if (url == null) url = "";
            if (token == null) token = "";
        }

        /** Both the URL and the bearer token are needed before any probe goes out. */
        @JsonIgnore
        public boolean isConfigured() {
            return url != null && !url.isBlank() && token != null && !token.isBlank();
        }

        public EndpointConfig copy() {
            return new EndpointConfig(url, token);
        }
    }
}
