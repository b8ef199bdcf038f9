package com.elssolution.unlockwatch.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * File-backed store shared by the command handlers and the sweep.
 * Every call re-reads the file and every mutation is load → modify → save,
 * all under one lock, so a command and the sweep never lose each other's writes.
 */
@Slf4j
@Component
public class SubscriptionStore {

    private final Path path;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public SubscriptionStore(@Value("${watch.store.path:data.json}") String path) {
        this(Path.of(path));
    }

    public SubscriptionStore(Path path) {
        this.path = path.toAbsolutePath();
        log.info("Subscription store: {}", this.path);
    }

    public Path path() { return path; }

    // ---------------------- raw load / save ----------------------

    /** Current state as a private copy. Missing or unreadable file → empty defaults, never an exception. */
    public StoreState load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    /** Replaces the whole file atomically (temp file + rename). */
    public void save(StoreState state) {
        lock.lock();
        try {
            write(state);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------- subscribers ----------------------

    public void addAccount(String subscriberId, String account) {
        mutate(s -> {
            s.getSubscribers()
                    .computeIfAbsent(subscriberId, id -> new StoreState.Subscriber())
                    .getAccounts().add(account);
            return null;
        });
        log.info("Chat {} now tracks {}", subscriberId, account);
    }

    /** Removes every occurrence of the account from the chat. Returns false when nothing matched. */
    public boolean removeAccount(String subscriberId, String account) {
        lock.lock();
        try {
            StoreState s = read();
            StoreState.Subscriber sub = s.getSubscribers().get(subscriberId);
            if (sub == null || !sub.getAccounts().removeIf(account::equals)) return false;
            write(s);
        } finally {
            lock.unlock();
        }
        log.info("Chat {} stopped tracking {}", subscriberId, account);
        return true;
    }

    /** The chat's subscription, or a default one (no accounts, 5 min) if it never subscribed. */
    public StoreState.Subscriber list(String subscriberId) {
        StoreState.Subscriber sub = load().getSubscribers().get(subscriberId);
        return sub != null ? sub : new StoreState.Subscriber();
    }

    public void setInterval(String subscriberId, int minutes) {
        if (minutes < 1) throw new IllegalArgumentException("interval must be >= 1 minute, got " + minutes);
        mutate(s -> {
            s.getSubscribers()
                    .computeIfAbsent(subscriberId, id -> new StoreState.Subscriber())
                    .setIntervalMinutes(minutes);
            return null;
        });
    }

    // ---------------------- endpoint ----------------------

    public void setEndpointUrl(String url) {
        mutate(s -> { s.getEndpoint().setUrl(url == null ? "" : url.trim()); return null; });
        log.info("Status endpoint URL set to {}", url);
    }

    public void setEndpointToken(String token) {
        mutate(s -> { s.getEndpoint().setToken(token == null ? "" : token.trim()); return null; });
        log.info("Status endpoint token updated");
    }

    public void setIncludeRaw(boolean includeRaw) {
        mutate(s -> { s.setIncludeRaw(includeRaw); return null; });
    }

    // ---------------------- account state cache ----------------------

    public boolean isUnlocked(String account) {
        return load().isUnlocked(account);
    }

    public void markUnlocked(String account) {
        mutate(s -> { s.getAccountState().put(account, Boolean.TRUE); return null; });
    }

    /** Forgets that the account was notified, so the next unlocked probe fires again. */
    public boolean resetAccount(String account) {
        return mutate(s -> s.getAccountState().remove(account) != null);
    }

    public List<String> unlockedAccounts() {
        return load().getAccountState().entrySet().stream()
                .filter(e -> Boolean.TRUE.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }

    // ---------------------- internals ----------------------

    private <T> T mutate(Function<StoreState, T> change) {
        lock.lock();
        try {
            StoreState s = read();
            T result = change.apply(s);
            write(s);
            return result;
        } finally {
            lock.unlock();
        }
    }

    private StoreState read() {
        if (!Files.exists(path)) return StoreState.empty();
        try {
            StoreState s = objectMapper.readValue(path.toFile(), StoreState.class);
            return s == null ? StoreState.empty() : s.normalize();
        } catch (IOException | RuntimeException e) {
            log.warn("Store file {} unreadable, starting from defaults: {}", path, e.toString());
            return StoreState.empty();
        }
    }

    private void write(StoreState state) {
        Path dir = path.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreWriteException("Cannot write store file " + path, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Temp file {} left behind: {}", tmp, e.toString());
        }
    }
}
