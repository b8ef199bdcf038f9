package com.elssolution.unlockwatch.service;

import com.elssolution.unlockwatch.notify.Notifier;
import com.elssolution.unlockwatch.store.StoreState;
import com.elssolution.unlockwatch.store.StoreWriteException;
import com.elssolution.unlockwatch.store.SubscriptionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Chat commands. Each one is a synchronous read-modify-write against the store
 * and returns the text to send back to the chat that asked.
 */
@Slf4j
@Service
public class CommandService {

    static final String HELP = "Bot kiểm tra Garena, các lệnh:\n"
            + "/add <account>\n/remove <account>\n/list\n/interval <phút>\n"
            + "/setapi <url>\n/settoken <bearer_token>\n/testnotify <account>\n"
            + "/reset <account>\n/raw on|off";

    static final String STORE_FAILED = "Lỗi lưu dữ liệu, thử lại sau.";

    private final SubscriptionStore store;
    private final Notifier notifier;
    private final Clock clock;

    public CommandService(SubscriptionStore store, Notifier notifier, Clock clock) {
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
    }

    /** A reply to the chat; {@code markdown} replies go out with Telegram Markdown parsing. */
    public record Reply(String text, boolean markdown) {
        static Reply plain(String text) { return new Reply(text, false); }
        static Reply markdown(String text) { return new Reply(text, true); }
    }

    /**
     * Dispatches one chat message. Returns null for anything that is not a known command.
     * Accepts the "/cmd@BotName" form Telegram uses in groups.
     */
    public Reply handle(String chatId, String text) {
        if (text == null || !text.startsWith("/")) return null;
        String[] parts = text.trim().split("\\s+");
        String command = parts[0].substring(1).toLowerCase(Locale.ROOT);
        int at = command.indexOf('@');
        if (at >= 0) command = command.substring(0, at);
        List<String> args = Arrays.asList(parts).subList(1, parts.length);

        try {
            return switch (command) {
                case "start", "help" -> Reply.plain(HELP);
                case "add" -> add(chatId, args);
                case "remove" -> remove(chatId, args);
                case "list" -> list(chatId);
                case "interval" -> interval(chatId, args);
                case "setapi" -> setApi(args);
                case "settoken" -> setToken(args);
                case "testnotify" -> testNotify(args);
                case "reset" -> reset(args);
                case "raw" -> raw(args);
                default -> null;
            };
        } catch (StoreWriteException e) {
            log.warn("Command /{} from chat {} not saved: {}", command, chatId, e.toString());
            return Reply.plain(STORE_FAILED);
        }
    }

    private Reply add(String chatId, List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /add <account>");
        String account = args.get(0).trim();
        store.addAccount(chatId, account);
        return Reply.plain("Đã thêm: " + account);
    }

    private Reply remove(String chatId, List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /remove <account>");
        String account = args.get(0).trim();
        return store.removeAccount(chatId, account)
                ? Reply.plain("Đã xoá: " + account)
                : Reply.plain("Không có trong danh sách: " + account);
    }

    private Reply list(String chatId) {
        StoreState state = store.load();
        StoreState.Subscriber sub = state.getSubscribers().getOrDefault(chatId, new StoreState.Subscriber());
        String rows = sub.getAccounts().isEmpty()
                ? "- (trống)"
                : sub.getAccounts().stream().map(a -> "- " + a).collect(Collectors.joining("\n"));
        String apiUrl = state.getEndpoint().getUrl().isBlank() ? "(chưa đặt)" : state.getEndpoint().getUrl();
        return Reply.plain("Đang theo dõi:\n" + rows
                + "\nChu kỳ: " + sub.getIntervalMinutes() + " phút"
                + "\nAPI: " + apiUrl);
    }

    private Reply interval(String chatId, List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /interval <phút>");
        int minutes;
        try {
            minutes = Integer.parseInt(args.get(0).trim());
        } catch (NumberFormatException e) {
            minutes = 0;
        }
        if (minutes < 1) return Reply.plain("Chu kỳ phải là số nguyên ≥ 1");
        store.setInterval(chatId, minutes);
        return Reply.plain("Đã đặt chu kỳ: " + minutes + " phút");
    }

    private Reply setApi(List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /setapi <url>");
        String url = args.get(0).trim();
        store.setEndpointUrl(url);
        return Reply.plain("Đã lưu API URL: " + url);
    }

    private Reply setToken(List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /settoken <token>");
        store.setEndpointToken(args.get(0).trim());
        return Reply.plain("Đã lưu Bearer token.");
    }

    private Reply testNotify(List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /testnotify <account>");
        return Reply.markdown(notifier.render(args.get(0).trim(), true, clock.instant()));
    }

    private Reply reset(List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /reset <account>");
        String account = args.get(0).trim();
        return store.resetAccount(account)
                ? Reply.plain("Đã đặt lại trạng thái: " + account)
                : Reply.plain("Chưa có trạng thái cho: " + account);
    }

    private Reply raw(List<String> args) {
        if (args.isEmpty()) return Reply.plain("Dùng: /raw on|off");
        String v = args.get(0).trim().toLowerCase(Locale.ROOT);
        boolean on;
        if (v.equals("on")) on = true;
        else if (v.equals("off")) on = false;
        else return Reply.plain("Dùng: /raw on|off");
        store.setIncludeRaw(on);
        return Reply.plain("Đính kèm dữ liệu thô: " + (on ? "bật" : "tắt"));
    }
}
