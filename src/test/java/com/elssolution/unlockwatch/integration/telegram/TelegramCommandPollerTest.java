package com.elssolution.unlockwatch.integration.telegram;

import com.elssolution.unlockwatch.service.CommandService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TelegramCommandPollerTest {

    TelegramChannel channel;
    CommandService commands;
    TelegramCommandPoller poller;
    ObjectMapper json = new ObjectMapper();

    @BeforeEach
    void setUp() {
        channel = mock(TelegramChannel.class);
        commands = mock(CommandService.class);
        poller = new TelegramCommandPoller(channel, commands, mock(ScheduledExecutorService.class));
    }

    private JsonNode updates(String body) throws Exception {
        return json.readTree(body);
    }

    @Test
    void replies_to_the_chat_and_advances_offset() throws Exception {
        when(commands.handle("1001", "/list")).thenReturn(new CommandService.Reply("Đang theo dõi:", false));
        when(commands.handle("1001", "/testnotify x")).thenReturn(new CommandService.Reply("*md*", true));

        int n = poller.handleUpdates(updates("{\"ok\":true,\"result\":["
                + "{\"update_id\":10,\"message\":{\"chat\":{\"id\":1001},\"text\":\"/list\"}},"
                + "{\"update_id\":11,\"message\":{\"chat\":{\"id\":1001},\"text\":\"/testnotify x\"}}]}"));

        assertThat(n).isEqualTo(2);
        assertThat(poller.offset()).isEqualTo(12);
        verify(channel).reply("1001", "Đang theo dõi:");
        verify(channel).send("1001", "*md*");
    }

    @Test
    void updates_without_text_or_reply_are_acknowledged_silently() throws Exception {
        when(commands.handle(anyString(), anyString())).thenReturn(null);

        poller.handleUpdates(updates("{\"ok\":true,\"result\":["
                + "{\"update_id\":5,\"message\":{\"chat\":{\"id\":7}}},"
                + "{\"update_id\":6,\"message\":{\"chat\":{\"id\":7},\"text\":\"hi\"}}]}"));

        assertThat(poller.offset()).isEqualTo(7);
        verifyNoInteractions(channel);
    }

    @Test
    void failing_command_does_not_block_the_batch() throws Exception {
        when(commands.handle("1", "/add a")).thenThrow(new IllegalStateException("boom"));
        when(commands.handle("2", "/add b")).thenReturn(new CommandService.Reply("Đã thêm: b", false));

        poller.handleUpdates(updates("{\"ok\":true,\"result\":["
                + "{\"update_id\":1,\"message\":{\"chat\":{\"id\":1},\"text\":\"/add a\"}},"
                + "{\"update_id\":2,\"message\":{\"chat\":{\"id\":2},\"text\":\"/add b\"}}]}"));

        verify(channel).reply("2", "Đã thêm: b");
        assertThat(poller.offset()).isEqualTo(3);
    }

    @Test
    void not_ok_response_is_ignored() throws Exception {
        assertThat(poller.handleUpdates(updates("{\"ok\":false,\"description\":\"Unauthorized\"}"))).isZero();
        assertThat(poller.offset()).isZero();
        verifyNoInteractions(commands);
    }
}
