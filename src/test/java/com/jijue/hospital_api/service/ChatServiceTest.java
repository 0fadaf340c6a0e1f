package com.jijue.hospital_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;

import com.jijue.hospital_api.dto.ChatStatus;

class ChatServiceTest {

    private static final ZoneId NAIROBI = ZoneId.of("Africa/Nairobi");

    private static ChatService at(String instant) {
        return new ChatService(Clock.fixed(Instant.parse(instant), NAIROBI));
    }

    @Test
    void chatIsOpenDuringBusinessHours() {
        // 09:00 local
        ChatStatus open = at("2024-06-10T06:00:00Z").getStatus();
        assertThat(open.chatAvailable()).isTrue();
        assertThat(open.message()).isEqualTo("Chat is available");

        // 18:00 local
        ChatStatus closed = at("2024-06-10T15:00:00Z").getStatus();
        assertThat(closed.chatAvailable()).isFalse();
        assertThat(closed.message()).isEqualTo("Chat is available during business hours (8 AM - 6 PM)");
    }

    @Test
    void firstMatchingKeywordWins() {
        ChatService chat = at("2024-06-10T06:00:00Z");

        assertThat(chat.reply("URGENT: I need to book an appointment").response()).startsWith("For emergencies");
        assertThat(chat.reply("How do I book?").response()).startsWith("To book an appointment");
        assertThat(chat.reply("When are you open").response()).startsWith("We are open");
        assertThat(chat.reply("What is your address").response()).startsWith("We are located");
        assertThat(chat.reply("hello").response()).isEqualTo(ChatService.DEFAULT_REPLY);
    }

    @Test
    void blankMessageIsRejected() {
        assertThatThrownBy(() -> at("2024-06-10T06:00:00Z").reply("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Message is required");
    }
}
