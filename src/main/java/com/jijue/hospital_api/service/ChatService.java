package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.ChatReply;
import com.jijue.hospital_api.dto.ChatStatus;

/**
 * Keyword-driven replies for the website chat widget.
 */
@Service
public class ChatService {

    private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

    static final String BUSINESS_HOURS = "8 AM - 6 PM";
    static final String DEFAULT_REPLY = "Thank you for your message. Our support team will get back to you soon.";

    private record Rule(List<String> keywords, String reply) {
        boolean matches(String message) {
            return keywords.stream().anyMatch(message::contains);
        }
    }

    // First matching rule wins
    private static final List<Rule> RULES = List.of(
            new Rule(List.of("emergency", "urgent"),
                    "For emergencies, please call our emergency line immediately: +254115947353"),
            new Rule(List.of("appointment", "book"),
                    "To book an appointment, please visit our patient portal or call our reception at +254115947353"),
            new Rule(List.of("hours", "open"),
                    "We are open Monday-Friday: 8am-6pm, Saturday: 9am-1pm. Emergency services are available 24/7."),
            new Rule(List.of("location", "address"),
                    "We are located at Health Street, Nairobi City, Kenya. You can get directions on Google Maps."));

    private final Clock clock;

    public ChatService(Clock clock) {
        this.clock = clock;
    }

    public ChatStatus getStatus() {
        int hour = LocalTime.now(clock).getHour();
        boolean open = hour >= 8 && hour < 18;
        return new ChatStatus(open,
                open ? "Chat is available" : "Chat is available during business hours (" + BUSINESS_HOURS + ")",
                BUSINESS_HOURS);
    }

    public ChatReply reply(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message is required");
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        String reply = RULES.stream()
                .filter(rule -> rule.matches(normalized))
                .map(Rule::reply)
                .findFirst()
                .orElse(DEFAULT_REPLY);
        logger.debug("Chat message answered ({} chars)", message.length());
        return new ChatReply(reply, clock.instant());
    }
}
