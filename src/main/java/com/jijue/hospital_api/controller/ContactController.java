package com.jijue.hospital_api.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.dto.ChatMessageRequest;
import com.jijue.hospital_api.dto.ContactMessageRequest;
import com.jijue.hospital_api.model.ContactSubmission;
import com.jijue.hospital_api.service.ChatService;
import com.jijue.hospital_api.service.ContactService;

import jakarta.servlet.http.HttpServletRequest;

@RestController
@RequestMapping("/api/contact")
public class ContactController {

    private static final Logger logger = LoggerFactory.getLogger(ContactController.class);

    private final ContactService contactService;
    private final ChatService chatService;

    public ContactController(ContactService contactService, ChatService chatService) {
        this.contactService = contactService;
        this.chatService = chatService;
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> getContactInfo() {
        return ResponseEntity.ok(Map.of("success", true, "data", contactService.getContactInfo()));
    }

    @PostMapping("/submit")
    public ResponseEntity<Map<String, Object>> submit(@RequestBody ContactMessageRequest request,
                                                      HttpServletRequest servletRequest) {
        ContactSubmission saved = contactService.submit(request, servletRequest.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", ContactService.THANK_YOU,
                "data", Map.of("id", saved.getId())));
    }

    @GetMapping("/submissions")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> getSubmissions(@RequestParam(required = false) String status) {
        List<ContactSubmission> submissions = contactService.getSubmissions(status);
        return ResponseEntity.ok(Map.of("success", true, "count", submissions.size(), "data", submissions));
    }

    @PatchMapping("/submissions/{id}/status")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> updateSubmissionStatus(@PathVariable String id,
                                                                      @RequestBody Map<String, String> body) {
        ContactSubmission updated = contactService.updateStatus(id, body.get("status"));
        return ResponseEntity.ok(Map.of("success", true, "message", "Status updated", "data", updated));
    }

    @GetMapping("/chat/status")
    public ResponseEntity<Map<String, Object>> getChatStatus() {
        return ResponseEntity.ok(Map.of("success", true, "data", chatService.getStatus()));
    }

    @PostMapping("/chat/message")
    public ResponseEntity<Map<String, Object>> sendChatMessage(@RequestBody ChatMessageRequest request) {
        logger.debug("Chat message received");
        return ResponseEntity.ok(Map.of("success", true, "data", chatService.reply(request.message())));
    }
}
