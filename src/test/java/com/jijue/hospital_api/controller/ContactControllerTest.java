package com.jijue.hospital_api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.jijue.hospital_api.dto.ChatReply;
import com.jijue.hospital_api.dto.ContactMessageRequest;
import com.jijue.hospital_api.exception.GlobalExceptionHandler;
import com.jijue.hospital_api.model.ContactInfo;
import com.jijue.hospital_api.model.ContactSubmission;
import com.jijue.hospital_api.service.ChatService;
import com.jijue.hospital_api.service.ContactService;

@ExtendWith(MockitoExtension.class)
class ContactControllerTest {

    @Mock
    private ContactService contactService;
    @Mock
    private ChatService chatService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ContactController(contactService, chatService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void infoFallsBackToDefaults() throws Exception {
        when(contactService.getContactInfo()).thenReturn(ContactInfo.defaults());

        mockMvc.perform(get("/api/contact/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.email").value("info@jijuehospital.com"));
    }

    @Test
    void submissionIsAcknowledged() throws Exception {
        ContactSubmission saved = new ContactSubmission();
        saved.setId("c-1");
        when(contactService.submit(any(ContactMessageRequest.class), anyString())).thenReturn(saved);

        mockMvc.perform(post("/api/contact/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Peter","email":"peter@example.com","subject":"Visiting hours","message":"When?"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value(ContactService.THANK_YOU))
                .andExpect(jsonPath("$.data.id").value("c-1"));
    }

    @Test
    void incompleteSubmissionIsBadRequest() throws Exception {
        when(contactService.submit(any(ContactMessageRequest.class), anyString()))
                .thenThrow(new IllegalArgumentException("Please fill in all required fields"));

        mockMvc.perform(post("/api/contact/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Peter\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Please fill in all required fields"));
    }

    @Test
    void chatMessageGetsReply() throws Exception {
        when(chatService.reply("where is the hospital address?"))
                .thenReturn(new ChatReply("We are located at Health Street", Instant.parse("2024-06-10T06:00:00Z")));

        mockMvc.perform(post("/api/contact/chat/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"where is the hospital address?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.response").value("We are located at Health Street"));
    }
}
