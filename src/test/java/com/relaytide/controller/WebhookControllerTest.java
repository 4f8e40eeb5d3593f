package com.relaytide.controller;

import com.relaytide.dto.CalendarPushNotification;
import com.relaytide.dto.GmailPushNotification;
import com.relaytide.dto.WebhookResponse;
import com.relaytide.service.MalformedNotificationException;
import com.relaytide.service.WebhookIntakeService;
import com.relaytide.service.WebhookVerificationException;
import com.relaytide.service.WebhookVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    private static final String GMAIL_BODY = "{\"message\": {"
            + "\"data\": \"eyJlbWFpbEFkZHJlc3MiOiJvd25lckBleGFtcGxlLmNvbSIsImhpc3RvcnlJZCI6IjEyMzQifQ==\", "
            + "\"messageId\": \"psm-1\"}, "
            + "\"subscription\": \"projects/p/subscriptions/gmail\"}";

    @Mock private WebhookIntakeService intakeService;
    @Mock private WebhookVerifier webhookVerifier;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(intakeService, webhookVerifier))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Gmail push is verified, handed off and answered with 200")
    void gmail_ok() throws Exception {
        UUID recordId = UUID.randomUUID();
        when(intakeService.handleGmail(any(GmailPushNotification.class))).thenReturn(WebhookResponse.builder()
                .received(true).processed(true).ingestionRecordId(recordId).entitiesCreated(1).build());

        mockMvc.perform(post("/api/webhooks/gmail").param("token", "t")
                        .contentType(MediaType.APPLICATION_JSON).content(GMAIL_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(true))
                .andExpect(jsonPath("$.entitiesCreated").value(1))
                .andExpect(jsonPath("$.ingestionRecordId").value(recordId.toString()));

        verify(webhookVerifier).verifyMailToken("t");
    }

    @Test
    @DisplayName("Gmail push without message data is a 400")
    void gmail_missingData_badRequest() throws Exception {
        mockMvc.perform(post("/api/webhooks/gmail")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"message\": {\"messageId\": \"1\"}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(intakeService);
    }

    @Test
    @DisplayName("Bad verification token is a 401")
    void gmail_badToken_unauthorized() throws Exception {
        doThrow(new WebhookVerificationException("Invalid verification token"))
                .when(webhookVerifier).verifyMailToken("wrong");

        mockMvc.perform(post("/api/webhooks/gmail").param("token", "wrong")
                        .contentType(MediaType.APPLICATION_JSON).content(GMAIL_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401));

        verifyNoInteractions(intakeService);
    }

    @Test
    @DisplayName("Calendar headers are mapped onto the notification")
    void calendar_headersMapped() throws Exception {
        when(intakeService.handleCalendar(any())).thenReturn(WebhookResponse.notProcessed("Unknown channel chan-1"));

        mockMvc.perform(post("/api/webhooks/calendar")
                        .header("X-Goog-Channel-ID", "chan-1")
                        .header("X-Goog-Resource-ID", "res-1")
                        .header("X-Goog-Resource-State", "exists")
                        .header("X-Goog-Message-Number", "7")
                        .header("X-Goog-Channel-Token", "secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(false));

        ArgumentCaptor<CalendarPushNotification> captor = ArgumentCaptor.forClass(CalendarPushNotification.class);
        verify(intakeService).handleCalendar(captor.capture());
        assertEquals("chan-1", captor.getValue().getChannelId());
        assertEquals("res-1", captor.getValue().getResourceId());
        assertEquals("exists", captor.getValue().getResourceState());
        assertEquals("7", captor.getValue().getMessageNumber());
        assertEquals("secret", captor.getValue().getChannelToken());
    }

    @Test
    @DisplayName("Calendar push missing required fields is a 400")
    void calendar_malformed_badRequest() throws Exception {
        when(intakeService.handleCalendar(any()))
                .thenThrow(new MalformedNotificationException("Calendar notification needs channelId"));

        mockMvc.perform(post("/api/webhooks/calendar"))
                .andExpect(status().isBadRequest());
    }
}
