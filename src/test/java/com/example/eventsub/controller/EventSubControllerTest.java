package com.example.eventsub.controller;

import com.example.eventsub.model.EnrollmentResult;
import com.example.eventsub.model.EventSubTypes;
import com.example.eventsub.service.ConduitResolver;
import com.example.eventsub.service.EnrollmentService;
import com.example.eventsub.service.SubscriptionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EventSubController.class)
class EventSubControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConduitResolver conduitResolver;

    @MockBean
    private SubscriptionService subscriptionService;

    @MockBean
    private EnrollmentService enrollmentService;

    @Test
    void conduitStatusReportsHealth() throws Exception {
        when(conduitResolver.getConduitId()).thenReturn(Optional.of("c-1"));
        when(conduitResolver.isConfigured()).thenReturn(true);
        when(conduitResolver.getCallbackUrl()).thenReturn(URI.create("https://bot.example.com/api/eventsub/callback"));

        mockMvc.perform(get("/api/eventsub/conduit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conduitId").value("c-1"))
                .andExpect(jsonPath("$.healthy").value(true))
                .andExpect(jsonPath("$.callbackUrl").value("https://bot.example.com/api/eventsub/callback"));
    }

    @Test
    void failedConduitCreationIsBadGateway() throws Exception {
        when(conduitResolver.createConduit()).thenReturn(false);

        mockMvc.perform(post("/api/eventsub/conduit"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.created").value(false));
    }

    @Test
    void enrollReturnsOutcome() throws Exception {
        when(enrollmentService.enroll(eq("123"), same(EventSubTypes.CHANNEL_CHAT_MESSAGE), anyMap()))
                .thenReturn(EnrollmentResult.subscribed(EventSubTypes.CHANNEL_CHAT_MESSAGE));

        mockMvc.perform(post("/api/eventsub/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"123\",\"type\":\"channel.chat.message\",\"condition\":{\"broadcaster_user_id\":\"123\",\"user_id\":\"999\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SUBSCRIBED"));

        verify(enrollmentService).enroll("123", EventSubTypes.CHANNEL_CHAT_MESSAGE,
                Map.of("broadcaster_user_id", "123", "user_id", "999"));
    }

    @Test
    void ineligibleEnrollmentIsUnprocessable() throws Exception {
        when(enrollmentService.enroll(anyString(), any(), anyMap()))
                .thenReturn(EnrollmentResult.ineligible(EventSubTypes.CHANNEL_BAN));

        mockMvc.perform(post("/api/eventsub/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"123\",\"type\":\"channel.ban\",\"condition\":{\"broadcaster_user_id\":\"123\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.outcome").value("INELIGIBLE"));
    }

    @Test
    void unknownTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/eventsub/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"123\",\"type\":\"channel.nope\",\"condition\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown subscription type: channel.nope"));

        verifyNoInteractions(enrollmentService);
    }

    @Test
    void subscriptionLookupPassesUser() throws Exception {
        when(subscriptionService.isSubscribed(EventSubTypes.STREAM_ONLINE, "123")).thenReturn(true);

        mockMvc.perform(get("/api/eventsub/subscriptions").param("type", "stream.online").param("userId", "123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscribed").value(true));
    }
}
