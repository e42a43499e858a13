package com.example.eventsub.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConduitMaintenanceTaskTest {

    @Mock
    private ConduitResolver conduitResolver;

    @InjectMocks
    private ConduitMaintenanceTask task;

    @Test
    void createsConduitWhenNoneCached() {
        when(conduitResolver.isConfigured()).thenReturn(false);
        when(conduitResolver.createConduit()).thenReturn(true);

        task.checkConduit();

        verify(conduitResolver).createConduit();
        verify(conduitResolver, never()).getConduitId();
    }

    @Test
    void healthyConduitIsLeftAlone() {
        when(conduitResolver.isConfigured()).thenReturn(true);
        when(conduitResolver.getConduitId()).thenReturn(Optional.of("c-1"));

        task.checkConduit();

        verify(conduitResolver, never()).createConduit();
    }

    @Test
    void unusableConduitIsNotRecreatedAutomatically() {
        when(conduitResolver.isConfigured()).thenReturn(true);
        when(conduitResolver.getConduitId()).thenReturn(Optional.empty());
        when(conduitResolver.getCallbackUrl()).thenReturn(URI.create("https://bot.example.com/api/eventsub/callback"));

        task.checkConduit();

        verify(conduitResolver, never()).createConduit();
    }

    @Test
    void unexpectedErrorDoesNotEscapeScheduler() {
        when(conduitResolver.isConfigured()).thenThrow(new IllegalStateException("redis down"));

        assertDoesNotThrow(() -> task.checkConduit());
    }
}
