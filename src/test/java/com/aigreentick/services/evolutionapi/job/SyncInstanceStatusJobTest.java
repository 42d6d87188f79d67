package com.aigreentick.services.evolutionapi.job;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncInstanceStatusJobTest {

    @Test
    void testExtractState_PrefersNestedInstanceState() {
        assertEquals("open", SyncInstanceStatusJob.extractState(
                Map.of("instance", Map.of("instanceName", "sales", "state", "open"), "state", "close")));
    }

    @Test
    void testExtractState_FallsBackToTopLevelState() {
        assertEquals("close", SyncInstanceStatusJob.extractState(Map.of("state", "close")));
        assertEquals("connecting", SyncInstanceStatusJob.extractState(
                Map.of("instance", Map.of("instanceName", "sales"), "state", "connecting")));
    }

    @Test
    void testExtractState_WithoutState_ReturnsNull() {
        assertNull(SyncInstanceStatusJob.extractState(null));
        assertNull(SyncInstanceStatusJob.extractState(Map.of("instance", "sales")));
    }
}
