package com.lucidreview.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReviewAgentPropertiesTest {

    @Test
    void testUnsetModelIdFollowsProvider() {
        ReviewAgentProperties properties = new ReviewAgentProperties();

        assertEquals("gpt-4o", properties.getModelId());
        properties.setAiProvider(ReviewAgentProperties.AiProvider.GOOGLE);
        assertEquals("gemini-2.5-flash", properties.getModelId());
        properties.setModelId("");
        assertEquals("gemini-2.5-flash", properties.getModelId());
    }

    @Test
    void testExplicitModelIdWins() {
        ReviewAgentProperties properties = new ReviewAgentProperties();
        properties.setAiProvider(ReviewAgentProperties.AiProvider.GOOGLE);
        properties.setModelId("gemini-2.5-pro");

        assertEquals("gemini-2.5-pro", properties.getModelId());
    }

    @Test
    void testQueueDefaults() {
        ReviewAgentProperties.QueueConfig queue = new ReviewAgentProperties().getQueue();

        assertEquals(2, queue.getAttempts());
        assertEquals(30, queue.getLockDuration().toSeconds());
        assertEquals(ReviewAgentProperties.QueueBackend.REDIS, queue.getBackend());
    }
}
