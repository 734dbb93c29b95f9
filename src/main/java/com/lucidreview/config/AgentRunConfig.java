package com.lucidreview.config;

import com.lucidreview.orchestration.api.ModelClient;
import com.lucidreview.orchestration.service.JsonProcessingService;
import com.lucidreview.orchestration.service.SpringAiModelClient;
import com.lucidreview.queue.AgentJobHandler;
import com.lucidreview.queue.AgentJobWorker;
import com.lucidreview.queue.InMemoryJobQueue;
import com.lucidreview.queue.JobFailureHook;
import com.lucidreview.queue.JobQueue;
import com.lucidreview.queue.JobRetryPolicy;
import com.lucidreview.queue.RedisJobQueue;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class AgentRunConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModelClient modelClient(ReviewAgentProperties properties,
                                   ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
                                   ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider,
                                   JsonProcessingService jsonProcessingService) {
        ChatModel chatModel = switch (properties.getAiProvider()) {
            case OPENAI -> openAiChatModelProvider.getIfAvailable();
            case GOOGLE -> googleGenAiChatModelProvider.getIfAvailable();
        };
        if (chatModel == null) {
            throw new IllegalStateException(properties.getAiProvider() + " provider is not properly configured. "
                    + "Check that you have a valid API key or a custom Base URL in your configuration.");
        }
        return new SpringAiModelClient(chatModel, jsonProcessingService,
                properties.getMaxTokens(), properties.getTemperature());
    }

    @Bean
    public JobQueue jobQueue(ReviewAgentProperties properties,
                             ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                             JsonProcessingService jsonProcessingService,
                             Clock clock) {
        ReviewAgentProperties.QueueConfig queue = properties.getQueue();
        if (queue.getBackend() == ReviewAgentProperties.QueueBackend.MEMORY) {
            return new InMemoryJobQueue(queue.getRemoveOnComplete(), queue.getRemoveOnFail(),
                    queue.getLockDuration(), clock);
        }
        return new RedisJobQueue(redisTemplateProvider.getObject(), jsonProcessingService, queue.getName(),
                queue.getRemoveOnComplete(), queue.getRemoveOnFail(), queue.getLockDuration(), clock);
    }

    @Bean
    public JobRetryPolicy jobRetryPolicy(ReviewAgentProperties properties) {
        return new JobRetryPolicy(properties.getQueue().getAttempts(), properties.getQueue().getBackoff());
    }

    @Bean
    public AgentJobWorker agentJobWorker(JobQueue jobQueue,
                                         AgentJobHandler jobHandler,
                                         JobFailureHook failureHook,
                                         JobRetryPolicy retryPolicy,
                                         ReviewAgentProperties properties) {
        return new AgentJobWorker(jobQueue, jobHandler, failureHook, retryPolicy, properties.getQueue());
    }
}
