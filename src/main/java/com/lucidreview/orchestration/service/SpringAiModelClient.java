package com.lucidreview.orchestration.service;

import com.lucidreview.orchestration.api.ModelClient;
import com.lucidreview.orchestration.model.ContentBlock;
import com.lucidreview.orchestration.model.ConversationMessage;
import com.lucidreview.orchestration.model.ModelRequest;
import com.lucidreview.orchestration.model.ModelResponse;
import com.lucidreview.orchestration.model.ModelToolSpec;
import com.lucidreview.orchestration.model.StopReason;
import com.lucidreview.orchestration.model.TextBlock;
import com.lucidreview.orchestration.model.TokenUsage;
import com.lucidreview.orchestration.model.ToolContent;
import com.lucidreview.orchestration.model.ToolResultBlock;
import com.lucidreview.orchestration.model.ToolUseBlock;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * {@link ModelClient} backed by a Spring AI {@link ChatModel}. Tools are declared to the model
 * but never executed by Spring AI: the run loop executes them itself so every call is persisted.
 */
public class SpringAiModelClient implements ModelClient {

    private final ChatModel chatModel;
    private final JsonProcessingService jsonProcessingService;
    private final int maxTokens;
    private final double temperature;

    public SpringAiModelClient(ChatModel chatModel, JsonProcessingService jsonProcessingService,
                               int maxTokens, double temperature) {
        this.chatModel = chatModel;
        this.jsonProcessingService = jsonProcessingService;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public ModelResponse converse(ModelRequest request) {
        Prompt prompt = new Prompt(toMessages(request), toOptions(request));
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException ex) {
            throw new ModelInvocationException("Model call failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.getResult() == null) {
            throw new ModelInvocationException("Model returned no result", null);
        }
        return toModelResponse(response);
    }

    List<Message> toMessages(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(request.systemPrompt()));
        for (ConversationMessage message : request.messages()) {
            if (message.role() == ConversationMessage.Role.ASSISTANT) {
                messages.add(toAssistantMessage(message.content()));
            } else {
                messages.addAll(toUserMessages(message.content()));
            }
        }
        return messages;
    }

    private AssistantMessage toAssistantMessage(List<ContentBlock> blocks) {
        StringBuilder text = new StringBuilder();
        List<AssistantMessage.ToolCall> toolCalls = new ArrayList<>();
        for (ContentBlock block : blocks) {
            if (block instanceof TextBlock textBlock) {
                text.append(textBlock.text());
            } else if (block instanceof ToolUseBlock toolUse) {
                toolCalls.add(new AssistantMessage.ToolCall(toolUse.toolUseId(), "function",
                        toolUse.name(), jsonProcessingService.toJson(toolUse.input())));
            }
        }
        return AssistantMessage.builder()
                .content(text.toString())
                .toolCalls(toolCalls)
                .build();
    }

    private List<Message> toUserMessages(List<ContentBlock> blocks) {
        List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (ContentBlock block : blocks) {
            if (block instanceof ToolResultBlock result) {
                responses.add(new ToolResponseMessage.ToolResponse(result.toolUseId(), result.toolName(),
                        renderToolResult(result)));
            } else if (block instanceof TextBlock textBlock) {
                text.append(textBlock.text());
            }
        }
        List<Message> messages = new ArrayList<>();
        if (!responses.isEmpty()) {
            messages.add(ToolResponseMessage.builder().responses(responses).build());
        }
        if (!text.isEmpty()) {
            messages.add(new UserMessage(text.toString()));
        }
        return messages;
    }

    private String renderToolResult(ToolResultBlock result) {
        String text = result.content().stream()
                .map(ToolContent::text)
                .filter(StringUtils::hasText)
                .collect(Collectors.joining("\n"));
        return result.error() ? "Tool error: " + text : text;
    }

    private ToolCallingChatOptions toOptions(ModelRequest request) {
        List<ToolCallback> callbacks = request.tools().stream()
                .map(DeclaredTool::new)
                .map(ToolCallback.class::cast)
                .toList();
        return ToolCallingChatOptions.builder()
                .model(request.modelId())
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }

    ModelResponse toModelResponse(ChatResponse response) {
        Generation generation = response.getResult();
        AssistantMessage output = generation.getOutput();
        List<ContentBlock> content = new ArrayList<>();
        if (StringUtils.hasText(output.getText())) {
            content.add(new TextBlock(output.getText()));
        }
        for (AssistantMessage.ToolCall toolCall : output.getToolCalls()) {
            content.add(new ToolUseBlock(toolCall.id(), toolCall.name(),
                    jsonProcessingService.readObject(toolCall.arguments())));
        }
        String finishReason = generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null;
        return new ModelResponse(content, stopReason(output.hasToolCalls(), finishReason), usage(response));
    }

    static StopReason stopReason(boolean hasToolCalls, String finishReason) {
        if (hasToolCalls) {
            return StopReason.TOOL_USE;
        }
        if (finishReason == null) {
            return StopReason.END_TURN;
        }
        return switch (finishReason.toUpperCase(Locale.ROOT)) {
            case "LENGTH", "MAX_TOKENS" -> StopReason.MAX_TOKENS;
            case "CONTENT_FILTER", "SAFETY" -> StopReason.CONTENT_FILTERED;
            default -> StopReason.END_TURN;
        };
    }

    private TokenUsage usage(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.ZERO;
        }
        Usage usage = response.getMetadata().getUsage();
        long input = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        long output = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        return new TokenUsage(input, output);
    }

    /**
     * Declares a tool to the model without giving Spring AI a way to run it.
     */
    private final class DeclaredTool implements ToolCallback {

        private final ToolDefinition definition;

        private DeclaredTool(ModelToolSpec spec) {
            this.definition = ToolDefinition.builder()
                    .name(spec.name())
                    .description(spec.description())
                    .inputSchema(jsonProcessingService.toJson(spec.inputSchema()))
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the run loop");
        }
    }
}
