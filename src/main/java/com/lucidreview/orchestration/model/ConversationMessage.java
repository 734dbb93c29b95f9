package com.lucidreview.orchestration.model;

import java.util.List;

public record ConversationMessage(
        Role role,
        List<ContentBlock> content
) {

    public enum Role {
        USER, ASSISTANT
    }

    public ConversationMessage {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ConversationMessage user(String text) {
        return new ConversationMessage(Role.USER, List.of(new TextBlock(text)));
    }

    public static ConversationMessage user(List<? extends ContentBlock> blocks) {
        return new ConversationMessage(Role.USER, List.copyOf(blocks));
    }

    public static ConversationMessage assistant(List<ContentBlock> blocks) {
        return new ConversationMessage(Role.ASSISTANT, blocks);
    }
}
