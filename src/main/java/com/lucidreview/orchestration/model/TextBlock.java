package com.lucidreview.orchestration.model;

public record TextBlock(
        String text
) implements ContentBlock {
}
