package com.deepansh.router.model;

public record TextBlock(String text) implements ContentBlock {

    public TextBlock {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
    }
}
