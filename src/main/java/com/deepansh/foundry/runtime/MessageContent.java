package com.deepansh.foundry.runtime;

import java.util.List;

/** One content item of a thread message. Non-text items have a null text. */
public record MessageContent(String type, String text, List<MessageAnnotation> annotations) {

    public static final String TEXT = "text";

    public MessageContent {
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
    }

    public static MessageContent text(String text, MessageAnnotation... annotations) {
        return new MessageContent(TEXT, text, List.of(annotations));
    }

    public boolean isText() {
        return TEXT.equals(type) && text != null;
    }
}
