package com.deepansh.foundry.core;

import com.deepansh.foundry.model.Citation;
import com.deepansh.foundry.runtime.MessageAnnotation;
import com.deepansh.foundry.runtime.MessageContent;
import com.deepansh.foundry.runtime.ThreadMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the answer out of a finished thread.
 *
 * Takes the newest assistant message, joins its text items with a newline and
 * collects every url_citation annotation in encounter order (duplicates kept).
 * Stateless; the same input always yields the same output.
 */
@Component
public class ResponseExtractor {

    public ExtractedResponse extract(List<ThreadMessage> newestFirst) {
        if (newestFirst == null) {
            return ExtractedResponse.EMPTY;
        }
        return newestFirst.stream()
                .filter(m -> m.role() == ThreadMessage.Role.ASSISTANT)
                .findFirst()
                .map(this::fromMessage)
                .orElse(ExtractedResponse.EMPTY);
    }

    private ExtractedResponse fromMessage(ThreadMessage message) {
        List<String> texts = new ArrayList<>();
        List<Citation> citations = new ArrayList<>();

        for (MessageContent content : message.content()) {
            if (!content.isText()) {
                continue;
            }
            texts.add(content.text());
            for (MessageAnnotation annotation : content.annotations()) {
                if (annotation.isUrlCitation() && annotation.url() != null) {
                    citations.add(new Citation(annotation.title() != null ? annotation.title() : "", annotation.url()));
                }
            }
        }
        return new ExtractedResponse(String.join("\n", texts), citations);
    }
}
