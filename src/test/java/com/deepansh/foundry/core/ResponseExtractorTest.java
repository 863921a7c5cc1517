package com.deepansh.foundry.core;

import com.deepansh.foundry.model.Citation;
import com.deepansh.foundry.runtime.MessageAnnotation;
import com.deepansh.foundry.runtime.MessageContent;
import com.deepansh.foundry.runtime.ThreadMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseExtractorTest {

    private final ResponseExtractor extractor = new ResponseExtractor();

    @Test
    void extract_takesNewestAssistantMessageAndJoinsTextItems() {
        List<ThreadMessage> messages = List.of(
                new ThreadMessage("m3", ThreadMessage.Role.ASSISTANT, "r2", List.of(
                        MessageContent.text("First part"),
                        new MessageContent("image_file", null, List.of()),
                        MessageContent.text("Second part"))),
                new ThreadMessage("m2", ThreadMessage.Role.USER, null, List.of(MessageContent.text("question"))),
                new ThreadMessage("m1", ThreadMessage.Role.ASSISTANT, "r1", List.of(MessageContent.text("old answer"))));

        ExtractedResponse response = extractor.extract(messages);

        assertThat(response.text()).isEqualTo("First part\nSecond part");
    }

    @Test
    void extract_collectsUrlCitationsInOrderWithoutDedup() {
        MessageAnnotation repo = new MessageAnnotation(MessageAnnotation.URL_CITATION, "hello", "https://github.com/octo/hello");
        MessageAnnotation filePath = new MessageAnnotation("file_path", null, null);
        MessageAnnotation docs = new MessageAnnotation(MessageAnnotation.URL_CITATION, null, "https://docs.github.com");

        List<ThreadMessage> messages = List.of(new ThreadMessage("m1", ThreadMessage.Role.ASSISTANT, "r", List.of(
                MessageContent.text("a", repo, filePath),
                MessageContent.text("b", docs, repo))));

        ExtractedResponse response = extractor.extract(messages);

        assertThat(response.citations()).containsExactly(
                new Citation("hello", "https://github.com/octo/hello"),
                new Citation("", "https://docs.github.com"),
                new Citation("hello", "https://github.com/octo/hello"));
    }

    @Test
    void extract_noAssistantMessage_isEmpty() {
        ExtractedResponse response = extractor.extract(List.of(
                new ThreadMessage("m1", ThreadMessage.Role.USER, null, List.of(MessageContent.text("hi")))));

        assertThat(response.text()).isEmpty();
        assertThat(response.citations()).isEmpty();
        assertThat(extractor.extract(null)).isEqualTo(ExtractedResponse.EMPTY);
    }

    @Test
    void extract_sameInputTwice_sameOutput() {
        List<ThreadMessage> messages = List.of(new ThreadMessage("m1", ThreadMessage.Role.ASSISTANT, "r", List.of(
                MessageContent.text("answer",
                        new MessageAnnotation(MessageAnnotation.URL_CITATION, "t", "https://github.com/a/b")))));

        assertThat(extractor.extract(messages)).isEqualTo(extractor.extract(messages));
    }
}
