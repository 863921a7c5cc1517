package com.deepansh.foundry.core;

import com.deepansh.foundry.model.Citation;

import java.util.List;

public record ExtractedResponse(String text, List<Citation> citations) {

    public static final ExtractedResponse EMPTY = new ExtractedResponse("", List.of());

    public ExtractedResponse {
        citations = citations != null ? List.copyOf(citations) : List.of();
    }
}
