package com.deepansh.foundry.model;

import com.deepansh.foundry.core.ToolCallRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String response;

    @Builder.Default
    private List<Citation> citations = new ArrayList<>();

    private String threadId;
    private String runId;
    private String agentId;

    @Builder.Default
    private List<ToolCallRecord> toolCalls = new ArrayList<>();
}
