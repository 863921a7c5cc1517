package com.deepansh.foundry.resilience;

import com.deepansh.foundry.runtime.ConversationRuntime;
import com.deepansh.foundry.runtime.FoundryServerException;
import com.deepansh.foundry.runtime.RunState;
import com.deepansh.foundry.runtime.RunStatus;
import com.deepansh.foundry.runtime.ToolOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilientConversationRuntimeTest {

    @Mock ConversationRuntime delegate;

    @InjectMocks
    ResilientConversationRuntime runtime;

    @Test
    void getRun_delegates() {
        RunState state = RunState.builder().id("r").threadId("t").status(RunStatus.IN_PROGRESS).build();
        when(delegate.getRun("t", "r")).thenReturn(state);

        assertThat(runtime.getRun("t", "r")).isSameAs(state);
    }

    @Test
    void submitToolOutputs_passesThroughUnchanged() {
        List<ToolOutput> outputs = List.of(new ToolOutput("call_1", "{}"));

        runtime.submitToolOutputs("t", "r", outputs);

        verify(delegate).submitToolOutputs("t", "r", outputs);
    }

    @Test
    void listMessages_failurePropagates() {
        when(delegate.listMessages("t")).thenThrow(new FoundryServerException(503, "Foundry listMessages failed [503]"));

        assertThatThrownBy(() -> runtime.listMessages("t"))
                .isInstanceOf(FoundryServerException.class);
    }
}
