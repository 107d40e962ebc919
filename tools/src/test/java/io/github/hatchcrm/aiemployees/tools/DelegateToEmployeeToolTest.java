package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationCoordinator;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationRequest;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationResult;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DelegateToEmployeeToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("tenant-1", "user-1", "session-1", "hatch-instance", 0);

    @Mock private DelegationCoordinator delegationCoordinator;
    @Mock private ConversationHistoryService conversationHistoryService;

    private DelegateToEmployeeTool tool;

    @BeforeEach
    void setUp() {
        tool = new DelegateToEmployeeTool();
        tool.setDelegationCoordinator(delegationCoordinator);
        tool.setConversationHistoryService(conversationHistoryService);
        when(conversationHistoryService.latestUserMessage(any(), any())).thenReturn(Optional.empty());
    }

    private static DelegationResult makeResult(String key, String name, String reply) {
        return new DelegationResult(key, name, key + "-instance", reply, null, null);
    }

    @Test
    void autoRunsWithLongTimeout() {
        assertThat(tool.allowAutoRun()).isTrue();
        assertThat(tool.defaultRequiresApproval()).isFalse();
        assertThat(tool.timeout()).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void delegatesWithExplicitPersonaAndMessage() {
        when(delegationCoordinator.delegate("Lumen", "Draft a text for Maya", CTX))
                .thenReturn(makeResult("lead_nurse", "Lumen", "Here is a draft."));

        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode()
                .put("persona", "Lumen").put("message", "Draft a text for Maya"));

        assertThat(result.success()).isTrue();
        JsonNode out = result.output();
        assertThat(out.path("personaKey").asText()).isEqualTo("lead_nurse");
        assertThat(out.path("reply").asText()).isEqualTo("Here is a draft.");
        assertThat(out.has("toolReplies")).isFalse();
        assertThat(out.has("error")).isFalse();
    }

    @Test
    void acceptsAlternateFieldNames() {
        when(delegationCoordinator.delegate(anyString(), anyString(), any()))
                .thenReturn(makeResult("market_analyst", "Atlas", "Prices are flat."));

        tool.execute(CTX, MAPPER.createObjectNode().put("employee", "market_analyst").put("instruction", "How is the market?"));

        verify(delegationCoordinator).delegate("market_analyst", "How is the market?", CTX);
    }

    @Test
    void fallsBackToLatestUserMessage() {
        when(conversationHistoryService.latestUserMessage("session-1", "hatch-instance"))
                .thenReturn(Optional.of("Ask Nova about closing dates"));
        when(delegationCoordinator.delegate(anyString(), anyString(), any()))
                .thenReturn(makeResult("transaction_coordinator", "Nova", "Two closings this week."));

        tool.execute(CTX, MAPPER.createObjectNode().put("persona", "Nova"));

        verify(delegationCoordinator).delegate("Nova", "Ask Nova about closing dates", CTX);
    }

    @Test
    void missingPersonaIsExtractedFromMessage() {
        when(delegationCoordinator.extractRequests("Echo: who is hot today?"))
                .thenReturn(List.of(new DelegationRequest("agent_copilot", "who is hot today?")));
        when(delegationCoordinator.delegate(anyString(), anyString(), any()))
                .thenReturn(makeResult("agent_copilot", "Echo", "Maya and Sam."));

        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("message", "Echo: who is hot today?"));

        assertThat(result.success()).isTrue();
        verify(delegationCoordinator).delegate("agent_copilot", "who is hot today?", CTX);
    }

    @Test
    void failsWhenNoPersonaCanBeFound() {
        when(delegationCoordinator.extractRequests(anyString())).thenReturn(List.of());

        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("message", "do something"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Missing persona for delegation");
    }

    @Test
    void failsWhenNoMessageAnywhere() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("persona", "Lumen"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Missing message for delegation");
        verify(delegationCoordinator, never()).delegate(any(), any(), any());
    }

    @Test
    void selfDelegationYieldsNullOutput() {
        when(delegationCoordinator.delegate(eq("Hatch"), anyString(), any())).thenReturn(null);

        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("persona", "Hatch").put("message", "hi"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().isNull()).isTrue();
    }

    @Test
    void coordinatorErrorsPropagate() {
        when(delegationCoordinator.delegate(anyString(), anyString(), any()))
                .thenThrow(new BadRequestException("Unknown persona: Zed"));

        assertThatThrownBy(() -> tool.execute(CTX, MAPPER.createObjectNode().put("persona", "Zed").put("message", "hi")))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Unknown persona: Zed");
    }

    @Test
    void failsWithoutCoordinator() {
        ToolResult result = new DelegateToEmployeeTool().execute(CTX, MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not available");
    }
}
