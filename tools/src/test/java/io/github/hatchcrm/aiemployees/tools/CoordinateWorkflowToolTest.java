package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationCoordinator;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationRequest;
import io.github.hatchcrm.aiemployees.runtime.delegation.DelegationResult;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.session.ConversationHistoryService;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CoordinateWorkflowToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("tenant-1", "user-1", "session-1", "hatch-instance", 0);

    @Mock private DelegationCoordinator delegationCoordinator;
    @Mock private ConversationHistoryService conversationHistoryService;
    @Mock private PersonaCatalog personaCatalog;

    private CoordinateWorkflowTool tool;

    @BeforeEach
    void setUp() {
        tool = new CoordinateWorkflowTool();
        tool.setDelegationCoordinator(delegationCoordinator);
        tool.setConversationHistoryService(conversationHistoryService);
        tool.setPersonaCatalog(personaCatalog);
        when(conversationHistoryService.latestUserMessage(any(), any())).thenReturn(Optional.empty());
        when(personaCatalog.resolvePersona(anyString())).thenReturn(Optional.empty());
        when(personaCatalog.resolvePersona("Echo")).thenReturn(Optional.of(makeTemplate("agent_copilot", "Echo")));
        when(personaCatalog.resolvePersona("lead_nurse")).thenReturn(Optional.of(makeTemplate("lead_nurse", "Lumen")));
        when(delegationCoordinator.coordinate(any(), any(), any())).thenReturn(List.of(
                new DelegationResult("agent_copilot", "Echo", "echo-1", "Call Maya first.", null, null),
                DelegationResult.failed("lead_nurse", "Lumen", "No active AI employee instance found for lead_nurse")));
    }

    private static PersonaTemplateDocument makeTemplate(String key, String name) {
        PersonaTemplateDocument template = new PersonaTemplateDocument();
        template.setKey(key);
        template.setDisplayName(name);
        return template;
    }

    @SuppressWarnings("unchecked")
    private List<DelegationRequest> capturedRequests() {
        ArgumentCaptor<List<DelegationRequest>> captor = ArgumentCaptor.forClass(List.class);
        verify(delegationCoordinator).coordinate(captor.capture(), any(), any());
        return captor.getValue();
    }

    @Test
    void explicitRequestsAreResolvedToKeys() {
        ObjectNode input = MAPPER.createObjectNode().put("message", "Plan my day");
        input.putArray("requests")
                .add(MAPPER.createObjectNode().put("persona", "Echo").put("message", "Who should I call?"))
                .add(MAPPER.createObjectNode().put("personaKey", "lead_nurse"))
                .add(MAPPER.createObjectNode().put("persona", "Nobody").put("message", "ignored"))
                .add("not an object");

        tool.execute(CTX, input);

        assertThat(capturedRequests()).containsExactly(
                new DelegationRequest("agent_copilot", "Who should I call?"),
                new DelegationRequest("lead_nurse", "Plan my day"));
    }

    @Test
    void tasksFieldIsAnAliasForRequests() {
        ObjectNode input = MAPPER.createObjectNode().put("message", "Plan my day");
        input.putArray("tasks").add(MAPPER.createObjectNode().put("employee", "Echo").put("task", "List hot leads"));

        tool.execute(CTX, input);

        assertThat(capturedRequests()).containsExactly(new DelegationRequest("agent_copilot", "List hot leads"));
    }

    @Test
    void withoutRequestsTheMessageIsHandedToTheCoordinator() {
        tool.execute(CTX, MAPPER.createObjectNode().put("message", "Echo: hot leads. Lumen: draft texts."));

        assertThat(capturedRequests()).isEmpty();
        verify(delegationCoordinator).coordinate(any(), eq("Echo: hot leads. Lumen: draft texts."), eq(CTX));
    }

    @Test
    void missingMessageFallsBackToLatestUserMessage() {
        when(conversationHistoryService.latestUserMessage("session-1", "hatch-instance"))
                .thenReturn(Optional.of("Have Echo and Lumen work the top 3 leads"));

        tool.execute(CTX, MAPPER.createObjectNode());

        verify(delegationCoordinator).coordinate(any(), eq("Have Echo and Lumen work the top 3 leads"), eq(CTX));
    }

    @Test
    void resultsKeepFailedBranches() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("message", "Echo and Lumen"));

        assertThat(result.success()).isTrue();
        JsonNode results = result.output().path("results");
        assertThat(results).hasSize(2);
        assertThat(results.get(0).path("reply").asText()).isEqualTo("Call Maya first.");
        assertThat(results.get(1).path("employeeInstanceId").asText()).isEqualTo("unknown");
        assertThat(results.get(1).path("error").asBoolean()).isTrue();
        assertThat(results.get(1).path("reply").asText()).startsWith("Error: ");
    }

    @Test
    void failsWithoutCoordinator() {
        ToolResult result = new CoordinateWorkflowTool().execute(CTX, MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
    }
}
