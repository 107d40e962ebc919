package io.github.hatchcrm.aiemployees.runtime.delegation;

import io.github.hatchcrm.aiemployees.persistence.document.PersonaInstanceDocument;
import io.github.hatchcrm.aiemployees.persistence.document.PersonaTemplateDocument;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaInstanceRepository;
import io.github.hatchcrm.aiemployees.persistence.repository.PersonaTemplateRepository;
import io.github.hatchcrm.aiemployees.protocol.api.ActionStatus;
import io.github.hatchcrm.aiemployees.protocol.api.ActionView;
import io.github.hatchcrm.aiemployees.protocol.api.AutonomyMode;
import io.github.hatchcrm.aiemployees.protocol.api.ChatResponse;
import io.github.hatchcrm.aiemployees.protocol.api.PersonaStatus;
import io.github.hatchcrm.aiemployees.runtime.conversation.ChatTurnRequest;
import io.github.hatchcrm.aiemployees.runtime.conversation.ConversationService;
import io.github.hatchcrm.aiemployees.runtime.error.BadRequestException;
import io.github.hatchcrm.aiemployees.runtime.persona.PersonaCatalog;
import io.github.hatchcrm.aiemployees.runtime.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DelegationCoordinatorTest {

    private static final String TENANT = "tenant-1";

    @Mock private PersonaTemplateRepository templateRepository;
    @Mock private PersonaInstanceRepository instanceRepository;
    @Mock private ConversationService conversationService;
    @Mock private ObjectProvider<WorkflowPrefetchHook> hookProvider;
    @Captor private ArgumentCaptor<ChatTurnRequest> turnCaptor;

    private final List<WorkflowPrefetchHook> hooks = new ArrayList<>();
    private DelegationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        List<PersonaTemplateDocument> templates = List.of(
                makeTemplate("hatch_assistant", "Hatch"),
                makeTemplate("agent_copilot", "Echo"),
                makeTemplate("lead_nurse", "Lumen"),
                makeTemplate("listing_concierge", "Haven"),
                makeTemplate("market_analyst", "Atlas"),
                makeTemplate("transaction_coordinator", "Nova"));
        when(templateRepository.findByActiveTrue()).thenReturn(templates);
        for (PersonaTemplateDocument t : templates) {
            when(instanceRepository.findFirstByTenantIdAndTemplateKeyAndStatus(TENANT, t.getKey(), PersonaStatus.ACTIVE))
                    .thenReturn(Optional.of(makeInstance("inst-" + t.getKey(), t.getKey())));
        }
        when(hookProvider.orderedStream()).thenAnswer(inv -> hooks.stream());
        when(conversationService.sendMessage(any(ChatTurnRequest.class))).thenAnswer(inv -> {
            ChatTurnRequest req = inv.getArgument(0);
            return new ChatResponse("nested-" + req.personaInstanceId(), req.personaInstanceId(),
                    "Reply to: " + req.message(), List.of());
        });

        coordinator = new DelegationCoordinator(new PersonaCatalog(templateRepository, instanceRepository),
                conversationService, hookProvider, 3);
    }

    // ------------------------------------------------------------------
    // delegate
    // ------------------------------------------------------------------

    @Test
    void delegateRunsNestedWorkflowTurn() {
        ActionView executed = makeView(ActionStatus.EXECUTED, " Text message sent. ");
        ActionView pending = makeView(ActionStatus.REQUIRES_APPROVAL, null);
        doReturn(new ChatResponse("nested-s", "inst-lead_nurse", "Sent a check-in.", List.of(executed, pending)))
                .when(conversationService).sendMessage(any(ChatTurnRequest.class));

        DelegationResult result = coordinator.delegate("lumen", "Text Ana", ctx("inst-agent_copilot", 0));

        verify(conversationService).sendMessage(turnCaptor.capture());
        ChatTurnRequest turn = turnCaptor.getValue();
        assertThat(turn.personaInstanceId()).isEqualTo("inst-lead_nurse");
        assertThat(turn.channel()).isEqualTo("workflow");
        assertThat(turn.contextType()).isEqualTo("workflow");
        assertThat(turn.contextId()).isEqualTo("session-1");
        assertThat(turn.userId()).isEqualTo("user-1");
        assertThat(turn.delegationDepth()).isEqualTo(1);

        assertThat(result.personaKey()).isEqualTo("lead_nurse");
        assertThat(result.personaName()).isEqualTo("Lumen");
        assertThat(result.employeeInstanceId()).isEqualTo("inst-lead_nurse");
        assertThat(result.reply()).isEqualTo("Sent a check-in.");
        assertThat(result.toolReplies()).containsExactly("Text message sent.");
        assertThat(result.error()).isNull();
    }

    @Test
    void selfDelegationReturnsNull() {
        assertThat(coordinator.delegate("Echo", "hi", ctx("inst-agent_copilot", 0))).isNull();
        verifyNoInteractions(conversationService);
    }

    @Test
    void unknownPersonaIsBadRequest() {
        assertThatThrownBy(() -> coordinator.delegate("Zed", "hi", ctx("inst-agent_copilot", 0)))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Unknown persona: Zed");
    }

    @Test
    void missingActiveInstanceIsBadRequest() {
        when(instanceRepository.findFirstByTenantIdAndTemplateKeyAndStatus(TENANT, "market_analyst", PersonaStatus.ACTIVE))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator.delegate("Atlas", "hi", ctx("inst-agent_copilot", 0)))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("market_analyst");
    }

    @Test
    void depthLimitStopsDelegationChains() {
        assertThatThrownBy(() -> coordinator.delegate("Nova", "hi", ctx("inst-agent_copilot", 3)))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(conversationService);
    }

    // ------------------------------------------------------------------
    // extractRequests
    // ------------------------------------------------------------------

    @Test
    void extractsNamedSegments() {
        List<DelegationRequest> requests = coordinator.extractRequests(
                "Echo: who should I call first? lumen: draft texts for them");

        assertThat(requests).containsExactly(
                new DelegationRequest("agent_copilot", "who should I call first?"),
                new DelegationRequest("lead_nurse", "draft texts for them"));
    }

    @Test
    void fallsBackToMentionsWithWholeMessage() {
        String message = "Can Nova and Haven check closing deadlines?";

        assertThat(coordinator.extractRequests(message)).containsExactly(
                new DelegationRequest("listing_concierge", message),
                new DelegationRequest("transaction_coordinator", message));
    }

    @Test
    void coordinatorPersonaIsNotAddressableByName() {
        assertThat(coordinator.extractRequests("Hatch: summarize the week")).isEmpty();
        assertThat(coordinator.extractRequests("   ")).isEmpty();
    }

    // ------------------------------------------------------------------
    // coordinate
    // ------------------------------------------------------------------

    @Test
    void fanOutIsCappedAtFive() {
        List<DelegationRequest> requests = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            requests.add(new DelegationRequest(i % 2 == 0 ? "lead_nurse" : "transaction_coordinator", "task " + i));
        }

        List<DelegationResult> results = coordinator.coordinate(requests, "go", ctx("inst-hatch_assistant", 0));

        assertThat(results).hasSize(DelegationCoordinator.MAX_FANOUT);
        verify(conversationService, times(5)).sendMessage(any(ChatTurnRequest.class));
    }

    @Test
    void fanOutCapAppliesToBranchesAddedByHooks() {
        hooks.add((message, requests, context) -> {
            List<DelegationRequest> expanded = new ArrayList<>(requests);
            for (int i = 0; i < 4; i++) {
                expanded.add(new DelegationRequest("market_analyst", "extra " + i));
            }
            return expanded;
        });
        List<DelegationRequest> requests = List.of(
                new DelegationRequest("lead_nurse", "a"),
                new DelegationRequest("listing_concierge", "b"),
                new DelegationRequest("transaction_coordinator", "c"));

        List<DelegationResult> results = coordinator.coordinate(requests, "go", ctx("inst-hatch_assistant", 0));

        assertThat(results).hasSize(DelegationCoordinator.MAX_FANOUT);
        assertThat(results).extracting(DelegationResult::personaKey).containsExactly(
                "lead_nurse", "listing_concierge", "transaction_coordinator", "market_analyst", "market_analyst");
        verify(conversationService, times(5)).sendMessage(any(ChatTurnRequest.class));
    }

    @Test
    void failingBranchDoesNotAbortTheOthers() {
        doThrow(new IllegalStateException("model down")).when(conversationService)
                .sendMessage(argThat(r -> r != null && "inst-lead_nurse".equals(r.personaInstanceId())));

        List<DelegationResult> results = coordinator.coordinate(null,
                "Lumen: draft texts Nova: list deadlines", ctx("inst-hatch_assistant", 0));

        assertThat(results).hasSize(2);
        DelegationResult failed = results.get(0);
        assertThat(failed.personaKey()).isEqualTo("lead_nurse");
        assertThat(failed.personaName()).isEqualTo("Lumen");
        assertThat(failed.employeeInstanceId()).isEqualTo(DelegationResult.UNKNOWN_INSTANCE);
        assertThat(failed.reply()).isEqualTo("Error: model down");
        assertThat(failed.error()).isTrue();
        assertThat(results.get(1).reply()).isEqualTo("Reply to: list deadlines");
    }

    @Test
    void selfBranchIsSkipped() {
        List<DelegationResult> results = coordinator.coordinate(null,
                "Echo: rank my leads Nova: list deadlines", ctx("inst-agent_copilot", 0));

        assertThat(results).extracting(DelegationResult::personaKey).containsExactly("transaction_coordinator");
    }

    @Test
    void hooksMayRewriteBranchMessages() {
        hooks.add((message, requests, context) -> requests.stream()
                .map(r -> r.withMessage(r.message() + "\n\nContext: 3 hot leads"))
                .toList());
        hooks.add((message, requests, context) -> {
            throw new IllegalStateException("hook broke");
        });

        List<DelegationResult> results = coordinator.coordinate(
                List.of(new DelegationRequest("agent_copilot", "who to call")), "who to call", ctx("inst-hatch_assistant", 0));

        assertThat(results).singleElement()
                .extracting(DelegationResult::reply)
                .isEqualTo("Reply to: who to call\n\nContext: 3 hot leads");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ToolContext ctx(String callerInstanceId, int depth) {
        return new ToolContext(TENANT, "user-1", "session-1", callerInstanceId, depth);
    }

    private ActionView makeView(ActionStatus status, String humanReadable) {
        return new ActionView("a-" + status.name(), "inst-lead_nurse", "nested-s", "send_sms", null, status,
                true, false, null, null, null, humanReadable, Instant.now());
    }

    private PersonaTemplateDocument makeTemplate(String key, String name) {
        PersonaTemplateDocument t = new PersonaTemplateDocument();
        t.setKey(key);
        t.setDisplayName(name);
        t.setDefaultAutonomyMode(AutonomyMode.REQUIRES_APPROVAL);
        t.setActive(true);
        return t;
    }

    private PersonaInstanceDocument makeInstance(String id, String templateKey) {
        PersonaInstanceDocument i = new PersonaInstanceDocument();
        i.setId(id);
        i.setTenantId(TENANT);
        i.setTemplateKey(templateKey);
        i.setStatus(PersonaStatus.ACTIVE);
        i.setAutonomyMode(AutonomyMode.REQUIRES_APPROVAL);
        return i;
    }
}
