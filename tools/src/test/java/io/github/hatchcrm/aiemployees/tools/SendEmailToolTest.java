package io.github.hatchcrm.aiemployees.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SendEmailToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("tenant-1", "user-1", "session-1", "instance-1");

    @Mock private CrmDirectory crmDirectory;
    @Mock private MessagingGateway messagingGateway;

    private SendEmailTool tool;

    @BeforeEach
    void setUp() {
        tool = new SendEmailTool();
        tool.setCrmDirectory(crmDirectory);
        tool.setMessagingGateway(messagingGateway);
        when(crmDirectory.findLead("tenant-1", "lead-1"))
                .thenReturn(Optional.of(TestLeads.lead("lead-1", "Maya", "Lopez", 90.0)));
        when(messagingGateway.sendEmail(any())).thenReturn("msg-1");
    }

    private ObjectNode makeInput() {
        return MAPPER.createObjectNode()
                .put("leadId", "lead-1")
                .put("from", "agent@brokerage.com")
                .put("subject", "New listings\r\nfor you")
                .put("body", "Three homes match your search.");
    }

    @Test
    void alwaysNeedsApproval() {
        assertThat(tool.allowAutoRun()).isFalse();
        assertThat(tool.defaultRequiresApproval()).isTrue();
    }

    @Test
    void sendsToLeadPrimaryEmailByDefault() {
        ToolResult result = tool.execute(CTX, makeInput());

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("messageId").asText()).isEqualTo("msg-1");
        ArgumentCaptor<EmailMessage> sent = ArgumentCaptor.forClass(EmailMessage.class);
        verify(messagingGateway).sendEmail(sent.capture());
        assertThat(sent.getValue().to()).isEqualTo("maya@example.com");
        assertThat(sent.getValue().subject()).isEqualTo("New listings for you");
        assertThat(sent.getValue().userId()).isEqualTo("user-1");
        assertThat(sent.getValue().includeUnsubscribe()).isTrue();
    }

    @Test
    void explicitRecipientAndTransactionalScope() {
        ObjectNode input = makeInput().put("to", "other@example.com").put("scope", "TRANSACTIONAL");

        tool.execute(CTX, input);

        ArgumentCaptor<EmailMessage> sent = ArgumentCaptor.forClass(EmailMessage.class);
        verify(messagingGateway).sendEmail(sent.capture());
        assertThat(sent.getValue().to()).isEqualTo("other@example.com");
        assertThat(sent.getValue().includeUnsubscribe()).isFalse();
    }

    @Test
    void failsWhenLeadHasNoEmail() {
        when(crmDirectory.findLead("tenant-1", "lead-1"))
                .thenReturn(Optional.of(TestLeads.lead("lead-1", null, null, 10.0)));

        ToolResult result = tool.execute(CTX, makeInput());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("email address");
        verify(messagingGateway, never()).sendEmail(any());
    }

    @Test
    void failsForUnknownLead() {
        ToolResult result = tool.execute(CTX, makeInput().put("leadId", "missing"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not found");
    }

    @Test
    void failsWithoutGateway() {
        SendEmailTool unwired = new SendEmailTool();
        unwired.setCrmDirectory(crmDirectory);

        ToolResult result = unwired.execute(CTX, makeInput());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not available");
    }
}
