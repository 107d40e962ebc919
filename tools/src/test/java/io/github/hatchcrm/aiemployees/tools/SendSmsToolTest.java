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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SendSmsToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("tenant-1", "user-1", "session-1", "instance-1");

    @Mock private CrmDirectory crmDirectory;
    @Mock private MessagingGateway messagingGateway;

    private SendSmsTool tool;

    @BeforeEach
    void setUp() {
        tool = new SendSmsTool();
        tool.setCrmDirectory(crmDirectory);
        tool.setMessagingGateway(messagingGateway);
        when(crmDirectory.findLead("tenant-1", "lead-1"))
                .thenReturn(Optional.of(TestLeads.lead("lead-1", "Maya", "Lopez", 90.0)));
        when(messagingGateway.sendSms(any())).thenReturn("sms-1");
    }

    private ObjectNode makeInput() {
        return MAPPER.createObjectNode()
                .put("leadId", "lead-1")
                .put("from", "+15555550199")
                .put("body", "Hi Maya, any updates on your search?");
    }

    @Test
    void sendsToLeadPrimaryPhone() {
        ToolResult result = tool.execute(CTX, makeInput());

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("messageId").asText()).isEqualTo("sms-1");
        ArgumentCaptor<SmsMessage> sent = ArgumentCaptor.forClass(SmsMessage.class);
        verify(messagingGateway).sendSms(sent.capture());
        assertThat(sent.getValue().to()).isEqualTo("+15555550100");
        assertThat(sent.getValue().overrideQuietHours()).isFalse();
        assertThat(sent.getValue().transactional()).isFalse();
    }

    @Test
    void passesQuietHourOverride() {
        tool.execute(CTX, makeInput().put("overrideQuietHours", true).put("transactional", true));

        ArgumentCaptor<SmsMessage> sent = ArgumentCaptor.forClass(SmsMessage.class);
        verify(messagingGateway).sendSms(sent.capture());
        assertThat(sent.getValue().overrideQuietHours()).isTrue();
        assertThat(sent.getValue().transactional()).isTrue();
    }

    @Test
    void gatewayFailurePropagates() {
        when(messagingGateway.sendSms(any())).thenThrow(new IllegalStateException("Quiet hours in effect"));

        assertThatThrownBy(() -> tool.execute(CTX, makeInput()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Quiet hours");
    }

    @Test
    void alwaysNeedsApproval() {
        assertThat(tool.allowAutoRun()).isFalse();
        assertThat(tool.defaultRequiresApproval()).isTrue();
    }
}
