package io.github.hatchcrm.aiemployees.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptedChatCompletionClientTest {

    private final ScriptedChatCompletionClient client = new ScriptedChatCompletionClient();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void plansReadsFromKeywordsInLatestUserMessage() throws Exception {
        String raw = client.complete("system", List.of(
                new ConversationEntry(ConversationRole.USER, "anything overdue?"),
                new ConversationEntry(ConversationRole.ASSISTANT, "No."),
                new ConversationEntry(ConversationRole.USER, "Give me today's summary and hot leads")),
                CompletionFormat.JSON_OBJECT);

        JsonNode plan = mapper.readTree(raw);
        List<String> tools = new ArrayList<>();
        plan.get("actions").forEach(a -> tools.add(a.get("tool").asText()));
        assertThat(tools).containsExactly("get_daily_summary", "get_hot_leads");
        assertThat(plan.get("reply").asText()).isNotBlank();
    }

    @Test
    void smallTalkHasNoActions() throws Exception {
        JsonNode plan = mapper.readTree(client.complete("system",
                List.of(new ConversationEntry(ConversationRole.USER, "hello")), CompletionFormat.JSON_OBJECT));

        assertThat(plan.get("actions").size()).isZero();
    }
}
