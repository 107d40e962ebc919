package io.github.hatchcrm.aiemployees.runtime.llm;

import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;
import io.github.hatchcrm.aiemployees.protocol.api.ConversationRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@ConditionalOnProperty(name = "hatch.ai.llm.provider", havingValue = "openai", matchIfMissing = true)
public class SpringAiChatCompletionClient implements ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiChatCompletionClient.class);

    private final OpenAiChatModel chatModel;
    private final String model;
    private final boolean available;

    public SpringAiChatCompletionClient(OpenAiChatModel chatModel,
                                        @Value("${hatch.ai.llm.model:gpt-4o-mini}") String model,
                                        @Value("${hatch.ai.llm.api-key:}") String apiKey) {
        this.chatModel = chatModel;
        this.model = model;
        this.available = apiKey != null && !apiKey.isBlank();
        if (!available) {
            log.warn("hatch.ai.llm.api-key is not set; chat turns will fail until a key is configured");
        }
    }

    @Override
    public String complete(String systemPrompt, List<ConversationEntry> history, CompletionFormat format) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPrompt));
        for (ConversationEntry entry : history) {
            String content = entry.content() != null ? entry.content() : "";
            if (entry.role() == ConversationRole.ASSISTANT) {
                messages.add(new AssistantMessage(content));
            } else {
                messages.add(new UserMessage(content));
            }
        }

        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder().model(model);
        if (format == CompletionFormat.JSON_OBJECT) {
            options.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
        }

        var response = chatModel.call(new Prompt(messages, options.build()));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Model returned no output");
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }

    @Override
    public String providerName() { return "openai"; }

    @Override
    public String modelName() { return model; }

    @Override
    public boolean isAvailable() { return available; }
}
