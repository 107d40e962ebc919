package io.github.hatchcrm.aiemployees.runtime.llm;

import io.github.hatchcrm.aiemployees.protocol.api.ConversationEntry;

import java.util.List;

/**
 * Single blocking chat-completion call against whichever provider is configured.
 * Implementations throw on any provider failure; timeouts are applied by the caller.
 */
public interface ChatCompletionClient {

    String complete(String systemPrompt, List<ConversationEntry> history, CompletionFormat format);

    String providerName();

    String modelName();

    /** False when no credentials are configured; calls will then fail. */
    default boolean isAvailable() { return true; }
}
