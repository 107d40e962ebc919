package io.github.hatchcrm.aiemployees.gateway.config;

import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat model for any OpenAI-compatible endpoint. Only created for the {@code openai} provider.
 */
@Configuration
@ConditionalOnProperty(name = "hatch.ai.llm.provider", havingValue = "openai", matchIfMissing = true)
public class LlmConfig {

    static final String UNSET_KEY = "unset";

    @Bean
    OpenAiChatModel openAiChatModel(@Value("${hatch.ai.llm.base-url:https://api.openai.com}") String baseUrl,
                                    @Value("${hatch.ai.llm.api-key:}") String apiKey,
                                    @Value("${hatch.ai.llm.model:gpt-4o-mini}") String model,
                                    @Value("${hatch.ai.llm.temperature:0.2}") double temperature) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey == null || apiKey.isBlank() ? UNSET_KEY : apiKey)
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(model).temperature(temperature).build())
                .build();
    }
}
