package com.zzf.simon.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class LlmConfig {

    @Bean
    public StreamingChatModel coachStreamingModel(SimonProperties properties) {
        SimonProperties.Llm llm = properties.getLlm();
        log.info("llm.init model={} baseUrl={}", llm.getModel(), llm.getBaseUrl());
        return OpenAiStreamingChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(apiKey(llm))
                .modelName(llm.getModel())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout())
                .build();
    }

    @Bean
    public ChatModel classifierModel(SimonProperties properties) {
        SimonProperties.Llm llm = properties.getLlm();
        return OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(apiKey(llm))
                .modelName(llm.getClassifierModel())
                .temperature(0.0)
                .timeout(llm.getTimeout())
                .build();
    }

    private static String apiKey(SimonProperties.Llm llm) {
        String key = llm.getApiKey();
        if (key == null || key.isBlank()) {
            log.warn("llm.api_key.missing model calls will fail until simon.llm.api-key is set");
            return "unset";
        }
        return key;
    }
}
