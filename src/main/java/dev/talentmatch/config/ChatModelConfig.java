package dev.talentmatch.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.talentmatch.analysis.AnalysisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Structured-assessment chat model used by the candidate analyzer. */
@Configuration
public class ChatModelConfig {

  @Bean
  public ChatModel chatModel(AnalysisProperties properties) {
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "talentmatch.analysis.api-key is required. Set the OPENAI_API_KEY environment variable.");
    }

    return OpenAiChatModel.builder()
        .apiKey(apiKey)
        .modelName(properties.modelName())
        .temperature(0.0)
        .timeout(properties.timeout())
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
