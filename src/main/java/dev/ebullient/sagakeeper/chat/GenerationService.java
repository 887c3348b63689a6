package dev.ebullient.sagakeeper.chat;

import java.util.ArrayList;
import java.util.List;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

/**
 * Single-prompt text generation with exponential backoff between failed attempts.
 */
@Singleton
public class GenerationService {
    private static final Logger log = Logger.getLogger(GenerationService.class);

    @ConfigProperty(name = "sagakeeper.generation.max-retries", defaultValue = "3")
    int maxRetries;

    @ConfigProperty(name = "sagakeeper.generation.backoff-ms", defaultValue = "1000")
    long backoffMillis;

    @Inject
    ChatModel chatModel;

    /**
     * @param systemPrompt may be null
     * @throws GenerationException when every attempt failed
     */
    public String generate(String prompt, String systemPrompt, double temperature, int maxTokens) {
        List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(prompt));
        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .build();

        int attempts = Math.max(1, maxRetries);
        RuntimeException last = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                ChatResponse response = chatModel.chat(request);
                String text = response.aiMessage().text();
                return text == null ? "" : text;
            } catch (RuntimeException e) {
                last = e;
                if (attempt == attempts - 1) {
                    break;
                }
                long delay = backoffMillis * (1L << attempt);
                log.warnf("Generation attempt %d/%d failed (%s); retrying in %d ms",
                        attempt + 1, attempts, e.getMessage(), delay);
                pause(delay);
            }
        }
        throw new GenerationException(attempts, last);
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(0, e);
        }
    }
}
