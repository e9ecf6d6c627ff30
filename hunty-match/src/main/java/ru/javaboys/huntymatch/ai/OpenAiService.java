package ru.javaboys.huntymatch.ai;

import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

/**
 * Reasoning-service boundary. Calls are time-bounded; failures surface as
 * {@link ru.javaboys.huntymatch.exception.ServiceUnavailableException}.
 */
public interface OpenAiService {

    <T> T structuredTalkToChatGPT(String conversationId, SystemMessage systemMessage, UserMessage userMessage, Class<T> classType);
}
