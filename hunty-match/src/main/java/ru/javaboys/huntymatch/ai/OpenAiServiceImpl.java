package ru.javaboys.huntymatch.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.AiProperties;
import ru.javaboys.huntymatch.util.ExternalCallGuard;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class OpenAiServiceImpl implements OpenAiService {

    private static final String SERVICE = "reasoning-service";

    private final ChatClient chatClient;
    private final ExternalCallGuard externalCallGuard;
    private final AiProperties aiProperties;

    @Override
    public <T> T structuredTalkToChatGPT(String conversationId, SystemMessage systemMessage, UserMessage userMessage, Class<T> classType) {
        log.debug("Structured chat call {} -> {}", conversationId, classType.getSimpleName());
        return externalCallGuard.call(SERVICE, aiProperties.getTimeout(), () -> chatClient
                .prompt(prompt(systemMessage, userMessage))
                .call()
                .entity(classType));
    }

    private Prompt prompt(SystemMessage systemMessage, UserMessage userMessage) {
        List<Message> promptMessages = List.of(systemMessage, userMessage);
        ChatOptions options = ChatOptions.builder()
                .model(aiProperties.getChatModel())
                .temperature(aiProperties.getTemperature())
                .maxTokens(aiProperties.getMaxTokens())
                .build();
        return new Prompt(promptMessages, options);
    }
}
