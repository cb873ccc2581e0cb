package com.stealthprompt.ai;

import com.stealthprompt.config.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Delegates each call to the OpenAI or Ollama model picked by {@code ai.mode}.
 */
@Primary
@Component
@RequiredArgsConstructor
public class ModeRoutingChatModel implements ChatModel {

    private final ObjectProvider<OpenAiChatModel> openAiProvider;
    private final ObjectProvider<OllamaChatModel> ollamaProvider;
    private final AiProperties props;

    ChatModel current() {
        AiProperties.Mode mode = props.getMode();
        return switch (mode) {
            case OPENAI -> {
                ChatModel m = openAiProvider.getIfAvailable();
                if (m == null) throw new IllegalStateException("OpenAI model not available on classpath/config.");
                yield m;
            }
            case OLLAMA -> {
                ChatModel m = ollamaProvider.getIfAvailable();
                if (m == null) throw new IllegalStateException("Ollama model not available on classpath/config.");
                yield m;
            }
        };
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        return current().call(prompt);
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        return current().stream(prompt);
    }
}
