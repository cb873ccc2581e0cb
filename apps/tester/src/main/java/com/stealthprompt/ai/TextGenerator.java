package com.stealthprompt.ai;

/**
 * Single-shot text generation: one system instruction, one user instruction, one reply.
 *
 * <p>Callers only see this interface; the provider behind it (OpenAI-compatible or Ollama)
 * is chosen by {@code ai.mode}.</p>
 */
public interface TextGenerator {

    /**
     * @return the generated text, trimmed; may be empty
     * @throws IllegalArgumentException on a blank or overlong instruction
     * @throws GenerationException      on provider failure or timeout
     */
    String generate(String systemInstruction, String userInstruction, GenerationOptions options);

    default String generate(String systemInstruction, String userInstruction) {
        return generate(systemInstruction, userInstruction, GenerationOptions.defaults());
    }
}
