package com.certprep.rag.model;

/**
 * Remote services the engine talks to, used to tag call log lines.
 *
 * @see com.certprep.rag.util.ExternalCallLogger
 */
public enum ServiceType {
    PINECONE("🔵", "Pinecone"),
    OPENAI("🟣", "OpenAI"),
    OLLAMA("🟢", "Ollama"),
    GEMINI("🔴", "Gemini");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
