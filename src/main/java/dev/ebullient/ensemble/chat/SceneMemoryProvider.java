package dev.ebullient.ensemble.chat;

import java.util.concurrent.ConcurrentHashMap;

import jakarta.inject.Singleton;

import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.ChatMemoryProvider;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;

/**
 * Narrator conversation history, one window per scene.
 */
@Singleton
public class SceneMemoryProvider implements ChatMemoryProvider {

    static final int MAX_MESSAGES = 12;

    private final ConcurrentHashMap<Object, ChatMemory> memories = new ConcurrentHashMap<>();

    @Override
    public ChatMemory get(Object memoryId) {
        return memories.computeIfAbsent(memoryId,
                id -> MessageWindowChatMemory.withMaxMessages(MAX_MESSAGES));
    }

    public void clear(Object memoryId) {
        memories.remove(memoryId);
    }
}
