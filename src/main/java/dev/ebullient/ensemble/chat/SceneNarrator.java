package dev.ebullient.ensemble.chat;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.guardrail.OutputGuardrails;
import io.quarkiverse.langchain4j.RegisterAiService;

@RegisterAiService(chatMemoryProviderSupplier = RegisterAiService.BeanChatMemoryProviderSupplier.class)
@OutputGuardrails(NarrationGuardrail.class)
public interface SceneNarrator {

    @SystemMessage("""
            You narrate one shared scene for a group of characters and the user.

            ## FORMAT
            - Write one combined scene, not one block per character.
            - Start every line a character speaks or acts with their name in bold:
              **Name** "What they say" *what they do*
            - Describe the surroundings in *italics* without a name.
            - No headers, no "Preview", no name on a line of its own.

            ## PRESENCE
            - Only characters listed under "Characters in scene" may speak or act.
            - Absent characters may be mentioned, never shown.
            - Characters may leave or come back; say where they go.

            ## THE USER
            - Never write the user's words, thoughts or actions.
            - Characters may talk to the user. End with one of them addressing the user.
            """)
    @UserMessage("""
            ## Characters in scene
            {characters}

            ## Current scene
            {scene}

            ## Absent
            {absent}

            ## Directly addressed
            {addressed}

            {reminder}

            ## User
            {userMessage}
            """)
    String narrate(
            @MemoryId String sceneId,
            String characters,
            String scene,
            String absent,
            String addressed,
            String reminder,
            String userMessage);
}
