package dev.ebullient.ensemble.chat;

import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.guardrail.OutputGuardrail;
import dev.langchain4j.guardrail.OutputGuardrailResult;
import io.quarkus.logging.Log;

/**
 * Asks the narrator again when it returns nothing usable. Layout problems are
 * repaired afterwards, so only empty or marker-free output is rejected here.
 */
@ApplicationScoped
public class NarrationGuardrail implements OutputGuardrail {

    private static final Pattern NAME_MARKER = Pattern.compile("\\*\\*[^*\\n]+\\*\\*");

    @Override
    public OutputGuardrailResult validate(AiMessage responseFromLLM) {
        Log.debugf("Validate narration");
        String text = responseFromLLM.text();
        if (text == null || text.isBlank()) {
            return reprompt("Empty narration",
                    "Write the scene now. Start each character's part with their name in bold, like **Name**.");
        }
        if (!NAME_MARKER.matcher(text).find()) {
            return reprompt("No character markers",
                    "Rewrite the scene so every line a character speaks or acts starts with their name in bold, like **Name**.");
        }
        return success();
    }
}
