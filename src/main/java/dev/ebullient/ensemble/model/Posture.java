package dev.ebullient.ensemble.model;

import java.util.Locale;

public enum Posture {
    STANDING("stand", "stands", "stood", "standing"),
    SITTING("sit", "sits", "sat", "sitting"),
    LEANING("lean", "leans", "leaned", "leant", "leaning"),
    LYING("lie", "lies", "lay", "lying"),
    KNEELING("kneel", "kneels", "knelt", "kneeled", "kneeling");

    private final String[] verbForms;

    Posture(String... verbForms) {
        this.verbForms = verbForms;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Map any tense of a posture verb to its posture.
     *
     * @return the posture, or null if the word is not a posture verb
     */
    public static Posture fromVerb(String verb) {
        if (verb == null) {
            return null;
        }
        String word = verb.trim().toLowerCase(Locale.ROOT);
        for (Posture posture : values()) {
            for (String form : posture.verbForms) {
                if (form.equals(word)) {
                    return posture;
                }
            }
        }
        return null;
    }
}
