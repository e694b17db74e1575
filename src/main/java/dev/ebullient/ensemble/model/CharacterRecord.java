package dev.ebullient.ensemble.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Presence and physical state of one character in a scene.
 * Immutable: every change produces a new record that replaces the old one in the store.
 */
public record CharacterRecord(
        boolean present,
        String activity,
        String location,
        String position,
        List<String> holdingItems,
        String interactingWith,
        String lastAction,
        String emotionalState,
        long lastSeen) {

    public static final String DEFAULT_ACTIVITY = "conversing";
    public static final String DEFAULT_LOCATION = "main area";
    public static final String DEFAULT_MOOD = "neutral";

    public CharacterRecord {
        holdingItems = holdingItems == null ? List.of() : List.copyOf(holdingItems);
    }

    public static CharacterRecord defaults(long now) {
        return new CharacterRecord(true, DEFAULT_ACTIVITY, DEFAULT_LOCATION, Posture.STANDING.token(),
                List.of(), null, null, DEFAULT_MOOD, now);
    }

    public CharacterRecord withPresence(boolean present, String activity, long now) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, emotionalState, now);
    }

    public CharacterRecord withLocation(String location) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, emotionalState, lastSeen);
    }

    public CharacterRecord withActivity(String activity) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, emotionalState, lastSeen);
    }

    public CharacterRecord withPosition(String position, long now) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, emotionalState, now);
    }

    /**
     * Add an item to the end of the held items. Holding the same item twice is a no-op
     * apart from the action label and timestamp.
     */
    public CharacterRecord withItem(String item, String action, long now) {
        List<String> items = holdingItems;
        if (!holds(item)) {
            items = new ArrayList<>(holdingItems);
            items.add(item);
        }
        return new CharacterRecord(present, activity, location, position, items,
                interactingWith, action, emotionalState, now);
    }

    public CharacterRecord withoutItem(String item, String action, long now) {
        List<String> items = holdingItems.stream()
                .filter(i -> !i.equalsIgnoreCase(item))
                .toList();
        return new CharacterRecord(present, activity, location, position, items,
                interactingWith, action, emotionalState, now);
    }

    public CharacterRecord withInteraction(String target, String action, long now) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                target, action, emotionalState, now);
    }

    public CharacterRecord withEmotionalState(String mood, long now) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, mood, now);
    }

    public CharacterRecord seenAt(long now) {
        return new CharacterRecord(present, activity, location, position, holdingItems,
                interactingWith, lastAction, emotionalState, now);
    }

    public boolean holds(String item) {
        return holdingItems.stream().anyMatch(i -> i.equalsIgnoreCase(item));
    }
}
