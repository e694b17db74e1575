package dev.ebullient.ensemble.model;

/**
 * Character directory entry supplied by the host for every turn.
 */
public record CharacterProfile(
        String name,
        String personality,
        String description,
        String scenario,
        boolean removed) {

    public static CharacterProfile named(String name) {
        return new CharacterProfile(name, null, null, null, false);
    }
}
