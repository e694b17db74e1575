package dev.ebullient.ensemble.model;

import java.util.List;

public record EnforcementResult(
        String cleanedText,
        boolean violationsFound,
        boolean formatIssuesFound,
        List<String> violatingCharacters) {

    public EnforcementResult {
        violatingCharacters = violatingCharacters == null ? List.of() : List.copyOf(violatingCharacters);
    }
}
