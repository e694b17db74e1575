package dev.ebullient.ensemble.model;

/**
 * Generated text after cleanup, and what the narrative pass over the cleaned text changed.
 */
public record ReviewResult(
        EnforcementResult enforcement,
        ExtractionSummary extraction) {
}
