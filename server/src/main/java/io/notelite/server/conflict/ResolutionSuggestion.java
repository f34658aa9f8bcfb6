package io.notelite.server.conflict;

import io.notelite.core.conflict.ResolutionStrategy;

/**
 * A strategy that could resolve a conflict, with how confident the engine is in it.
 */
public record ResolutionSuggestion(ResolutionStrategy strategy, double confidence, String rationale) {}
