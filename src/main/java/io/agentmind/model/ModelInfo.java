package io.agentmind.model;

/**
 * Describes the model behind a {@link ModelAdapter}.
 */
public record ModelInfo(String provider, String model, int maxTokens, double temperature) {}
