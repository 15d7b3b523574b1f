package com.glyph.config;

/**
 * Configuration for token identifier generation.
 *
 * @param minDigits           Minimum width of the zero-padded numeric suffix
 * @param maxCollisionRetries Perturbation attempts before a category is reported exhausted
 * @param maxSuffix           Largest numeric suffix that may be allocated
 */
public record GeneratorConfig(
        int minDigits,
        int maxCollisionRetries,
        int maxSuffix
) {
    public static final int DEFAULT_MIN_DIGITS = 2;
    public static final int DEFAULT_MAX_COLLISION_RETRIES = 16;
    public static final int DEFAULT_MAX_SUFFIX = 99_999;

    public GeneratorConfig {
        if (minDigits < 1) {
            throw new IllegalArgumentException("minDigits must be at least 1, got " + minDigits);
        }
        if (maxCollisionRetries < 0) {
            throw new IllegalArgumentException("maxCollisionRetries cannot be negative, got " + maxCollisionRetries);
        }
        if (maxSuffix < 1) {
            throw new IllegalArgumentException("maxSuffix must be positive, got " + maxSuffix);
        }
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_MIN_DIGITS, DEFAULT_MAX_COLLISION_RETRIES, DEFAULT_MAX_SUFFIX);
    }
}
