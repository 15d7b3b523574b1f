package com.glyph.token;

import com.glyph.config.GeneratorConfig;
import com.glyph.exception.CategoryExhaustedException;
import com.glyph.exception.RegistryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * Produces and reuses short identifiers ({@code <prefix><number>}) for values
 * within a {@link TokenCategory}.
 * <p>
 * Rules:
 * - The same canonical value in the same category always gets the same identifier
 * - New identifiers take the next suffix after the category counter, so later values
 *   receive strictly higher suffixes
 * - A candidate already bound to another value is perturbed with a hash of the value
 *   and retried a bounded number of times
 * - Every new binding is saved immediately when the registry has a store; a failed
 *   save is thrown to the caller, but the binding stays in memory so the same value
 *   keeps its identifier
 */
public class TokenIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(TokenIdGenerator.class);

    /**
     * Upper bound (exclusive) of the extra distance a perturbed candidate jumps.
     */
    private static final int PERTURBATION_SPAN = 8;

    private final TokenRegistry registry;
    private final GeneratorConfig config;

    public TokenIdGenerator(TokenRegistry registry) {
        this(registry, GeneratorConfig.defaults());
    }

    public TokenIdGenerator(TokenRegistry registry, GeneratorConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * Get the identifier for a value, allocating one if the value is new.
     *
     * @param value    Raw value; canonicalized before lookup
     * @param category Category the value belongs to
     * @return Identifier such as {@code T04}
     * @throws CategoryExhaustedException   if no free suffix could be found
     * @throws RegistryPersistenceException if the new binding could not be saved
     */
    public String generateId(String value, TokenCategory category) {
        String canonical = ValueNormalizer.canonicalize(value);

        Optional<String> existing = registry.findSuffix(category, canonical);
        if (existing.isPresent()) {
            String identifier = category.prefix() + existing.get();
            log.debug("Reusing {} for '{}' in {}", identifier, canonical, category.key());
            return identifier;
        }

        int suffix = allocateSuffix(canonical, category);
        String formatted = format(suffix);
        String identifier = category.prefix() + formatted;
        registry.bind(category, canonical, formatted);
        save(identifier);

        log.debug("Generated {} for '{}' in {}", identifier, canonical, category.key());
        return identifier;
    }

    /**
     * Generate (or reuse) an identifier and return it as a full token.
     */
    public Token token(String value, TokenCategory category) {
        String identifier = generateId(value, category);
        return new Token(identifier, category, ValueNormalizer.canonicalize(value));
    }

    /**
     * Explicitly bind a value to an identifier.
     * <p>
     * The identifier must carry the category's prefix and must not already belong to a
     * different value in the prefix group. A numeric suffix above the counter moves the
     * counter past it, so later generated identifiers never collide with it.
     *
     * @return true if the binding is in place
     * @throws RegistryPersistenceException if the new binding could not be saved
     */
    public boolean registerId(String value, TokenCategory category, String identifier) {
        if (identifier == null || identifier.length() < 2) {
            log.warn("Cannot register malformed identifier '{}'", identifier);
            return false;
        }
        if (!identifier.startsWith(category.prefix())) {
            log.warn("Identifier '{}' does not carry prefix '{}' of category {}",
                    identifier, category.prefix(), category.key());
            return false;
        }

        String canonical = ValueNormalizer.canonicalize(value);
        String suffix = identifier.substring(category.prefix().length());

        Optional<Token> owner = findOwner(category, suffix);
        if (owner.isPresent()) {
            Token current = owner.get();
            if (current.category() == category && current.canonicalValue().equals(canonical)) {
                log.debug("{} already bound to '{}' in {}", identifier, canonical, category.key());
                return true;
            }
            log.warn("Identifier {} is already bound to {}", identifier, current);
            return false;
        }

        registry.bind(category, canonical, suffix);
        save(identifier);
        log.debug("Registered {} for '{}' in {}", identifier, canonical, category.key());
        return true;
    }

    /**
     * Look up the value and category behind an identifier.
     * Malformed identifiers and unknown prefixes resolve to empty.
     */
    public Optional<Token> resolve(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            log.warn("Invalid identifier format: '{}'", identifier);
            return Optional.empty();
        }

        String prefix = identifier.substring(0, 1);
        if (TokenCategory.forPrefix(prefix).isEmpty()) {
            log.warn("Unknown category prefix '{}' in '{}'", prefix, identifier);
            return Optional.empty();
        }

        String suffix = identifier.substring(1);
        for (TokenCategory category : TokenCategory.forPrefix(prefix)) {
            Optional<String> value = registry.findValue(category, suffix);
            if (value.isPresent()) {
                return Optional.of(new Token(identifier, category, value.get()));
            }
        }

        log.debug("No value bound to '{}'", identifier);
        return Optional.empty();
    }

    public TokenRegistry getRegistry() {
        return registry;
    }

    private void save(String identifier) {
        try {
            registry.save();
        } catch (RegistryPersistenceException e) {
            throw new RegistryPersistenceException("Identifier " + identifier + " could not be saved", e);
        }
    }

    private int allocateSuffix(String canonical, TokenCategory category) {
        int counter = 0;
        for (TokenCategory member : category.prefixGroup()) {
            counter = Math.max(counter, registry.counter(member));
        }

        long seed = hash(canonical);
        int candidate = counter + 1;

        for (int attempt = 0; attempt <= config.maxCollisionRetries(); attempt++) {
            if (candidate > config.maxSuffix()) {
                throw new CategoryExhaustedException(category, "Category '" + category.key()
                        + "' has no suffix left below " + config.maxSuffix());
            }
            Optional<Token> owner = findOwner(category, format(candidate));
            if (owner.isEmpty()) {
                return candidate;
            }
            log.debug("Suffix {} in {} is taken by {}, perturbing (attempt {})",
                    candidate, category.key(), owner.get(), attempt + 1);
            candidate = perturb(candidate, seed, category, attempt + 1);
        }

        throw new CategoryExhaustedException(category, "Category '" + category.key()
                + "' exhausted after " + config.maxCollisionRetries() + " collision retries");
    }

    private int perturb(int candidate, long seed, TokenCategory category, int attempt) {
        long secondary = hash(category.key() + "#" + attempt) ^ seed;
        return candidate + 1 + (int) Math.floorMod(secondary, (long) PERTURBATION_SPAN);
    }

    private Optional<Token> findOwner(TokenCategory category, String suffix) {
        for (TokenCategory member : category.prefixGroup()) {
            Optional<String> value = registry.findValue(member, suffix);
            if (value.isPresent()) {
                return Optional.of(new Token(member.prefix() + suffix, member, value.get()));
            }
        }
        return Optional.empty();
    }

    private String format(int suffix) {
        return String.format("%0" + config.minDigits() + "d", suffix);
    }

    /**
     * Stable 32-bit hash taken from the first bytes of the value's SHA-256 digest.
     */
    private static long hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            long result = 0;
            for (int i = 0; i < 4; i++) {
                result = (result << 8) | (bytes[i] & 0xFF);
            }
            return result;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
