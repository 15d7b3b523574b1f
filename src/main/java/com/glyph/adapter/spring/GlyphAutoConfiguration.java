package com.glyph.adapter.spring;

import com.glyph.compiler.GlyphCompiler;
import com.glyph.compiler.StructureSynthesizer;
import com.glyph.config.ConfigLoader;
import com.glyph.config.GlyphConfig;
import com.glyph.config.RegistryConfig;
import com.glyph.mapper.SemanticMapper;
import com.glyph.token.TokenIdGenerator;
import com.glyph.token.TokenRegistry;
import com.glyph.token.TokenRegistryFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Glyph.
 * <p>
 * The config file supplies name, registry and generator settings; {@link GlyphProperties}
 * may move the registry. On shutdown, registry changes whose save failed are retried
 * once unless {@code glyph.save-on-shutdown} is false.
 */
@Configuration
@ConditionalOnProperty(prefix = "glyph", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GlyphProperties.class)
public class GlyphAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GlyphAutoConfiguration.class);

    private final GlyphProperties properties;
    private TokenRegistry tokenRegistry;

    public GlyphAutoConfiguration(GlyphProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public GlyphConfig glyphConfig() {
        GlyphConfig config = ConfigLoader.load(properties.getConfigPath());
        if (properties.getRegistryPath() == null) {
            return config;
        }
        log.info("Registry path overridden by glyph.registry-path: '{}'", properties.getRegistryPath());
        return new GlyphConfig(config.name(), new RegistryConfig(properties.getRegistryPath()), config.generator());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenRegistry tokenRegistry(GlyphConfig config) {
        this.tokenRegistry = TokenRegistryFactory.create(config.registry());
        return this.tokenRegistry;
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenIdGenerator tokenIdGenerator(TokenRegistry registry, GlyphConfig config) {
        return new TokenIdGenerator(registry, config.generator());
    }

    @Bean
    @ConditionalOnMissingBean
    public SemanticMapper semanticMapper(TokenIdGenerator generator) {
        return new SemanticMapper(generator);
    }

    @Bean
    @ConditionalOnMissingBean
    public GlyphCompiler glyphCompiler(GlyphConfig config, TokenIdGenerator generator, SemanticMapper mapper) {
        log.info("Creating GlyphCompiler: {}", config.name());
        return new GlyphCompiler(generator, mapper, new StructureSynthesizer());
    }

    @PreDestroy
    public void shutdown() {
        if (properties.isSaveOnShutdown() && tokenRegistry != null && tokenRegistry.hasUnsavedChanges()) {
            log.info("Retrying save of unsaved token registry changes");
            tokenRegistry.persist();
        }
    }
}
