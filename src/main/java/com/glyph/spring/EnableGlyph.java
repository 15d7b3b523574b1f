package com.glyph.spring;

import com.glyph.adapter.spring.GlyphAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the Glyph compiler beans: {@code GlyphConfig}, {@code TokenRegistry},
 * {@code TokenIdGenerator}, {@code SemanticMapper} and {@code GlyphCompiler}.
 * <p>
 * All of them share one token registry, so identifiers handed out through the
 * compiler and through the generator bean never clash. Any of the beans can be
 * replaced by declaring your own; the others are then built on top of it.
 * The registry file comes from {@code glyph.registry-path} when set, otherwise
 * from the YAML file named by {@code glyph.config-path}.
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableGlyph
 * public class ReleaseNotesApplication {
 *     public ReleaseNotesApplication(GlyphCompiler compiler) { ... }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(GlyphAutoConfiguration.class)
public @interface EnableGlyph {
}
