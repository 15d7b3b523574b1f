package com.glyph;

import com.glyph.compiler.GlyphCompiler;
import com.glyph.config.CompilationRequestLoader;
import com.glyph.mapper.CompilationRequest;
import com.glyph.spring.EnableGlyph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application: compiles the request files given as arguments,
 * or the bundled sample requests when there are none.
 */
@SpringBootApplication
@EnableGlyph
public class GlyphApplication {

    private static final Logger log = LoggerFactory.getLogger(GlyphApplication.class);

    private static final String[] SAMPLE_REQUESTS = {
            "classpath:requests/deploy-pipeline.yaml",
            "classpath:requests/command-hierarchy.yaml"
    };

    public static void main(String[] args) {
        SpringApplication.run(GlyphApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(GlyphCompiler compiler) {
        return args -> {
            String[] paths = args.length > 0 ? args : SAMPLE_REQUESTS;
            for (String path : paths) {
                CompilationRequest request = CompilationRequestLoader.load(path);
                String expression = compiler.compile(request);
                log.info("{} => {}", path, expression);
            }
        };
    }
}
