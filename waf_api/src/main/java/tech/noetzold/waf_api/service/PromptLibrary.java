package tech.noetzold.waf_api.service;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Instruction texts shipped under {@code classpath:prompts/}.
 */
@Component
public class PromptLibrary {

    private final String fastEngineDefault;
    private final String deepEngineDefault;
    private final String scoutSystem;
    private final String adaptSystem;

    public PromptLibrary() {
        this.fastEngineDefault = load("prompts/fast-engine-default.txt");
        this.deepEngineDefault = load("prompts/deep-engine-default.txt");
        this.scoutSystem = load("prompts/scout-system.txt");
        this.adaptSystem = load("prompts/adapt-system.txt");
    }

    public String fastEngineDefault() {
        return fastEngineDefault;
    }

    public String deepEngineDefault() {
        return deepEngineDefault;
    }

    public String scoutSystem() {
        return scoutSystem;
    }

    public String adaptSystem() {
        return adaptSystem;
    }

    private static String load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Missing prompt resource " + path, e);
        }
    }
}
