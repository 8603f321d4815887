package com.fleetdeploy.orchestrator.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named command templates, loaded from {@code classpath:templates/<name>.sh}.
 *
 * Each template is read once and kept; the bodies are immutable strings.
 */
@Component
public class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final String location;
    private final Map<String, CommandTemplate> loaded = new ConcurrentHashMap<>();

    public TemplateCatalog() {
        this("templates");
    }

    public TemplateCatalog(String location) {
        this.location = location;
    }

    /**
     * @throws RenderException UNKNOWN_TEMPLATE if no such resource exists
     */
    public CommandTemplate get(String name) {
        return loaded.computeIfAbsent(name, this::load);
    }

    private CommandTemplate load(String name) {
        ClassPathResource resource = new ClassPathResource(location + "/" + name + ".sh");
        if (!resource.exists()) {
            throw RenderException.unknownTemplate(name);
        }
        try (InputStream in = resource.getInputStream()) {
            String body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.info("Loaded command template '{}' ({} chars)", name, body.length());
            return new CommandTemplate(name, body);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read template " + resource.getPath(), e);
        }
    }
}
