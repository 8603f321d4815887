package com.fleetdeploy.orchestrator.template;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders command templates into scripts.
 *
 * Rules:
 * <ul>
 *   <li>Placeholders are {@code {{name}}} with name matching {@code [a-z][a-z0-9_]*}.</li>
 *   <li>Every placeholder must be bound; rendering is all-or-nothing.</li>
 *   <li>Extra bindings are ignored.</li>
 *   <li>Each value is inserted as one single-quoted shell word, so a value
 *       containing quotes, {@code ;} or {@code $(...)} stays a literal string.</li>
 * </ul>
 *
 * Pure: no I/O, no state, safe to share.
 */
@Component
public class CommandTemplateEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-z][a-z0-9_]*)}}");

    /**
     * @throws RenderException MISSING_BINDING for the first unbound placeholder in body order
     */
    public RenderedCommand render(CommandTemplate template, Map<String, String> bindings) {
        for (String name : placeholders(template)) {
            if (bindings.get(name) == null) {
                throw RenderException.missingBinding(template.name(), name);
            }
        }

        Matcher matcher = PLACEHOLDER.matcher(template.body());
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = bindings.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(shellQuote(value)));
        }
        matcher.appendTail(out);
        return new RenderedCommand(template.name(), out.toString());
    }

    /** Placeholder names declared by the template, in order of first use. */
    public Set<String> placeholders(CommandTemplate template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template.body());
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
