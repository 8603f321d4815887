package com.fleetdeploy.orchestrator.template;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTemplateEngineTest {

    private final CommandTemplateEngine engine = new CommandTemplateEngine();

    @Test
    void render_substitutesEveryPlaceholderAsQuotedWord() {
        CommandTemplate t = new CommandTemplate("pull", "docker pull {{image_ref}} && echo {{image_ref}}");

        RenderedCommand cmd = engine.render(t, Map.of("image_ref", "registry/web:1.2"));

        assertThat(cmd.templateName()).isEqualTo("pull");
        assertThat(cmd.script()).isEqualTo("docker pull 'registry/web:1.2' && echo 'registry/web:1.2'");
    }

    @Test
    void render_missingBinding_namesFirstUnboundPlaceholder() {
        CommandTemplate t = new CommandTemplate("swap", "cd {{deploy_path}} && run {{container_name}} {{image_ref}}");

        assertThatThrownBy(() -> engine.render(t, Map.of("deploy_path", "/opt/app")))
                .isInstanceOf(RenderException.class)
                .hasMessage("MissingBinding(\"container_name\") in template 'swap'")
                .satisfies(e -> {
                    RenderException re = (RenderException) e;
                    assertThat(re.getKind()).isEqualTo(RenderException.Kind.MISSING_BINDING);
                    assertThat(re.getName()).isEqualTo("container_name");
                    assertThat(re.getTemplateName()).isEqualTo("swap");
                });
    }

    @Test
    void render_nullValueCountsAsMissing() {
        Map<String, String> bindings = new HashMap<>();
        bindings.put("image_ref", null);

        assertThatThrownBy(() -> engine.render(new CommandTemplate("t", "x {{image_ref}}"), bindings))
                .isInstanceOf(RenderException.class);
    }

    @Test
    void render_extraBindingsIgnored() {
        RenderedCommand cmd = engine.render(new CommandTemplate("t", "echo {{a}}"),
                Map.of("a", "1", "unused", "2"));

        assertThat(cmd.script()).isEqualTo("echo '1'");
    }

    @Test
    void render_hostileValueStaysOneLiteralWord() {
        RenderedCommand cmd = engine.render(new CommandTemplate("t", "docker pull {{image_ref}}"),
                Map.of("image_ref", "web'; rm -rf / #$(id)"));

        assertThat(cmd.script()).isEqualTo("docker pull 'web'\"'\"'; rm -rf / #$(id)'");
    }

    @Test
    void render_leavesNonPlaceholderBracesAlone() {
        CommandTemplate t = new CommandTemplate("t", "docker image inspect --format '{{.Id}}' {{image_ref}}");

        RenderedCommand cmd = engine.render(t, Map.of("image_ref", "web:1"));

        assertThat(cmd.script()).isEqualTo("docker image inspect --format '{{.Id}}' 'web:1'");
    }

    @Test
    void render_dollarAndBackslashInValueAreNotReplacementSyntax() {
        RenderedCommand cmd = engine.render(new CommandTemplate("t", "echo {{v}}"),
                Map.of("v", "$1\\n"));

        assertThat(cmd.script()).isEqualTo("echo '$1\\n'");
    }

    @Test
    void placeholders_inOrderOfFirstUse() {
        CommandTemplate t = new CommandTemplate("t", "{{b}} {{a}} {{b}} {{c_2}}");

        assertThat(engine.placeholders(t)).containsExactly("b", "a", "c_2");
    }

    @Test
    void renderedCommand_bytesAreACopy() {
        RenderedCommand cmd = engine.render(new CommandTemplate("t", "echo hi"), Map.of());

        byte[] first = cmd.bytes();
        first[0] = 'X';

        assertThat(cmd.bytes()[0]).isEqualTo((byte) 'e');
    }
}
