package com.fleetdeploy.orchestrator.template;

/**
 * A template could not be rendered. This is a configuration defect, never an
 * execution problem: it is not retried and no remote call is made after it.
 */
public class RenderException extends RuntimeException {

    public enum Kind { MISSING_BINDING, UNKNOWN_TEMPLATE }

    private final Kind   kind;
    private final String templateName;
    private final String name;

    private RenderException(Kind kind, String templateName, String name, String message) {
        super(message);
        this.kind         = kind;
        this.templateName = templateName;
        this.name         = name;
    }

    public static RenderException missingBinding(String templateName, String placeholder) {
        return new RenderException(Kind.MISSING_BINDING, templateName, placeholder,
                "MissingBinding(\"" + placeholder + "\") in template '" + templateName + "'");
    }

    public static RenderException unknownTemplate(String templateName) {
        return new RenderException(Kind.UNKNOWN_TEMPLATE, templateName, templateName,
                "Unknown command template '" + templateName + "'");
    }

    public Kind getKind()            { return kind; }
    public String getTemplateName()  { return templateName; }

    /** The unbound placeholder, or the unknown template name. */
    public String getName()          { return name; }
}
