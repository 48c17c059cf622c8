package uk.gegc.learnpath.features.ai.domain.model;

import java.util.Locale;

/**
 * Reader personas the assistant can write for. Each carries the system-prompt preamble that sets tone and depth.
 */
public enum Audience {
    COO("coo", "COO (Operations Focus)",
            "You are explaining to a Chief Operating Officer who needs to understand technical concepts for business decisions. "
                    + "Use clear, business-focused language with operational impact examples."),
    PRODUCT_MANAGER("product_manager", "Product Manager",
            "You are explaining to a Product Manager who needs technical understanding to make product decisions. "
                    + "Focus on user impact, technical feasibility and implementation considerations."),
    PROJECT_MANAGER("project_manager", "Project Manager",
            "You are explaining to a Project Manager who needs to coordinate technical work. "
                    + "Emphasize timelines, risks, dependencies and delivery aspects."),
    FOUNDER("founder", "Founder/CEO",
            "You are explaining to a Founder/CEO who needs high-level technical understanding for strategic decisions. "
                    + "Focus on business value, competitive advantage and investment implications."),
    DELIVERY_DIRECTOR("delivery_director", "Delivery Director",
            "You are explaining to a Delivery Director who manages technical delivery. "
                    + "Emphasize quality, scalability, technical debt and operational considerations."),
    GENERAL("general", "General Business Professional",
            "You are explaining to a business professional with limited technical background. "
                    + "Use simple, clear language with practical examples.");

    private final String key;
    private final String label;
    private final String persona;

    Audience(String key, String label, String persona) {
        this.key = key;
        this.label = label;
        this.persona = persona;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public String getPersona() {
        return persona;
    }

    /**
     * Unknown or missing keys fall back to {@link #GENERAL}.
     */
    public static Audience fromKey(String key) {
        if (key == null || key.isBlank()) {
            return GENERAL;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Audience audience : values()) {
            if (audience.key.equals(normalized) || audience.name().equalsIgnoreCase(normalized)) {
                return audience;
            }
        }
        return GENERAL;
    }
}
