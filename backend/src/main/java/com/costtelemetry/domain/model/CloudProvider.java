package com.costtelemetry.domain.model;

/**
 * Providers whose billing data lands in the infrastructure cost ledger.
 */
public enum CloudProvider {
    AWS("Amazon Web Services"),
    AZURE("Azure"),
    GCP("Google Cloud Platform"),
    OPENAI("OpenAI"),
    ANTHROPIC("Anthropic"),
    OTHER("Other");

    private final String displayName;

    CloudProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
