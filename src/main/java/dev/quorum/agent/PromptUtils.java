package dev.quorum.agent;

/**
 * Shared prompt construction for every agent row.
 */
public final class PromptUtils {

    private PromptUtils() {}

    /**
     * Builds a complete prompt: role instructions + response contract + diff.
     */
    public static String render(AgentDefinition agent, String diffText) {
        return agent.instructions()
                + "\n\n" + PromptTemplates.RESPONSE_CONTRACT
                + "\n\n--- CHANGES ---\n"
                + diffText
                + "\n--- END CHANGES ---";
    }
}
