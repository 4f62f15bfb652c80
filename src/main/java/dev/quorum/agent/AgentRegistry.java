package dev.quorum.agent;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.valueobject.ReviewSettings;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed agent table. Adding an agent means adding a role and a row here;
 * the dispatcher drives every row the same way.
 */
@Component
public class AgentRegistry {

    private final Map<AgentRole, AgentDefinition> definitions;

    public AgentRegistry() {
        EnumMap<AgentRole, AgentDefinition> table = new EnumMap<>(AgentRole.class);
        table.put(AgentRole.SECURITY, new AgentDefinition(AgentRole.SECURITY, PromptTemplates.SECURITY));
        table.put(AgentRole.LOGIC, new AgentDefinition(AgentRole.LOGIC, PromptTemplates.LOGIC));
        table.put(AgentRole.PERFORMANCE, new AgentDefinition(AgentRole.PERFORMANCE, PromptTemplates.PERFORMANCE));
        table.put(AgentRole.STYLE, new AgentDefinition(AgentRole.STYLE, PromptTemplates.STYLE));
        this.definitions = Collections.unmodifiableMap(table);
    }

    public AgentDefinition definition(AgentRole role) {
        return definitions.get(role);
    }

    /** All definitions in priority order. */
    public List<AgentDefinition> all() {
        return List.copyOf(definitions.values());
    }

    public List<AgentDefinition> enabledFor(ReviewSettings settings) {
        return definitions.values().stream()
                .filter(d -> settings.isEnabled(d.role()))
                .toList();
    }
}
