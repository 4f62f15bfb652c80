package dev.quorum.infrastructure.ai;

import dev.quorum.agent.AgentCallResult;
import dev.quorum.domain.enums.AgentRole;
import dev.quorum.infrastructure.crypto.ApiCredential;

/**
 * One call to the remote model. Implementations never throw for provider
 * failures; they classify them into the returned tag.
 */
public interface ModelInvoker {

    AgentCallResult invoke(AgentRole role, String prompt, ApiCredential credential);
}
