package com.trustplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the agent id of a reputation call through reactive pipelines.
 *
 * <p>The Reactor Context holds the value; MDC only sees it for the duration of a
 * single log statement via {@link #withMdc(String, Runnable)}.
 *
 * <pre>
 *     return AgentLogContext.withAgentId(pipeline, agentId);
 * </pre>
 */
public final class AgentLogContext {

    public static final String AGENT_ID_KEY = "agentId";
    static final String UNKNOWN = "unknown";

    private AgentLogContext() {}

    /**
     * Stores {@code agentId} in the Reactor Context of {@code mono}. Call at the end
     * of assembly; {@code contextWrite} propagates upstream at subscription.
     */
    public static <T> Mono<T> withAgentId(Mono<T> mono, String agentId) {
        return mono.contextWrite(ctx -> ctx.put(AGENT_ID_KEY, agentId == null ? UNKNOWN : agentId));
    }

    /** Agent id from the context, or {@code "unknown"}. Never {@code null}. */
    public static String getAgentId(ContextView ctx) {
        return ctx.getOrDefault(AGENT_ID_KEY, UNKNOWN);
    }

    /**
     * Puts {@code agentId} into MDC, runs {@code logAction}, then removes it.
     * Logging side-effects only.
     */
    public static void withMdc(String agentId, Runnable logAction) {
        MDC.put(AGENT_ID_KEY, agentId);
        try {
            logAction.run();
        } finally {
            MDC.remove(AGENT_ID_KEY);
        }
    }
}
