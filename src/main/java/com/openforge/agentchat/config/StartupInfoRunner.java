package com.openforge.agentchat.config;

import com.openforge.agentchat.llm.LlmProperties;
import com.openforge.agentchat.tool.AgentTool;
import com.openforge.agentchat.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reports:
 *   - Runtime: server port, Java version
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Tools: each registered tool with its enabled flag
 *   - Classifier mode: LLM or keyword rules
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final AgentProperties agentProperties;
    private final LlmProperties   llmProperties;
    private final ToolRegistry    toolRegistry;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");
        String tools = toolRegistry.getAll().stream()
                .map(t -> t.name() + (t.isEnabled() ? " ✔" : " ✘"))
                .collect(Collectors.joining(", "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║          Agentic Chat Assistant  :  Startup Summary      ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    Version        : {}
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    WebSocket      : /api/v1/ws/{connection_id}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Agent                                                   ║
                ║    Tools          : {}
                ║    Classifier     : {}
                ║    Tool pool      : {} threads, {}s per tool
                ╚══════════════════════════════════════════════════════════╝
                """,
                agentProperties.app().version(),
                port,
                javaVersion,

                describe(llmProperties.primary()),
                describe(llmProperties.fallback()),

                tools.isEmpty() ? "(none)" : tools,
                llmProperties.primaryConfigured() ? "LLM" : "keyword rules",
                agentProperties.tools().poolSize(), agentProperties.tools().timeoutSeconds()
        );

        if (!agentProperties.tools().coversLlmCalls(llmProperties)) {
            log.warn("[Startup] agent.tools.timeout-seconds={} is below the LLM providers' combined timeout of {}s; "
                    + "slow text generation will be reported as failed",
                    agentProperties.tools().timeoutSeconds(),
                    AgentProperties.Tools.llmBudgetSeconds(llmProperties));
        }

        if (toolRegistry.getEnabled().isEmpty()) {
            log.warn("[Startup] No enabled tools, every query will get a fallback answer. "
                    + "Set OPENAI_API_KEY to enable {}", toolRegistry.getAll().stream()
                    .map(AgentTool::name).collect(Collectors.joining(", ")));
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(LlmProperties.ProviderConfig provider) {
        if (provider == null) return "(not configured)";
        return "%s  [%s]  key=%s".formatted(provider.name(), provider.model(), maskKey(provider.apiKey()));
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is empty or looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
