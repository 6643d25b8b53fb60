package me.golemcore.pilot.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.component.ToolComponent;
import me.golemcore.pilot.domain.component.ToolRegistry;
import me.golemcore.pilot.domain.service.RuntimeEventService;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.ConversationStorePort;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public StructuredOutputReader structuredOutputReader(ObjectMapper objectMapper) {
        return new StructuredOutputReader(objectMapper);
    }

    @Bean
    public ToolArgumentValidator toolArgumentValidator() {
        return new ToolArgumentValidator();
    }

    @Bean
    public ToolCallRepairer toolCallRepairer(LlmPort llmPort, StructuredOutputReader reader,
            PilotProperties properties) {
        PilotProperties.LlmProperties llm = properties.getLlm();
        return new ToolCallRepairer(llmPort, reader, llm.resolvePlannerModel(), llm.getTimeout());
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    /**
     * Actions registered as Spring beans. Callers may pass their own registry per
     * run instead.
     */
    @Bean
    public ToolRegistry toolRegistry(ObjectProvider<ToolComponent> toolComponents) {
        List<ToolComponent> tools = toolComponents.orderedStream().toList();
        return ToolRegistry.of(tools);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, HistoryWriter historyWriter,
            ToolArgumentValidator argumentValidator, ToolCallRepairer callRepairer,
            ConversationStorePort conversationStore, RuntimeEventService runtimeEventService,
            PilotProperties properties, Clock clock) {
        return new DefaultToolLoopSystem(llmPort, historyWriter, argumentValidator, callRepairer,
                conversationStore, runtimeEventService, properties.getToolLoop(), properties.getLlm(), clock);
    }
}
