package com.deepansh.assistant.config;

import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolRegistry;
import com.deepansh.assistant.tool.impl.DocumentSearchTool;
import com.deepansh.assistant.tool.impl.ImageGenerationTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the shared {@link ToolRegistry} from every AgentTool bean.
 *
 * Image tools are left out when multimodal support is off, and the document
 * and image-generation tools honour their own enable switches.
 */
@Configuration
@Slf4j
public class ToolConfig {

    @Bean
    public ToolRegistry toolRegistry(List<AgentTool> toolBeans,
                                     AgentProperties agentProperties,
                                     ToolProperties toolProperties,
                                     ObjectMapper objectMapper) {
        List<AgentTool> enabled = toolBeans.stream()
                .filter(tool -> isEnabled(tool, agentProperties, toolProperties))
                .toList();
        if (enabled.size() < toolBeans.size()) {
            log.info("Skipped {} disabled tool(s)", toolBeans.size() - enabled.size());
        }
        return new ToolRegistry(objectMapper, enabled);
    }

    static boolean isEnabled(AgentTool tool, AgentProperties agentProperties, ToolProperties toolProperties) {
        if (tool.isMultimodal() && !agentProperties.isMultimodalEnabled()) {
            return false;
        }
        if (tool instanceof DocumentSearchTool) {
            return toolProperties.getDocuments().isEnabled();
        }
        if (tool instanceof ImageGenerationTool) {
            return toolProperties.getImage().isGenerationEnabled();
        }
        return true;
    }
}
