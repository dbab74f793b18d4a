package com.deepansh.assistant.config;

import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolRegistry;
import com.deepansh.assistant.tool.impl.CalculatorTool;
import com.deepansh.assistant.tool.impl.DocumentSearchTool;
import com.deepansh.assistant.tool.impl.ImageAnalysisTool;
import com.deepansh.assistant.tool.impl.ImageGenerationTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ToolConfigTest {

    private final AgentProperties agentProperties = new AgentProperties();
    private final ToolProperties toolProperties = new ToolProperties();

    @Test
    void toolRegistry_multimodalDisabled_dropsImageTools() {
        agentProperties.setMultimodalEnabled(false);
        List<AgentTool> beans = List.of(new CalculatorTool(), new ImageAnalysisTool());

        ToolRegistry registry = new ToolConfig()
                .toolRegistry(beans, agentProperties, toolProperties, new ObjectMapper());

        assertThat(registry.contains("calculator")).isTrue();
        assertThat(registry.contains("analyze_image")).isFalse();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void isEnabled_honoursPerToolSwitches() {
        DocumentSearchTool documents = mock(DocumentSearchTool.class);
        ImageGenerationTool generation = mock(ImageGenerationTool.class);

        assertThat(ToolConfig.isEnabled(documents, agentProperties, toolProperties)).isTrue();
        assertThat(ToolConfig.isEnabled(generation, agentProperties, toolProperties)).isTrue();

        toolProperties.getDocuments().setEnabled(false);
        toolProperties.getImage().setGenerationEnabled(false);

        assertThat(ToolConfig.isEnabled(documents, agentProperties, toolProperties)).isFalse();
        assertThat(ToolConfig.isEnabled(generation, agentProperties, toolProperties)).isFalse();
        assertThat(ToolConfig.isEnabled(new CalculatorTool(), agentProperties, toolProperties)).isTrue();
    }
}
