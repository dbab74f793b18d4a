package com.deepansh.assistant;

import com.deepansh.assistant.config.AgentProperties;
import com.deepansh.assistant.config.LlmProperties;
import com.deepansh.assistant.config.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class, ToolProperties.class})
public class ConversationalAssistantApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConversationalAssistantApplication.class, args);
    }
}
