package com.deepansh.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the built-in tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Documents documents = new Documents();
    private WebSearch webSearch = new WebSearch();
    private Image image = new Image();

    @Data
    public static class Documents {
        private boolean enabled = true;
        private String path = "./data/docs";
        private String extensions = ".txt,.md,.json";
        private int topK = 3;

        public List<String> getExtensionList() {
            if (extensions == null || extensions.isBlank()) return List.of();
            return Arrays.stream(extensions.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .map(s -> s.startsWith(".") ? s : "." + s)
                    .toList();
        }
    }

    @Data
    public static class WebSearch {
        private Brave brave = new Brave();

        @Data
        public static class Brave {
            private String apiKey = "";
            private String baseUrl = "https://api.search.brave.com/res/v1";
            private int maxResults = 5;
        }
    }

    @Data
    public static class Image {
        private boolean generationEnabled = true;
        private String dashscopeApiKey = "";
        private String baseUrl = "https://dashscope.aliyuncs.com/api/v1";
        private String model = "wanx-v1";
        private String size = "1024*1024";
        private String saveDir = "./data/generated_images";
        private long pollIntervalMs = 2000;
        private int maxPollAttempts = 30;
    }
}
