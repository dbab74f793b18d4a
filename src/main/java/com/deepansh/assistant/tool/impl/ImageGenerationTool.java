package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.config.ToolProperties;
import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Text-to-image through DashScope (Tongyi Wanxiang).
 *
 * The synthesis API is asynchronous: submit a task, poll it until it
 * succeeds or fails, then download the first result into the save folder.
 */
@Component
@Slf4j
public class ImageGenerationTool implements AgentTool {

    static final List<String> STYLES =
            List.of("auto", "photography", "portrait", "3d", "anime", "oil painting", "watercolor", "sketch");

    private final ToolProperties.Image config;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public ImageGenerationTool(ToolProperties toolProperties, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.config = toolProperties.getImage();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    public String getName() {
        return "generate_image";
    }

    @Override
    public String getDescription() {
        return "生成图片。当用户想要创建、画图、生成视觉内容时使用。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("prompt")
                        .description("图片生成的描述提示词，越详细越好")
                        .build(),
                ToolParameter.builder()
                        .name("style")
                        .description("图片风格")
                        .required(false)
                        .enumValues(STYLES)
                        .defaultValue("auto")
                        .build()
        );
    }

    @Override
    public boolean isMultimodal() {
        return true;
    }

    @Override
    public String execute(Map<String, Object> arguments) throws Exception {
        String apiKey = config.getDashscopeApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return """
                    ❌ 图片生成功能未配置

                    要使用图片生成功能，请设置环境变量 DASHSCOPE_API_KEY
                    （获取地址: https://dashscope.aliyun.com/）""";
        }

        String prompt = ToolArguments.string(arguments, "prompt", "");
        String style = ToolArguments.string(arguments, "style", "auto");

        log.info("Generating image [model={}, style={}]", config.getModel(), style);

        JsonNode submitted = submit(apiKey, prompt, style);
        String taskId = submitted.path("output").path("task_id").asText("");
        if (taskId.isEmpty()) {
            return "❌ 图片生成失败: " + submitted.path("message").asText("未返回任务ID");
        }

        JsonNode output = awaitTask(apiKey, taskId);
        if (output == null) {
            return "❌ 图片生成超时 (任务ID: " + taskId + ")";
        }
        if (!"SUCCEEDED".equals(output.path("task_status").asText())) {
            return "❌ 图片生成失败: " + output.path("message").asText("未知错误");
        }

        String imageUrl = output.path("results").path(0).path("url").asText("");
        if (imageUrl.isEmpty()) {
            return "❌ 图片生成失败: 结果中没有图片地址";
        }
        Path saved = download(imageUrl);

        return """
                ✅ 图片生成成功！

                提示词: %s
                风格: %s
                图片已保存至: %s

                你可以查看该图片，或让我分析这张图片的内容。""".formatted(prompt, style, saved);
    }

    private JsonNode submit(String apiKey, String prompt, String style) throws IOException {
        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "input", Map.of("prompt", prompt),
                "parameters", Map.of(
                        "style", "auto".equals(style) ? "<auto>" : "<" + style + ">",
                        "size", config.getSize(),
                        "n", 1));

        String response = restClient.post()
                .uri("/services/aigc/text2image/image-synthesis")
                .header("Authorization", "Bearer " + apiKey)
                .header("X-DashScope-Async", "enable")
                .header("Content-Type", "application/json")
                .body(body)
                .retrieve()
                .body(String.class);
        return objectMapper.readTree(response == null ? "{}" : response);
    }

    /** Polls until the task leaves PENDING/RUNNING; null when attempts run out. */
    private JsonNode awaitTask(String apiKey, String taskId) throws IOException, InterruptedException {
        for (int attempt = 1; attempt <= config.getMaxPollAttempts(); attempt++) {
            String response = restClient.get()
                    .uri("/tasks/{taskId}", taskId)
                    .header("Authorization", "Bearer " + apiKey)
                    .retrieve()
                    .body(String.class);
            JsonNode output = objectMapper.readTree(response == null ? "{}" : response).path("output");
            String status = output.path("task_status").asText("");
            log.debug("Image task [{}] status={} (attempt {})", taskId, status, attempt);

            if (!"PENDING".equals(status) && !"RUNNING".equals(status)) {
                return output;
            }
            Thread.sleep(config.getPollIntervalMs());
        }
        return null;
    }

    private Path download(String imageUrl) throws IOException {
        byte[] bytes = restClient.get()
                .uri(URI.create(imageUrl))
                .retrieve()
                .body(byte[].class);
        if (bytes == null || bytes.length == 0) {
            throw new IOException("empty image download from " + imageUrl);
        }
        Path dir = Path.of(config.getSaveDir());
        Files.createDirectories(dir);
        Path file = dir.resolve("generated_" + System.currentTimeMillis() + ".png");
        Files.write(file, bytes);
        log.info("Saved generated image to [{}]", file);
        return file;
    }
}
