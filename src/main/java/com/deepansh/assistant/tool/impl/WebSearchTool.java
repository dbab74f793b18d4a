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
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Web search backed by the Brave Search API.
 *
 * Without BRAVE_API_KEY the tool stays registered and answers with a
 * configuration hint, so the model can fall back to what it knows.
 */
@Component
@Slf4j
public class WebSearchTool implements AgentTool {

    private final ToolProperties.WebSearch.Brave brave;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public WebSearchTool(ToolProperties toolProperties, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.brave = toolProperties.getWebSearch().getBrave();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(brave.getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return "web_search";
    }

    @Override
    public String getDescription() {
        return "在互联网上搜索信息。当用户询问最新新闻、实时信息或本地知识库无法回答的问题时使用。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("query")
                        .description("搜索查询，越具体结果越好")
                        .build(),
                ToolParameter.builder()
                        .name("count")
                        .type("integer")
                        .description("返回结果数量（1-10），默认" + brave.getMaxResults())
                        .required(false)
                        .build()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) throws Exception {
        String apiKey = brave.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return "错误: 未配置网络搜索 API Key。请设置环境变量 BRAVE_API_KEY "
                    + "(免费申请: https://api.search.brave.com/register)";
        }

        String query = ToolArguments.string(arguments, "query", "");
        int count = Math.min(Math.max(ToolArguments.integer(arguments, "count", brave.getMaxResults()), 1), 10);

        log.info("Web search: query='{}' count={}", query, count);

        String url = UriComponentsBuilder.fromPath("/web/search")
                .queryParam("q", query)
                .queryParam("count", count)
                .queryParam("text_decorations", false)
                .build()
                .toUriString();

        String responseBody = restClient.get()
                .uri(url)
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .body(String.class);

        return formatResults(responseBody, query);
    }

    String formatResults(String responseBody, String query) throws Exception {
        JsonNode results = objectMapper.readTree(responseBody == null ? "{}" : responseBody)
                .path("web").path("results");

        if (!results.isArray() || results.isEmpty()) {
            return "未找到与 '" + query + "' 相关的网络结果。";
        }

        List<String> formatted = new ArrayList<>();
        int index = 1;
        for (JsonNode result : results) {
            formatted.add(String.format("""
                    【结果 %d】
                    标题: %s
                    来源: %s
                    摘要: %s""",
                    index++,
                    result.path("title").asText("无标题"),
                    result.path("url").asText(""),
                    result.path("description").asText("无摘要")));
        }
        return "网络搜索结果 (查询: " + query + "):\n\n" + String.join("\n\n", formatted);
    }
}
