package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.config.ToolProperties;
import com.deepansh.assistant.search.KeywordRelevance;
import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Keyword search over a local folder of text documents.
 *
 * Documents are read into memory at startup (and on {@link #reload()}), keyed
 * by their path relative to the folder. Ranking uses {@link KeywordRelevance}.
 */
@Component
@Slf4j
public class DocumentSearchTool implements AgentTool {

    private static final int SNIPPET_LENGTH = 200;
    private static final int TITLE_LENGTH = 50;

    private final Path root;
    private final List<String> extensions;
    private final int defaultTopK;

    private volatile Map<String, String> documents = Map.of();

    @Autowired
    public DocumentSearchTool(ToolProperties toolProperties) {
        this(Path.of(toolProperties.getDocuments().getPath()),
                toolProperties.getDocuments().getExtensionList(),
                toolProperties.getDocuments().getTopK(),
                toolProperties.getDocuments().isEnabled());
    }

    DocumentSearchTool(Path root, List<String> extensions, int defaultTopK) {
        this(root, extensions, defaultTopK, true);
    }

    DocumentSearchTool(Path root, List<String> extensions, int defaultTopK, boolean enabled) {
        this.root = root;
        this.extensions = extensions;
        this.defaultTopK = defaultTopK;
        if (enabled) {
            reload();
        } else {
            log.info("Document search disabled, not loading [{}]", root);
        }
    }

    /** Re-reads the folder; returns the number of documents loaded. */
    public synchronized int reload() {
        Map<String, String> loaded = new TreeMap<>();
        if (!Files.isDirectory(root)) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                log.warn("Could not create document folder [{}]: {}", root, e.getMessage());
            }
            documents = Map.of();
            return 0;
        }

        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(this::hasSupportedExtension)
                    .forEach(file -> {
                        try {
                            String key = root.relativize(file).toString().replace('\\', '/');
                            loaded.put(key, Files.readString(file, StandardCharsets.UTF_8));
                        } catch (IOException | UncheckedIOException e) {
                            log.warn("Failed to load document [{}]: {}", file, e.getMessage());
                        }
                    });
        } catch (IOException e) {
            log.error("Failed to scan document folder [{}]", root, e);
        }

        documents = Map.copyOf(loaded);
        log.info("Loaded {} document(s) from [{}]", loaded.size(), root.toAbsolutePath());
        return loaded.size();
    }

    public int documentCount() {
        return documents.size();
    }

    @Override
    public String getName() {
        return "search_documents";
    }

    @Override
    public String getDescription() {
        return "在本地知识库中搜索相关文档。当用户询问特定主题、需要查找信息或回答需要依据时使用此工具。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("query")
                        .description("搜索查询关键词，可以是问题或关键词组合")
                        .build(),
                ToolParameter.builder()
                        .name("top_k")
                        .type("integer")
                        .description("返回结果数量，默认为" + defaultTopK)
                        .required(false)
                        .defaultValue(defaultTopK)
                        .build()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Map<String, String> snapshot = documents;
        if (snapshot.isEmpty()) {
            return "没有可搜索的文档。请确保文档目录存在且包含文档文件。";
        }
        String query = ToolArguments.string(arguments, "query", "");
        int topK = Math.max(1, ToolArguments.integer(arguments, "top_k", defaultTopK));

        List<Hit> hits = new ArrayList<>();
        snapshot.forEach((name, content) -> {
            double score = KeywordRelevance.score(query, content);
            if (score > 0) {
                hits.add(new Hit(name, content, score));
            }
        });
        hits.sort(Comparator.comparingDouble(Hit::score).reversed());

        if (hits.isEmpty()) {
            return "未找到与 '" + query + "' 相关的文档。";
        }

        List<Hit> top = hits.subList(0, Math.min(topK, hits.size()));
        StringBuilder out = new StringBuilder("找到 ").append(top.size()).append(" 条相关结果:\n\n");
        for (int i = 0; i < top.size(); i++) {
            Hit hit = top.get(i);
            out.append("【结果 ").append(i + 1).append("】\n")
                    .append("来源: ").append(hit.source()).append('\n')
                    .append("标题: ").append(title(hit)).append('\n')
                    .append("内容摘要: ").append(KeywordRelevance.snippet(query, hit.content(), SNIPPET_LENGTH))
                    .append("\n\n");
        }
        return out.toString();
    }

    private boolean hasSupportedExtension(Path file) {
        String name = file.getFileName().toString();
        return extensions.stream().anyMatch(name::endsWith);
    }

    private static String title(Hit hit) {
        String firstLine = hit.content().split("\n", 2)[0].strip();
        if (firstLine.isEmpty()) {
            return hit.source();
        }
        return firstLine.length() > TITLE_LENGTH ? firstLine.substring(0, TITLE_LENGTH) : firstLine;
    }

    private record Hit(String source, String content, double score) {
    }
}
