package com.deepansh.assistant.tool;

import com.deepansh.assistant.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-indexed set of tools shared by every conversation.
 *
 * Built once by {@link com.deepansh.assistant.config.ToolConfig} and injected
 * into the agent loop; tests construct their own instance with fake tools.
 * Reads are safe from any thread. Registration is expected at startup only.
 *
 * {@code execute} never throws: unknown tools, unparseable arguments, missing
 * required parameters and tool exceptions all come back as error strings that
 * the model sees as an ordinary tool result.
 */
@Slf4j
public class ToolRegistry {

    /** Prefix of every error string produced by the registry itself. */
    public static final String ERROR_PREFIX = "错误: ";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ToolRegistry(ObjectMapper objectMapper, List<AgentTool> initialTools) {
        this(objectMapper);
        initialTools.forEach(this::register);
        log.info("Total tools registered: {}", tools.size());
    }

    /** Inserts or replaces the tool under its name. */
    public void register(AgentTool tool) {
        AgentTool previous = tools.put(tool.getName(), tool);
        if (previous != null) {
            log.info("Replaced tool: [{}]", tool.getName());
        } else {
            log.info("Registered tool: [{}]", tool.getName());
        }
    }

    public boolean unregister(String name) {
        boolean removed = tools.remove(name) != null;
        if (removed) {
            log.info("Unregistered tool: [{}]", name);
        }
        return removed;
    }

    public Optional<AgentTool> get(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /** Registered tools ordered by name. */
    public List<AgentTool> listTools() {
        return tools.values().stream()
                .sorted(Comparator.comparing(AgentTool::getName))
                .toList();
    }

    public List<ToolDefinition> getAllDefinitions() {
        return listTools().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public String execute(ToolCall toolCall) {
        return execute(toolCall.getToolName(), toolCall.getArguments());
    }

    /**
     * Executes a tool with arguments given as raw JSON object text.
     * Blank text means no arguments.
     */
    public String execute(String name, String argumentsJson) {
        AgentTool tool = tools.get(name == null ? "" : name);
        if (tool == null) {
            return unknownTool(name);
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(argumentsJson);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse arguments for tool [{}]: {}", name, e.getOriginalMessage());
            return ERROR_PREFIX + "参数解析失败 - " + e.getOriginalMessage();
        }
        return invoke(tool, arguments);
    }

    /** Executes a tool with already structured arguments. */
    public String execute(String name, Map<String, Object> arguments) {
        AgentTool tool = tools.get(name == null ? "" : name);
        if (tool == null) {
            return unknownTool(name);
        }
        return invoke(tool, arguments != null ? arguments : Map.of());
    }

    private String invoke(AgentTool tool, Map<String, Object> arguments) {
        Map<String, Object> bound = new LinkedHashMap<>(arguments);
        for (ToolParameter parameter : tool.getParameters()) {
            if (bound.get(parameter.getName()) != null) {
                continue;
            }
            if (parameter.isRequired()) {
                return ERROR_PREFIX + "缺少必需参数 - " + parameter.getName();
            }
            if (parameter.getDefaultValue() != null) {
                bound.put(parameter.getName(), parameter.getDefaultValue());
            }
        }

        log.info("Executing tool: [{}] with args: {}", tool.getName(), bound);
        try {
            String result = tool.execute(bound);
            log.debug("Tool [{}] returned: {}", tool.getName(), result);
            return result != null ? result : "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Tool [{}] was interrupted", tool.getName());
            return ERROR_PREFIX + "工具执行被中断";
        } catch (Exception e) {
            log.error("Tool [{}] failed", tool.getName(), e);
            return ERROR_PREFIX + "工具执行失败 - " + e.getMessage();
        }
    }

    private Map<String, Object> parseArguments(String argumentsJson) throws JsonProcessingException {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(argumentsJson, ARGUMENTS_TYPE);
        return parsed != null ? parsed : Map.of();
    }

    private String unknownTool(String name) {
        log.warn("Unknown tool requested: [{}] (available: {})", name, tools.keySet());
        return ERROR_PREFIX + "工具 '" + name + "' 不存在";
    }
}
