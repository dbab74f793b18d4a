package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Acknowledges an image question. The image itself reaches the model as a
 * multimodal user message; this tool only validates the path.
 */
@Component
public class ImageAnalysisTool implements AgentTool {

    @Override
    public String getName() {
        return "analyze_image";
    }

    @Override
    public String getDescription() {
        return "分析图片内容。当用户提供图片路径并询问图片相关问题时使用。注意：实际分析由多模态模型完成。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("image_path")
                        .description("图片文件路径")
                        .build(),
                ToolParameter.builder()
                        .name("question")
                        .description("关于图片的问题")
                        .required(false)
                        .defaultValue("请描述这张图片")
                        .build()
        );
    }

    @Override
    public boolean isMultimodal() {
        return true;
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String imagePath = ToolArguments.string(arguments, "image_path", "");
        String question = ToolArguments.string(arguments, "question", "请描述这张图片");

        if (imagePath.isBlank() || !Files.isRegularFile(Path.of(imagePath))) {
            return "❌ 图片文件不存在: " + imagePath;
        }
        return """
                📷 图片分析请求已接收

                图片路径: %s
                分析问题: %s

                提示：实际的图片分析将由多模态模型完成。
                如果当前模型不支持视觉理解，请切换到支持的模型（如 qwen-vl-plus）。""".formatted(imagePath, question);
    }
}
