package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Current date and time in the server's zone.
 *
 * The optional format accepts strftime-style directives (%Y-%m-%d) or a plain
 * {@link DateTimeFormatter} pattern (yyyy/MM/dd).
 */
@Component
public class DateTimeTool implements AgentTool {

    private static final String[] WEEKDAYS = {"星期一", "星期二", "星期三", "星期四", "星期五", "星期六", "星期日"};

    private final Clock clock;

    public DateTimeTool() {
        this(Clock.systemDefaultZone());
    }

    DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "datetime";
    }

    @Override
    public String getDescription() {
        return "获取当前日期时间或进行日期计算。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.builder()
                        .name("action")
                        .description("操作类型")
                        .enumValues(List.of("now", "date", "time", "weekday"))
                        .build(),
                ToolParameter.builder()
                        .name("format")
                        .description("日期时间格式（可选）")
                        .required(false)
                        .build()
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String action = ToolArguments.string(arguments, "action", "");
        String format = ToolArguments.string(arguments, "format");
        LocalDateTime now = LocalDateTime.now(clock);

        return switch (action) {
            case "now" -> "当前时间: " + now.format(formatter(format, "yyyy-MM-dd HH:mm:ss"));
            case "date" -> "当前日期: " + now.format(formatter(format, "yyyy-MM-dd"));
            case "time" -> "当前时间: " + now.format(formatter(format, "HH:mm:ss"));
            case "weekday" -> "今天是: " + WEEKDAYS[now.getDayOfWeek().getValue() - 1];
            default -> "未知操作: " + action;
        };
    }

    private static DateTimeFormatter formatter(String format, String defaultPattern) {
        if (format == null || format.isBlank()) {
            return DateTimeFormatter.ofPattern(defaultPattern);
        }
        return DateTimeFormatter.ofPattern(format.contains("%") ? fromStrftime(format) : format);
    }

    /** Translates strftime directives; everything else is quoted as literal text. */
    static String fromStrftime(String format) {
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                String directive = directive(format.charAt(i + 1));
                if (directive != null) {
                    flushLiteral(pattern, literal);
                    pattern.append(directive);
                    i++;
                    continue;
                }
            }
            literal.append(c);
        }
        flushLiteral(pattern, literal);
        return pattern.toString();
    }

    private static String directive(char c) {
        return switch (c) {
            case 'Y' -> "yyyy";
            case 'y' -> "yy";
            case 'm' -> "MM";
            case 'd' -> "dd";
            case 'H' -> "HH";
            case 'I' -> "hh";
            case 'M' -> "mm";
            case 'S' -> "ss";
            case 'p' -> "a";
            case 'B' -> "MMMM";
            case 'b' -> "MMM";
            case 'A' -> "EEEE";
            case 'a' -> "EEE";
            case 'j' -> "DDD";
            case '%' -> "'%'";
            default -> null;
        };
    }

    private static void flushLiteral(StringBuilder pattern, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
