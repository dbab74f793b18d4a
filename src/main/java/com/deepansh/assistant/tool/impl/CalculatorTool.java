package com.deepansh.assistant.tool.impl;

import com.deepansh.assistant.tool.AgentTool;
import com.deepansh.assistant.tool.ToolArguments;
import com.deepansh.assistant.tool.ToolParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Evaluates arithmetic expressions: + - * / // % ** and parentheses, plus
 * abs, round, min, max, sum, pow, sqrt, sin, cos, tan, log, log10, exp and
 * the constants pi and e.
 *
 * Integral results are printed without a fractional part ("2+2 = 4").
 */
@Component
@Slf4j
public class CalculatorTool implements AgentTool {

    @Override
    public String getName() {
        return "calculator";
    }

    @Override
    public String getDescription() {
        return "执行数学计算。支持基本运算（加减乘除）和高级运算（幂、开方、三角函数等）。";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.builder()
                .name("expression")
                .description("数学表达式，如 '2 + 3 * 4' 或 'sqrt(16)'")
                .build());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String expression = ToolArguments.string(arguments, "expression", "");
        try {
            double result = ExpressionEvaluator.evaluate(expression);
            return "计算结果: " + expression + " = " + format(result);
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.debug("Calculation failed for '{}': {}", expression, e.getMessage());
            return "计算错误: " + e.getMessage();
        }
    }

    /**
     * Integral values below 1e16 print without a decimal point; magnitudes of
     * 1e16 and above or below 1e-4 print in scientific form, e.g. {@code 1e+20}.
     */
    static String format(double value) {
        double magnitude = Math.abs(value);
        if (magnitude >= 1e16 || (magnitude < 1e-4 && value != 0)) {
            return scientific(value);
        }
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String scientific(double value) {
        // Double.toString always uses the E form in these ranges, e.g. "1.5E20"
        String[] parts = Double.toString(value).split("E");
        String mantissa = parts[0].endsWith(".0") ? parts[0].substring(0, parts[0].length() - 2) : parts[0];
        int exponent = Integer.parseInt(parts[1]);
        String digits = String.format("%02d", Math.abs(exponent));
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + digits;
    }
}
