package org.webcdu.cdu.model;

/**
 * {@code DEFVAL} 默认值定义。{@code operand1} 可以是数字字面量，也可以是参数名（惰性解析）。
 */
public record CduDefaultValue(String subtype, String defaultVar, String operand1, char operator, String operand2) {
}
