package org.webcdu.cdu.parser;

/**
 * 输入文本中的一个物理行。
 *
 * @param number 行号（从 1 开始）
 * @param text   行内容（不含换行符）
 */
public record SourceLine(int number, String text) {
}
