package org.webcdu.cdu.model;

/**
 * {@code DEFPAR} 参数定义。
 *
 * @param name        参数名
 * @param value       参数值；原文不是合法数字时为 null（同时会产生一条 FIELD_FORMAT 诊断）
 * @param description 自由文本说明
 */
public record CduParam(String name, Double value, String description) {
}
