package org.webcdu.cdu.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 图编辑器导出的精简块描述，作为 {@code cdu_export_blocks} 的输入元素。
 *
 * @param type       块类型（GAIN、INTEGRATOR、SUM、INPUT、OUTPUT，大小写不敏感）
 * @param label      块标签，作为输出行的第一个字段
 * @param inputVars  输入变量（JSON 字段 {@code vin}）
 * @param outputVar  输出变量（JSON 字段 {@code vout}）
 * @param parameters 参数表，例如 {@code {"K": 2.5}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockDescriptor(
        String type,
        String label,
        @JsonProperty("vin") List<String> inputVars,
        @JsonProperty("vout") String outputVar,
        Map<String, Object> parameters
) {
}
