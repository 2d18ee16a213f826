package org.webcdu.cdu.dto;

import org.webcdu.cdu.CduDiagnostic;

import java.util.List;

/**
 * {@code cdu_export_blocks} 的返回结果。
 *
 * @param text        生成的 CDU 文本（空块列表时为空串）
 * @param lineCount   行数
 * @param diagnostics 非致命诊断（无诊断时为 null）
 */
public record CduExportResult(String text, int lineCount, List<CduDiagnostic> diagnostics) {
}
