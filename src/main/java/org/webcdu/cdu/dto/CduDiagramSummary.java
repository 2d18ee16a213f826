package org.webcdu.cdu.dto;

import org.webcdu.cdu.CduDiagnostic;

import java.util.List;

/**
 * 单张图的概要信息（{@code cdu_list_diagrams} 的列表元素）。
 *
 * @param index       图序号（从 0 开始），可作为 {@code cdu_import_file} 的 diagramIndex
 * @param id          图编号
 * @param name        图名称
 * @param imports     IMPORT 块数
 * @param exports     EXPORT 块数
 * @param entries     ENTRAD 块数
 * @param blocks      内部块数
 * @param params      DEFPAR 数
 * @param defaults    DEFVAL 数
 * @param variables   图内产生的变量
 * @param diagnostics 该图的解析诊断（无诊断时为 null）
 */
public record CduDiagramSummary(
        int index,
        Integer id,
        String name,
        int imports,
        int exports,
        int entries,
        int blocks,
        int params,
        int defaults,
        List<String> variables,
        List<CduDiagnostic> diagnostics
) {
}
