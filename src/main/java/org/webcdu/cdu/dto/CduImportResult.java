package org.webcdu.cdu.dto;

import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.dto.graph.GraphDocument;
import org.webcdu.cdu.model.CduDefaultValue;
import org.webcdu.cdu.model.CduParam;

import java.util.List;

/**
 * {@code cdu_import_file}/{@code cdu_import_text} 的返回结果。
 *
 * @param rootId       根目录标识（文本导入时为 null）
 * @param path         相对 root 的路径（统一使用 / 分隔；文本导入时为 null）
 * @param truncated    是否因为 readMaxBytes 只读取了文件前半段
 * @param decodedWith  文件字节使用的解码字符集（文本导入时为 null）
 * @param diagramIndex 导入的图序号（从 0 开始）
 * @param diagramCount 输入中完整图的数量
 * @param diagramId    图编号（头行编号不合法时为 null）
 * @param diagramName  图名称
 * @param params       DEFPAR 参数表
 * @param defaults     DEFVAL 默认值表
 * @param graph        节点/连线文档
 * @param diagnostics  非致命诊断（无诊断时为 null）
 */
public record CduImportResult(
        String rootId,
        String path,
        boolean truncated,
        String decodedWith,
        int diagramIndex,
        int diagramCount,
        Integer diagramId,
        String diagramName,
        List<CduParam> params,
        List<CduDefaultValue> defaults,
        GraphDocument graph,
        List<CduDiagnostic> diagnostics
) {
}
