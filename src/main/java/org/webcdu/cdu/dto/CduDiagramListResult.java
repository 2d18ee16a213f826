package org.webcdu.cdu.dto;

import org.webcdu.cdu.CduDiagnostic;

import java.util.List;

/**
 * {@code cdu_list_diagrams} 的返回结果。
 *
 * @param rootId      根目录标识
 * @param path        相对 root 的路径
 * @param truncated   是否因为 readMaxBytes 只读取了文件前半段
 * @param decodedWith 解码字符集
 * @param diagrams    文件中的全部图（可能为空）
 * @param diagnostics 读取/解码阶段的诊断（无诊断时为 null）
 */
public record CduDiagramListResult(
        String rootId,
        String path,
        boolean truncated,
        String decodedWith,
        List<CduDiagramSummary> diagrams,
        List<CduDiagnostic> diagnostics
) {
}
