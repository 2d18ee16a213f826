package org.webcdu.cdu;

import java.util.ArrayList;
import java.util.List;

/**
 * 非致命诊断信息：解析/投影/生成过程中发现的问题，不会中断整体流程。
 *
 * @param line    输入文本中的物理行号（从 1 开始）；与源文本无关的问题（连线解析、文本生成）为 null
 * @param kind    诊断类别
 * @param message 可读说明
 */
public record CduDiagnostic(Integer line, Kind kind, String message) {

    public enum Kind {
        /** 数值字段（图编号、参数值）不是合法数字 */
        FIELD_FORMAT,
        /** 单行解码失败，该行（连同其续行）被跳过 */
        LINE_DECODE,
        /** 类型列为空、又不属于任何块的孤立行 */
        ORPHAN_LINE,
        /** 块编号重复，后出现的块被丢弃 */
        DUPLICATE_BLOCK,
        /** 固定续行数的块在 FIMCDU/段尾之前没有取满续行 */
        TRUNCATED_CONTINUATION,
        /** 未闭合的 DCDU 段被丢弃 */
        DISCARDED_SECTION,
        /** 输入变量找不到产生者，未生成连线 */
        UNRESOLVED_VARIABLE,
        /** 文本生成时遇到不认识的块类型 */
        UNKNOWN_BLOCK_TYPE,
        /** 文本生成时块缺少必需的输入变量 */
        MISSING_INPUT,
        /** 输入因字节上限被截断 */
        TRUNCATED_INPUT,
        /** 输入不是 UTF-8，使用了备用字符集解码 */
        CHARSET,
        /** 诊断条数超过上限，其余被省略 */
        TRUNCATED_DIAGNOSTICS
    }

    public static CduDiagnostic at(int line, Kind kind, String message) {
        return new CduDiagnostic(line, kind, message);
    }

    public static CduDiagnostic of(Kind kind, String message) {
        return new CduDiagnostic(null, kind, message);
    }

    /**
     * 按上限截断诊断列表，超出部分以一条 {@link Kind#TRUNCATED_DIAGNOSTICS} 代替；空列表返回 null。
     */
    public static List<CduDiagnostic> limit(List<CduDiagnostic> diagnostics, int maxDiagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return null;
        }
        if (maxDiagnostics <= 0 || diagnostics.size() <= maxDiagnostics) {
            return List.copyOf(diagnostics);
        }
        List<CduDiagnostic> result = new ArrayList<>(diagnostics.subList(0, maxDiagnostics));
        result.add(of(Kind.TRUNCATED_DIAGNOSTICS,
                "诊断信息过多，已省略 " + (diagnostics.size() - maxDiagnostics) + " 条。"));
        return List.copyOf(result);
    }
}
