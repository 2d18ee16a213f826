package org.webcdu.cdu.parser;

import org.webcdu.cdu.CduDiagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 从原始文本中切出 {@code DCDU ... FIMCDU} 段（尽力而为）。
 * <p>
 * 规则：
 * <ul>
 *   <li>以 {@code (} 开头的注释行和空行直接丢弃，不计入任何段。</li>
 *   <li>以段标记（默认 {@code DCDU}）开头的行开启一个段，其后的第一行是图头。</li>
 *   <li>{@code FIMCDU} 结束一张图；同一个段内可以连续出现多张图，直到 {@code 999999}。</li>
 *   <li>{@code 999999} 哨兵行丢弃尚未闭合的内容并退出段。</li>
 *   <li>标记嵌套、标记未闭合时，已累积的行被丢弃，只留下一条 DISCARDED_SECTION 诊断，不会输出残缺的图。</li>
 * </ul>
 * 调用方以“返回空列表”作为找不到图的信号。
 */
public final class CduSectionExtractor {

    public static final String DEFAULT_MARKER = "DCDU";
    public static final String END_MARKER = "FIMCDU";
    public static final String SENTINEL = "999999";

    private CduSectionExtractor() {
    }

    public record Extraction(List<CduSection> sections, List<CduDiagnostic> diagnostics) {
    }

    public static Extraction extract(String text) {
        return extract(text, DEFAULT_MARKER);
    }

    public static Extraction extract(String text, String marker) {
        List<CduSection> sections = new ArrayList<>();
        List<CduDiagnostic> diagnostics = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return new Extraction(sections, diagnostics);
        }
        String resolvedMarker = (marker == null || marker.isBlank())
                ? DEFAULT_MARKER
                : marker.trim().toUpperCase(Locale.ROOT);

        boolean inSection = false;
        List<SourceLine> current = new ArrayList<>();
        int lineNumber = 0;
        for (String raw : text.split("\\r?\\n|\\r", -1)) {
            lineNumber++;
            String trimmed = raw.strip();
            if (isCommentOrBlank(trimmed)) {
                continue;
            }
            String upper = trimmed.toUpperCase(Locale.ROOT);

            if (upper.equals(SENTINEL)) {
                discardPending(current, lineNumber, "遇到 999999", diagnostics);
                inSection = false;
                continue;
            }
            if (upper.startsWith(resolvedMarker)) {
                discardPending(current, lineNumber, "遇到新的 " + resolvedMarker + " 标记", diagnostics);
                inSection = true;
                continue;
            }
            if (!inSection) {
                continue;
            }

            current.add(new SourceLine(lineNumber, raw));
            if (upper.startsWith(END_MARKER)) {
                if (current.size() > 1) {
                    sections.add(new CduSection(current));
                } else {
                    diagnostics.add(CduDiagnostic.at(lineNumber, CduDiagnostic.Kind.DISCARDED_SECTION,
                            "FIMCDU 之前没有图头行，已忽略。"));
                }
                current = new ArrayList<>();
            }
        }
        discardPending(current, lineNumber, "输入已结束", diagnostics);
        return new Extraction(sections, diagnostics);
    }

    public static boolean isCommentOrBlank(String line) {
        if (line == null) {
            return true;
        }
        String trimmed = line.strip();
        return trimmed.isEmpty() || trimmed.startsWith("(");
    }

    public static boolean isEndLine(String line) {
        return line != null && line.strip().toUpperCase(Locale.ROOT).startsWith(END_MARKER);
    }

    private static void discardPending(List<SourceLine> current, int lineNumber, String reason, List<CduDiagnostic> diagnostics) {
        if (current.isEmpty()) {
            return;
        }
        diagnostics.add(CduDiagnostic.at(current.get(0).number(), CduDiagnostic.Kind.DISCARDED_SECTION,
                "第 " + current.get(0).number() + " 行开始的图在 FIMCDU 之前" + reason + "（第 " + lineNumber + " 行），已丢弃 "
                        + current.size() + " 行。"));
        current.clear();
    }
}
