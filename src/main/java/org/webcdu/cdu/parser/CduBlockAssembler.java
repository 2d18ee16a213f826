package org.webcdu.cdu.parser;

import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.CduFieldFormatException;
import org.webcdu.cdu.model.CduBlock;
import org.webcdu.cdu.model.CduDefaultValue;
import org.webcdu.cdu.model.CduDiagram;
import org.webcdu.cdu.model.CduParam;
import org.webcdu.cdu.record.CduRecordDecoder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把一张图的行列表组装成 {@link CduDiagram}。
 * <p>
 * 处理顺序：
 * <ol>
 *   <li>第 0 行固定是图头（编号 + 名称）。</li>
 *   <li>{@code DEFPAR}/{@code DEFVAL} 行进入参数表/默认值表，不会开启新块。</li>
 *   <li>其余行按块记录解码，再按 {@link ContinuationProfile} 吞掉续行。</li>
 *   <li>续行：状态标记总是追加；输入变量、P1..P4 非空时追加；输出变量非空时覆盖。</li>
 *   <li>按类型归类：ENTRAD、EXPORT、IMPORT，其余为内部块。</li>
 * </ol>
 * 单行出错不会中断整张图：出错的行（连同其续行）被跳过，并在诊断列表中记录行号与原因。
 */
public final class CduBlockAssembler {

    private CduBlockAssembler() {
    }

    public record Assembly(CduDiagram diagram, List<CduDiagnostic> diagnostics) {
    }

    public static Assembly assemble(CduSection section) {
        return assemble(section, ContinuationProfile.EXTENDED);
    }

    public static Assembly assemble(CduSection section, ContinuationProfile profile) {
        ContinuationProfile resolvedProfile = profile == null ? ContinuationProfile.EXTENDED : profile;
        List<CduDiagnostic> diagnostics = new ArrayList<>();
        List<SourceLine> lines = section.lines();

        SourceLine headerLine = section.header();
        CduRecordDecoder.HeaderLine header = CduRecordDecoder.decodeHeader(headerLine.text());
        Integer id = null;
        try {
            id = CduRecordDecoder.parseDiagramId(header.rawId());
        } catch (CduFieldFormatException e) {
            diagnostics.add(CduDiagnostic.at(headerLine.number(), CduDiagnostic.Kind.FIELD_FORMAT,
                    "图编号不是合法数字：'" + e.getRawValue() + "'"));
        }

        List<CduParam> params = new ArrayList<>();
        List<CduDefaultValue> defaults = new ArrayList<>();
        List<CduBlock> imports = new ArrayList<>();
        List<CduBlock> exports = new ArrayList<>();
        List<CduBlock> entries = new ArrayList<>();
        List<CduBlock> blocks = new ArrayList<>();
        Map<Integer, Integer> seenNumbers = new HashMap<>();

        int i = 1;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            i++;
            String text = line.text();
            if (CduSectionExtractor.isCommentOrBlank(text) || CduSectionExtractor.isEndLine(text)) {
                continue;
            }
            if (CduRecordDecoder.isDefParLine(text)) {
                params.add(toParam(line, diagnostics));
                continue;
            }
            if (CduRecordDecoder.isDefValLine(text)) {
                defaults.add(toDefaultValue(line));
                continue;
            }

            CduRecordDecoder.BlockLine head;
            try {
                head = CduRecordDecoder.decodeBlock(text);
            } catch (RuntimeException e) {
                diagnostics.add(CduDiagnostic.at(line.number(), CduDiagnostic.Kind.LINE_DECODE,
                        "块记录解码失败，已跳过：" + e.getMessage()));
                continue;
            }
            if (!head.hasBlockType()) {
                diagnostics.add(CduDiagnostic.at(line.number(), CduDiagnostic.Kind.ORPHAN_LINE,
                        "类型列为空且不属于任何块，已跳过。"));
                continue;
            }

            BlockDraft draft = new BlockDraft(head, line.number());
            i = consumeContinuations(lines, i, draft, resolvedProfile.ruleFor(head.blockType()), diagnostics);

            int number;
            try {
                number = CduRecordDecoder.parseBlockNumber(head.rawNumber());
            } catch (CduFieldFormatException e) {
                diagnostics.add(CduDiagnostic.at(line.number(), CduDiagnostic.Kind.LINE_DECODE,
                        "块编号不是合法数字：'" + e.getRawValue() + "'，块 " + head.blockType() + " 已跳过。"));
                continue;
            }
            Integer firstLine = seenNumbers.putIfAbsent(number, line.number());
            if (firstLine != null) {
                diagnostics.add(CduDiagnostic.at(line.number(), CduDiagnostic.Kind.DUPLICATE_BLOCK,
                        "块编号 " + number + " 已在第 " + firstLine + " 行使用，重复的块已丢弃。"));
                continue;
            }

            CduBlock block = draft.toBlock(number);
            switch (block.blockType().toUpperCase(Locale.ROOT)) {
                case "ENTRAD" -> entries.add(block);
                case "EXPORT" -> exports.add(block);
                case "IMPORT" -> imports.add(block);
                default -> blocks.add(block);
            }
        }

        CduDiagram diagram = new CduDiagram(id, header.name(), params, defaults, imports, exports, entries, blocks);
        return new Assembly(diagram, diagnostics);
    }

    /**
     * 按续行规则吞掉后续行，返回下一条待处理行的下标。
     */
    private static int consumeContinuations(List<SourceLine> lines,
                                            int index,
                                            BlockDraft draft,
                                            ContinuationProfile.Rule rule,
                                            List<CduDiagnostic> diagnostics) {
        int i = index;
        switch (rule.kind()) {
            case FIXED -> {
                int taken = 0;
                while (taken < rule.count()) {
                    if (i >= lines.size() || CduSectionExtractor.isEndLine(lines.get(i).text())) {
                        diagnostics.add(CduDiagnostic.at(draft.line, CduDiagnostic.Kind.TRUNCATED_CONTINUATION,
                                draft.blockType + " 需要 " + rule.count() + " 行续行，实际只有 " + taken + " 行。"));
                        break;
                    }
                    SourceLine next = lines.get(i);
                    i++;
                    if (CduSectionExtractor.isCommentOrBlank(next.text())) {
                        continue;
                    }
                    draft.addContinuation(CduRecordDecoder.decodeBlock(next.text()));
                    taken++;
                }
            }
            case VARIABLE -> {
                while (i < lines.size()) {
                    SourceLine next = lines.get(i);
                    if (CduSectionExtractor.isCommentOrBlank(next.text())) {
                        i++;
                        continue;
                    }
                    if (CduSectionExtractor.isEndLine(next.text())
                            || !CduRecordDecoder.blockTypeColumn(next.text()).isEmpty()) {
                        break;
                    }
                    draft.addContinuation(CduRecordDecoder.decodeBlock(next.text()));
                    i++;
                }
            }
            case NONE -> {
                // 单行块
            }
        }
        return i;
    }

    private static CduParam toParam(SourceLine line, List<CduDiagnostic> diagnostics) {
        CduRecordDecoder.ParamLine decoded = CduRecordDecoder.decodeParam(line.text());
        Double value = null;
        try {
            value = CduRecordDecoder.parseParamValue(decoded.rawValue());
        } catch (CduFieldFormatException e) {
            diagnostics.add(CduDiagnostic.at(line.number(), CduDiagnostic.Kind.FIELD_FORMAT,
                    "参数 " + decoded.name() + " 的值不是合法数字：'" + e.getRawValue() + "'"));
        }
        return new CduParam(decoded.name(), value, decoded.description());
    }

    private static CduDefaultValue toDefaultValue(SourceLine line) {
        CduRecordDecoder.DefaultValueLine decoded = CduRecordDecoder.decodeDefaultValue(line.text());
        return new CduDefaultValue(
                decoded.subtype(),
                decoded.defaultVar(),
                decoded.operand1(),
                decoded.operator(),
                decoded.operand2()
        );
    }

    /**
     * 组装中的块：收集首行与续行的字段，最后一次性生成不可变的 {@link CduBlock}。
     */
    private static final class BlockDraft {

        private final CduRecordDecoder.BlockLine head;
        private final String blockType;
        private final int line;
        private final List<Character> stateFlags = new ArrayList<>();
        private final List<String> inputVars = new ArrayList<>();
        private final List<String> p1 = new ArrayList<>();
        private final List<String> p2 = new ArrayList<>();
        private final List<String> p3 = new ArrayList<>();
        private final List<String> p4 = new ArrayList<>();
        private String outputVar;

        private BlockDraft(CduRecordDecoder.BlockLine head, int line) {
            this.head = head;
            this.blockType = head.blockType();
            this.line = line;
            this.outputVar = head.outputVar();
            collect(head);
        }

        private void addContinuation(CduRecordDecoder.BlockLine continuation) {
            collect(continuation);
            if (!continuation.outputVar().isEmpty()) {
                outputVar = continuation.outputVar();
            }
        }

        private void collect(CduRecordDecoder.BlockLine record) {
            stateFlags.add(record.stateFlag());
            addIfPresent(inputVars, record.inputVar());
            addIfPresent(p1, record.p1());
            addIfPresent(p2, record.p2());
            addIfPresent(p3, record.p3());
            addIfPresent(p4, record.p4());
        }

        private CduBlock toBlock(int number) {
            return new CduBlock(
                    number,
                    head.inputFlag(),
                    head.blockType(),
                    head.outputFlag(),
                    head.subtype(),
                    stateFlags,
                    inputVars,
                    outputVar,
                    p1,
                    p2,
                    p3,
                    p4,
                    head.vmin(),
                    head.vmax(),
                    line
            );
        }

        private static void addIfPresent(List<String> target, String value) {
            if (!value.isEmpty()) {
                target.add(value);
            }
        }
    }
}
