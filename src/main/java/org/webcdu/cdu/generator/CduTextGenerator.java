package org.webcdu.cdu.generator;

import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.dto.BlockDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把精简块描述列表生成 CDU 文本，每个块一行。
 * <p>
 * 只认识一小组块类型：
 * <ul>
 *   <li>{@code GAIN}：{@code <label> GAIN <vin> <vout> K=<K>}，K 默认 1.0</li>
 *   <li>{@code INTEGRATOR}：{@code <label> INT <vin> <vout> T=<T>}，T 默认 1.0</li>
 *   <li>{@code SUM}：{@code <label> SUM <vin> <vout>}</li>
 *   <li>{@code INPUT}：{@code <label> INP <vout>}</li>
 *   <li>{@code OUTPUT}：{@code <label> OUT <第一个输入>}</li>
 * </ul>
 * 其余类型输出一行 {@code * Unknown block type <TYPE>} 注释并记一条诊断，整体生成不会失败。
 * 生成的文本不保证能被 {@link org.webcdu.cdu.parser.CduBlockAssembler} 读回。
 */
public final class CduTextGenerator {

    public static final String LINE_SEPARATOR = "\n";

    private static final Double DEFAULT_GAIN = 1.0;
    private static final Double DEFAULT_TIME_CONSTANT = 1.0;

    private CduTextGenerator() {
    }

    /**
     * @param text        生成的文本（行之间用 {@code \n} 分隔，末尾不带换行）
     * @param lineCount   行数
     * @param diagnostics 非致命诊断
     */
    public record Generation(String text, int lineCount, List<CduDiagnostic> diagnostics) {
    }

    public static Generation generate(List<BlockDescriptor> blocks) {
        List<String> lines = new ArrayList<>();
        List<CduDiagnostic> diagnostics = new ArrayList<>();
        if (blocks == null) {
            return new Generation("", 0, diagnostics);
        }

        for (int index = 0; index < blocks.size(); index++) {
            BlockDescriptor block = blocks.get(index);
            if (block == null) {
                diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.UNKNOWN_BLOCK_TYPE, "第 " + index + " 个块为空，已输出注释行。"));
                lines.add("* Unknown block type null");
                continue;
            }
            String type = block.type() == null ? "" : block.type().trim().toUpperCase(Locale.ROOT);
            String label = block.label() == null ? "" : block.label();
            List<String> inputs = block.inputVars() == null ? List.of() : block.inputVars();
            String vin = String.join(",", inputs);
            String vout = block.outputVar() == null ? "" : block.outputVar();
            Map<String, Object> params = block.parameters() == null ? Map.of() : block.parameters();

            switch (type) {
                case "GAIN" -> lines.add(label + " GAIN " + vin + " " + vout + " K=" + param(params, "K", DEFAULT_GAIN));
                case "INTEGRATOR" -> lines.add(label + " INT " + vin + " " + vout + " T=" + param(params, "T", DEFAULT_TIME_CONSTANT));
                case "SUM" -> lines.add(label + " SUM " + vin + " " + vout);
                case "INPUT" -> lines.add(label + " INP " + vout);
                case "OUTPUT" -> {
                    if (inputs.isEmpty()) {
                        diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.MISSING_INPUT,
                                "OUTPUT 块 '" + label + "' 没有输入变量。"));
                        lines.add(label + " OUT");
                    } else {
                        lines.add(label + " OUT " + inputs.get(0));
                    }
                }
                default -> {
                    diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.UNKNOWN_BLOCK_TYPE,
                            "不支持的块类型 '" + type + "'（块 '" + label + "'），已输出注释行。"));
                    lines.add("* Unknown block type " + type);
                }
            }
        }
        return new Generation(String.join(LINE_SEPARATOR, lines), lines.size(), diagnostics);
    }

    private static String param(Map<String, Object> params, String name, Double defaultValue) {
        Object value = params.get(name);
        return String.valueOf(value == null ? defaultValue : value);
    }
}
