package org.webcdu.cdu.record;

import org.webcdu.cdu.CduFieldFormatException;

import java.util.Locale;

/**
 * CDU 定长记录解码器。
 * <p>
 * CDU 是按列对齐的老式文本格式，每个字段占据固定的字符区间（0 起始、右开区间）。解码规则：
 * <ul>
 *   <li>切片前先把行右侧补空格到至少 {@value #RECORD_WIDTH} 列；短行不会被拒绝，缺失的字段就是空串。</li>
 *   <li>字段切片一律 trim，任何字段提取都不会抛异常。</li>
 *   <li>数值字段（块编号、图编号、参数值）由单独的 {@code parse*} 方法解析，失败时抛 {@link CduFieldFormatException}。</li>
 * </ul>
 * <p>
 * 块记录（首行与续行格式相同）：
 * <pre>
 * number[0:4] inputFlag[4] blockType[5:11] outputFlag[11] subtype[12:18] stateFlag[18]
 * inputVar[19:25] outputVar[26:32] p1[33:39] p2[39:45] p3[45:51] p4[51:57] vmin[58:64] vmax[65:71]
 * </pre>
 */
public final class CduRecordDecoder {

    public static final int RECORD_WIDTH = 71;

    private CduRecordDecoder() {
    }

    /**
     * 图头行：{@code id[0:6]}，其余部分只保留字母数字作为图名称。
     *
     * @param rawId 原始编号字段（未解析，需调用 {@link #parseDiagramId(String)}）
     * @param name  图名称
     */
    public record HeaderLine(String rawId, String name) {
    }

    /**
     * 一行块记录（首行或续行）。
     * <p>
     * {@code rawNumber} 保持原文，由 {@link #parseBlockNumber(String)} 单独解析。
     */
    public record BlockLine(
            String rawNumber,
            char inputFlag,
            String blockType,
            char outputFlag,
            String subtype,
            char stateFlag,
            String inputVar,
            String outputVar,
            String p1,
            String p2,
            String p3,
            String p4,
            String vmin,
            String vmax
    ) {
        public boolean hasBlockType() {
            return !blockType.isEmpty();
        }
    }

    /**
     * {@code DEFPAR} 行：{@code name[7:13] value[14:32] description[32:]}。
     */
    public record ParamLine(String name, String rawValue, String description) {
    }

    /**
     * {@code DEFVAL} 行：{@code subtype[7:13] defaultVar[14:20] operand1[21:27] operator[28] operand2[29:35]}。
     */
    public record DefaultValueLine(String subtype, String defaultVar, String operand1, char operator, String operand2) {
    }

    public static HeaderLine decodeHeader(String line) {
        String padded = pad(line);
        String rest = padded.substring(6);
        StringBuilder name = new StringBuilder(rest.length());
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                name.append(c);
            }
        }
        return new HeaderLine(slice(padded, 0, 6), name.toString());
    }

    public static BlockLine decodeBlock(String line) {
        String padded = pad(line);
        return new BlockLine(
                slice(padded, 0, 4),
                padded.charAt(4),
                slice(padded, 5, 11),
                padded.charAt(11),
                slice(padded, 12, 18).replace(".", "").trim(),
                padded.charAt(18),
                slice(padded, 19, 25),
                slice(padded, 26, 32),
                slice(padded, 33, 39),
                slice(padded, 39, 45),
                slice(padded, 45, 51),
                slice(padded, 51, 57),
                slice(padded, 58, 64),
                slice(padded, 65, 71)
        );
    }

    public static ParamLine decodeParam(String line) {
        String padded = pad(line);
        return new ParamLine(slice(padded, 7, 13), slice(padded, 14, 32), padded.substring(32).trim());
    }

    public static DefaultValueLine decodeDefaultValue(String line) {
        String padded = pad(line);
        return new DefaultValueLine(
                slice(padded, 7, 13),
                slice(padded, 14, 20),
                slice(padded, 21, 27),
                padded.charAt(28),
                slice(padded, 29, 35)
        );
    }

    /**
     * 只看块记录的类型列 {@code [5:11]}，用于续行判断。
     */
    public static String blockTypeColumn(String line) {
        return slice(pad(line), 5, 11);
    }

    public static boolean isDefParLine(String line) {
        return line != null && line.toUpperCase(Locale.ROOT).startsWith("DEFPAR");
    }

    public static boolean isDefValLine(String line) {
        return line != null && line.toUpperCase(Locale.ROOT).startsWith("DEFVAL");
    }

    public static int parseBlockNumber(String raw) {
        int number = parseInt("number", raw);
        if (number < 0) {
            throw new CduFieldFormatException("number", raw);
        }
        return number;
    }

    public static int parseDiagramId(String raw) {
        return parseInt("id", raw);
    }

    public static double parseParamValue(String raw) {
        String value = raw == null ? "" : raw.trim();
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new CduFieldFormatException("value", value);
        }
    }

    private static int parseInt(String field, String raw) {
        String value = raw == null ? "" : raw.trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CduFieldFormatException(field, value);
        }
    }

    static String pad(String line) {
        String text = line == null ? "" : stripLineTerminator(line);
        if (text.length() >= RECORD_WIDTH) {
            return text;
        }
        StringBuilder sb = new StringBuilder(RECORD_WIDTH);
        sb.append(text);
        while (sb.length() < RECORD_WIDTH) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static String slice(String padded, int start, int end) {
        return padded.substring(start, end).trim();
    }
}
