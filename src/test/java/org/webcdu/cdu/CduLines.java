package org.webcdu.cdu;

import java.util.Arrays;

/**
 * 测试用定长行构造器：按列写入字段，避免手工数空格。
 */
public final class CduLines {

    private final char[] chars;

    private CduLines() {
        chars = new char[71];
        Arrays.fill(chars, ' ');
    }

    public static CduLines line() {
        return new CduLines();
    }

    public static String header(int id, String name) {
        return String.format("%06d %s", id, name);
    }

    public static String defpar(String name, String value, String description) {
        String fixed = line().put(0, "DEFPAR").put(7, name).put(14, value).text();
        StringBuilder sb = new StringBuilder(fixed);
        while (sb.length() < 32) {
            sb.append(' ');
        }
        return sb.append(description).toString();
    }

    public static String defval(String subtype, String defaultVar, String operand1, char operator, String operand2) {
        return line().put(0, "DEFVAL").put(7, subtype).put(14, defaultVar).put(21, operand1)
                .put(28, String.valueOf(operator)).put(29, operand2).text();
    }

    /**
     * 块首行：编号右对齐到 [0:4]，类型 [5:11]，输入 [19:25]，输出 [26:32]。
     */
    public static CduLines block(int number, String type, String inputVar, String outputVar) {
        return line().put(0, String.format("%4d", number)).put(5, type).put(19, inputVar).put(26, outputVar);
    }

    /**
     * 续行：类型列为空，只写输入/输出。
     */
    public static CduLines continuation(String inputVar, String outputVar) {
        return line().put(19, inputVar).put(26, outputVar);
    }

    public CduLines flags(char input, char output) {
        chars[4] = input;
        chars[11] = output;
        return this;
    }

    public CduLines subtype(String subtype) {
        return put(12, subtype);
    }

    public CduLines state(char state) {
        chars[18] = state;
        return this;
    }

    public CduLines params(String p1, String p2, String p3, String p4) {
        return put(33, p1).put(39, p2).put(45, p3).put(51, p4);
    }

    public CduLines limits(String vmin, String vmax) {
        return put(58, vmin).put(65, vmax);
    }

    public CduLines put(int column, String value) {
        if (value == null) {
            return this;
        }
        if (column + value.length() > chars.length) {
            throw new IllegalArgumentException("字段越界：" + column + " + '" + value + "'");
        }
        value.getChars(0, value.length(), chars, column);
        return this;
    }

    public String text() {
        return new String(chars).stripTrailing();
    }
}
