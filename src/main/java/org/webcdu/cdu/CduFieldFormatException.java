package org.webcdu.cdu;

/**
 * 定长记录中的数值字段无法解析（块编号、图编号、DEFPAR 参数值）。
 * <p>
 * 只在 {@link org.webcdu.cdu.record.CduRecordDecoder} 的数值解析方法中抛出，
 * 组装阶段会把它转换为带行号的 {@link CduDiagnostic}。
 */
public class CduFieldFormatException extends RuntimeException {

    private final String field;
    private final String rawValue;

    public CduFieldFormatException(String field, String rawValue) {
        super("字段 " + field + " 不是合法数字：'" + rawValue + "'");
        this.field = field;
        this.rawValue = rawValue;
    }

    public String getField() {
        return field;
    }

    public String getRawValue() {
        return rawValue;
    }
}
