package org.webcdu.cdu.parser;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 续行规则表：决定某种块类型的首行之后还要吞掉多少行作为续行。
 * <ul>
 *   <li>固定行数：ACUM 3 行、INTRES 2 行、COMPAR 1 行，不看续行自身的类型列。</li>
 *   <li>可变行数：只要下一行类型列为空且不是 FIMCDU 就继续吞。</li>
 *   <li>其他类型：单行。</li>
 * </ul>
 * {@link #EXTENDED} 在 {@link #STANDARD} 的基础上把 FUNCAO、LOGIC、S/HOLD、T/HOLD、SELET2 也视为可变行数。
 */
public enum ContinuationProfile {

    STANDARD(List.of("DIVSAO", "PONTOS", "POL(S)", "MAX", "MIN", "MULTPL", "SOMA")),
    EXTENDED(List.of("DIVSAO", "PONTOS", "POL(S)", "MAX", "MIN", "MULTPL", "SOMA",
            "FUNCAO", "LOGIC", "S/HOLD", "T/HOLD", "SELET2"));

    private static final Map<String, Integer> FIXED_COUNTS = Map.of(
            "ACUM", 3,
            "INTRES", 2,
            "COMPAR", 1
    );

    private final Set<String> variableTypes;

    ContinuationProfile(List<String> variableTypes) {
        this.variableTypes = Set.copyOf(variableTypes);
    }

    public Rule ruleFor(String blockType) {
        String type = blockType == null ? "" : blockType.trim().toUpperCase(Locale.ROOT);
        Integer fixed = FIXED_COUNTS.get(type);
        if (fixed != null) {
            return Rule.fixed(fixed);
        }
        if (variableTypes.contains(type)) {
            return Rule.VARIABLE;
        }
        return Rule.NONE;
    }

    /**
     * @param kind  续行方式
     * @param count 固定续行数（仅 {@link Kind#FIXED} 有意义）
     */
    public record Rule(Kind kind, int count) {

        public static final Rule NONE = new Rule(Kind.NONE, 0);
        public static final Rule VARIABLE = new Rule(Kind.VARIABLE, 0);

        public static Rule fixed(int count) {
            return new Rule(Kind.FIXED, count);
        }
    }

    public enum Kind {
        NONE,
        FIXED,
        VARIABLE
    }
}
