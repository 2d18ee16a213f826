package org.webcdu.cdu.model;

import java.util.List;
import java.util.Locale;

/**
 * 控制图中的一个功能块（首行 + 续行合并后的结果）。
 * <p>
 * 块不持有所属图的引用；参数/默认值的解析通过 {@link CduDiagram#resolveParam(String)} 等方法
 * 由持有图的一方完成。
 *
 * @param number     块编号，在同一张图内唯一
 * @param inputFlag  输入标记列
 * @param blockType  块类型（SOMA、GANHO、FUNCAO、IMPORT...）
 * @param outputFlag 输出标记列
 * @param subtype    子类型（已去掉 '.'，主要用于 FUNCAO）
 * @param stateFlags 每个物理行一个状态标记（首行 + 续行）
 * @param inputVars  输入变量，按端口顺序
 * @param outputVar  输出变量（续行中非空的值会覆盖）
 * @param p1         各行 P1 列的非空值
 * @param p2         各行 P2 列的非空值
 * @param p3         各行 P3 列的非空值
 * @param p4         各行 P4 列的非空值
 * @param vmin       下限（只取首行）
 * @param vmax       上限（只取首行）
 * @param line       首行在输入文本中的行号
 */
public record CduBlock(
        int number,
        char inputFlag,
        String blockType,
        char outputFlag,
        String subtype,
        List<Character> stateFlags,
        List<String> inputVars,
        String outputVar,
        List<String> p1,
        List<String> p2,
        List<String> p3,
        List<String> p4,
        String vmin,
        String vmax,
        int line
) {

    public CduBlock {
        stateFlags = List.copyOf(stateFlags);
        inputVars = List.copyOf(inputVars);
        p1 = List.copyOf(p1);
        p2 = List.copyOf(p2);
        p3 = List.copyOf(p3);
        p4 = List.copyOf(p4);
    }

    public boolean isType(String type) {
        return blockType.equalsIgnoreCase(type);
    }

    public String nodeId() {
        return String.format(Locale.ROOT, "%04d", number);
    }

    /**
     * 物理行数（首行 + 续行）。
     */
    public int lineCount() {
        return stateFlags.size();
    }
}
