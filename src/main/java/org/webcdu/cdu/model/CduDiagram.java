package org.webcdu.cdu.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 一张完整解析后的 CDU 控制图。
 * <p>
 * 图独占其中所有块；构造后不可变，每次解析调用生成一个新实例。
 * 块按 {@code blockType} 分为四类：IMPORT、EXPORT、ENTRAD 以及其余的内部块。
 */
public final class CduDiagram {

    /**
     * 参数/默认值缺失时的返回值，表示“未定义/无界”，与合法的 0 区分。
     */
    public static final double UNDEFINED = Double.NEGATIVE_INFINITY;

    private final Integer id;
    private final String name;
    private final List<CduParam> params;
    private final List<CduDefaultValue> defaults;
    private final List<CduBlock> imports;
    private final List<CduBlock> exports;
    private final List<CduBlock> entries;
    private final List<CduBlock> blocks;

    public CduDiagram(Integer id,
                      String name,
                      List<CduParam> params,
                      List<CduDefaultValue> defaults,
                      List<CduBlock> imports,
                      List<CduBlock> exports,
                      List<CduBlock> entries,
                      List<CduBlock> blocks) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.params = List.copyOf(params);
        this.defaults = List.copyOf(defaults);
        this.imports = List.copyOf(imports);
        this.exports = List.copyOf(exports);
        this.entries = List.copyOf(entries);
        this.blocks = List.copyOf(blocks);
    }

    /**
     * 图编号；头行编号不是合法数字时为 null。
     */
    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<CduParam> getParams() {
        return params;
    }

    public List<CduDefaultValue> getDefaults() {
        return defaults;
    }

    public List<CduBlock> getImports() {
        return imports;
    }

    public List<CduBlock> getExports() {
        return exports;
    }

    public List<CduBlock> getEntries() {
        return entries;
    }

    /**
     * 内部块（除 IMPORT/EXPORT/ENTRAD 以外的所有块）。
     */
    public List<CduBlock> getBlocks() {
        return blocks;
    }

    /**
     * 全部块，顺序为：ENTRAD、IMPORT、内部块、EXPORT（与图编辑器期望的节点顺序一致）。
     */
    public List<CduBlock> allBlocks() {
        List<CduBlock> all = new ArrayList<>(entries.size() + imports.size() + blocks.size() + exports.size());
        all.addAll(entries);
        all.addAll(imports);
        all.addAll(blocks);
        all.addAll(exports);
        return all;
    }

    /**
     * 图内产生的变量：IMPORT、ENTRAD、内部块的输出变量。EXPORT 只消费不产生。
     */
    public List<String> variables() {
        List<String> result = new ArrayList<>();
        collectOutputs(imports, result);
        collectOutputs(entries, result);
        collectOutputs(blocks, result);
        return result;
    }

    public boolean isVariable(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        for (String variable : variables()) {
            if (variable.equalsIgnoreCase(name.trim())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 按名称（忽略大小写）查找 DEFPAR 参数值；不存在或值无法解析时返回 {@link #UNDEFINED}。
     */
    public double resolveParam(String name) {
        if (name == null) {
            return UNDEFINED;
        }
        String key = name.trim();
        for (CduParam param : params) {
            if (param.name().equalsIgnoreCase(key)) {
                return param.value() == null ? UNDEFINED : param.value();
            }
        }
        return UNDEFINED;
    }

    /**
     * 按 {@code defaultVar} 查找 DEFVAL，先把 operand1 当作数字字面量，失败再当作参数名解析。
     */
    public double resolveDefault(String defaultVar) {
        if (defaultVar == null) {
            return UNDEFINED;
        }
        String key = defaultVar.trim();
        for (CduDefaultValue value : defaults) {
            if (value.defaultVar().equalsIgnoreCase(key)) {
                try {
                    return Double.parseDouble(value.operand1());
                } catch (NumberFormatException e) {
                    return resolveParam(value.operand1());
                }
            }
        }
        return UNDEFINED;
    }

    private static void collectOutputs(List<CduBlock> source, List<String> target) {
        for (CduBlock block : source) {
            if (!block.outputVar().isEmpty()) {
                target.add(block.outputVar());
            }
        }
    }
}
