package org.webcdu.cdu.graph;

import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.dto.graph.GraphDocument;
import org.webcdu.cdu.dto.graph.GraphEdge;
import org.webcdu.cdu.dto.graph.GraphNode;
import org.webcdu.cdu.dto.graph.GraphPosition;
import org.webcdu.cdu.model.CduBlock;
import org.webcdu.cdu.model.CduDiagram;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把 {@link CduDiagram} 投影为节点/连线图。
 * <p>
 * 连线推导：先建立“输出变量名 -> 节点 id”的索引（覆盖全部块，变量名忽略大小写，后出现的产生者覆盖先出现的），
 * 再遍历每个块的输入变量逐一查找产生者。找不到产生者的引用不生成连线，只记一条 UNRESOLVED_VARIABLE 诊断。
 * <p>
 * 多个输入变量不会拆成多个端口字段，而是合并为一个 {@code [a,b,c]} 形式的字符串放在 {@code Vin} 中。
 */
public final class CduGraphProjector {

    public static final String EDGE_ID_PREFIX = "reactflow__edge-";
    public static final String EDGE_TYPE = "default";

    private static final String FUNCTION_TYPE = "FUNCAO";
    private static final String SQUARE_SUBTYPE = "x**2";
    private static final String SQUARE_NODE_TYPE = "x2";

    private CduGraphProjector() {
    }

    public record Projection(GraphDocument graph, List<CduDiagnostic> diagnostics) {
    }

    public static Projection project(CduDiagram diagram) {
        List<CduBlock> all = diagram.allBlocks();
        List<CduDiagnostic> diagnostics = new ArrayList<>();

        Map<String, String> producers = new HashMap<>();
        for (CduBlock block : all) {
            if (!block.outputVar().isEmpty()) {
                producers.put(variableKey(block.outputVar()), block.nodeId());
            }
        }

        List<GraphNode> nodes = new ArrayList<>(all.size());
        for (CduBlock block : all) {
            nodes.add(new GraphNode(block.nodeId(), nodeType(block), GraphPosition.ORIGIN, nodeData(block)));
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (CduBlock block : all) {
            String target = block.nodeId();
            List<String> inputs = block.inputVars();
            for (int k = 1; k <= inputs.size(); k++) {
                String variable = inputs.get(k - 1);
                String source = producers.get(variableKey(variable));
                if (source == null) {
                    diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.UNRESOLVED_VARIABLE,
                            "块 " + target + " 的第 " + k + " 个输入变量 '" + variable + "' 没有产生者，未生成连线。"));
                    continue;
                }
                edges.add(new GraphEdge(edgeId(source, target, k), source, target, EDGE_TYPE));
            }
        }

        return new Projection(GraphDocument.of(nodes, edges), diagnostics);
    }

    /**
     * 节点类型：块类型小写；FUNCAO 使用子类型小写，其中平方函数 {@code X**2} 映射为 {@code x2}。
     * 子类型为空的 FUNCAO 仍使用 {@code funcao}。
     */
    public static String nodeType(CduBlock block) {
        if (block.isType(FUNCTION_TYPE) && !block.subtype().isEmpty()) {
            String subtype = block.subtype().toLowerCase(Locale.ROOT);
            return SQUARE_SUBTYPE.equals(subtype) ? SQUARE_NODE_TYPE : subtype;
        }
        return block.blockType().toLowerCase(Locale.ROOT);
    }

    public static String edgeId(String source, String target, int inputIndex) {
        String port = inputIndex == 1 ? "vin" : "vin" + inputIndex;
        return EDGE_ID_PREFIX + source + "vout-" + target + port;
    }

    static Map<String, Object> nodeData(CduBlock block) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("label", titleCase(block.blockType()));
        data.put("id", block.nodeId());
        data.put("Vout", block.outputVar());

        List<String> inputs = block.inputVars();
        if (inputs.size() == 1) {
            data.put("Vin", inputs.get(0));
        } else if (inputs.size() > 1) {
            data.put("Vin", "[" + String.join(",", inputs) + "]");
        }

        if (!block.p1().isEmpty()) {
            data.put("P1", block.p1().get(0));
        }
        if (!block.p2().isEmpty()) {
            data.put("P2", block.p2().get(0));
        }
        if (!block.vmin().isEmpty()) {
            data.put("Vmin", block.vmin());
        }
        if (!block.vmax().isEmpty()) {
            data.put("Vmax", block.vmax());
        }
        if (!block.subtype().isEmpty()) {
            data.put("stip", block.subtype());
        }
        return data;
    }

    /**
     * 每段连续字母首字母大写、其余小写：{@code S/HOLD -> S/Hold}，{@code POL(S) -> Pol(S)}。
     */
    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }

    private static String variableKey(String variable) {
        return variable.trim().toUpperCase(Locale.ROOT);
    }
}
