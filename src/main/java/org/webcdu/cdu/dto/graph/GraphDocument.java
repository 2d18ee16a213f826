package org.webcdu.cdu.dto.graph;

import java.util.List;

/**
 * 图编辑器使用的节点/连线文档。
 * <p>
 * {@code drawingData}、{@code groupData}、{@code parameters} 只是为兼容图编辑器的文档结构而保留的空骨架，
 * 不承载任何由 CDU 推导出的语义。
 *
 * @param nodes       节点（每个块一个）
 * @param edges       连线（由输入/输出变量匹配推导）
 * @param drawingData 手绘层数据（空）
 * @param groupData   分组数据（空）
 * @param parameters  参数面板数据（空）
 */
public record GraphDocument(
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        DrawingData drawingData,
        GroupData groupData,
        List<Object> parameters
) {

    public static GraphDocument of(List<GraphNode> nodes, List<GraphEdge> edges) {
        return new GraphDocument(List.copyOf(nodes), List.copyOf(edges), DrawingData.empty(), GroupData.empty(), List.of());
    }
}
