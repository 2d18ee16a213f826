package org.webcdu.cdu.dto.graph;

/**
 * 图连线：从产生变量的节点指向消费该变量的节点。
 *
 * @param id     确定性 id：{@code reactflow__edge-<source>vout-<target>vin[k]}
 * @param source 源节点 id
 * @param target 目标节点 id
 * @param type   连线类型，固定为 {@code default}
 */
public record GraphEdge(String id, String source, String target, String type) {
}
