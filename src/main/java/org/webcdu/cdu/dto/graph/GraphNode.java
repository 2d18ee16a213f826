package org.webcdu.cdu.dto.graph;

import java.util.Map;

/**
 * 图节点。
 *
 * @param id       4 位补零的块编号
 * @param type     节点类型（块类型小写；FUNCAO 取子类型）
 * @param position 画布坐标（导入时统一为原点，由编辑器自动布局）
 * @param data     节点数据：label/id/Vout 必有，Vin/P1/P2/Vmin/Vmax/stip 按需出现
 */
public record GraphNode(String id, String type, GraphPosition position, Map<String, Object> data) {
}
