package com.ccflow.analyzer.layout;

import com.ccflow.analyzer.model.GraphNode;
import com.ccflow.analyzer.model.GraphPayload;
import com.ccflow.analyzer.model.NodePlacement;
import com.ccflow.analyzer.model.Port;
import com.ccflow.analyzer.model.Position;
import com.ccflow.analyzer.model.ResolvedTraceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 节点坐标 + 出入挂点。
 *
 * 网格布局是蛇形（boustrophedon）：偶数行从左往右，奇数行从右往左，行尾往下接。
 * 结果只由 (index, total, columns) 决定，和节点内容无关，可重入。
 */
public class GraphLayoutEngine {

    /**
     * 第 index 个节点（共 total 个）的位置和挂点。
     */
    public static NodePlacement place(int index, int total, GridConfig grid) {
        int columns = grid.getColumns();
        int row = index / columns;
        boolean evenRow = row % 2 == 0;
        int offset = index % columns;
        int column = evenRow ? offset : columns - 1 - offset;

        Position position = new Position(
                column * (grid.getNodeWidth() + grid.getHorizontalGap()),
                row * (grid.getNodeHeight() + grid.getVerticalGap()));

        Port sourcePort = null;
        if (index + 1 < total) {
            if ((index + 1) % columns == 0) {
                sourcePort = Port.BOTTOM;
            } else {
                sourcePort = evenRow ? Port.RIGHT : Port.LEFT;
            }
        }

        Port targetPort;
        if (index == 0) {
            targetPort = Port.LEFT;
        } else if (offset == 0 && row > 0) {
            targetPort = Port.TOP;
        } else {
            targetPort = evenRow ? Port.LEFT : Port.RIGHT;
        }

        return new NodePlacement(position, sourcePort, targetPort);
    }

    public <T extends GraphPayload> List<GraphNode> layoutNodes(List<T> nodes, GridConfig grid) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }
        GridConfig cfg = grid == null ? GridConfig.defaults() : grid;
        List<GraphNode> positioned = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            T payload = nodes.get(i);
            NodePlacement placement = place(i, nodes.size(), cfg);
            positioned.add(GraphNode.builder()
                    .id(idOf(payload, i))
                    .position(placement.getPosition())
                    .sourcePort(placement.getSourcePort())
                    .targetPort(placement.getTargetPort())
                    .payload(payload)
                    .build());
        }
        return positioned;
    }

    /**
     * trace 泳道布局：根在左边，每个服务一列；列内按出现顺序往下排，按深度缩进。
     * 连线统一右出左入。
     */
    public List<GraphNode> layoutLanes(ResolvedTraceNode root,
                                       Map<String, List<ResolvedTraceNode>> lanes,
                                       LaneConfig lane) {
        LaneConfig cfg = lane == null ? LaneConfig.defaults() : lane;
        List<GraphNode> positioned = new ArrayList<>();
        if (root != null) {
            positioned.add(GraphNode.builder()
                    .id(root.nodeId())
                    .position(new Position(cfg.getRootX(), cfg.getTop()))
                    .sourcePort(Port.RIGHT)
                    .payload(root)
                    .build());
        }
        if (lanes == null) {
            return positioned;
        }

        int laneIndex = 0;
        for (List<ResolvedTraceNode> members : lanes.values()) {
            for (int row = 0; row < members.size(); row++) {
                ResolvedTraceNode node = members.get(row);
                double x = cfg.getLaneBaseX() + laneIndex * cfg.getLaneSpacing() + node.getDepth() * cfg.getDepthIndent();
                double y = cfg.getTop() + row * cfg.getRowSpacing();
                positioned.add(GraphNode.builder()
                        .id(idOf(node, positioned.size()))
                        .position(new Position(x, y))
                        .sourcePort(Port.RIGHT)
                        .targetPort(Port.LEFT)
                        .payload(node)
                        .build());
            }
            laneIndex++;
        }
        return positioned;
    }

    private static String idOf(GraphPayload payload, int index) {
        String id = payload == null ? null : payload.nodeId();
        return id == null ? "node_" + index : id;
    }
}
