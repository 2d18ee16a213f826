package org.webcdu.cdu.dto.graph;

import java.util.List;

public record GroupData(List<Object> groups, List<String> selectedGroupIds, List<Object> groupCounter) {

    public static GroupData empty() {
        return new GroupData(List.of(), List.of(), List.of());
    }
}
