package org.webcdu.cdu.dto.graph;

import java.util.List;

public record DrawingData(String version, List<Object> strokes, List<Object> shapes) {

    public static DrawingData empty() {
        return new DrawingData("1.0.0", List.of(), List.of());
    }
}
