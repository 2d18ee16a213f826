package org.webcdu.cdu.dto.graph;

public record GraphPosition(int x, int y) {

    public static final GraphPosition ORIGIN = new GraphPosition(0, 0);
}
