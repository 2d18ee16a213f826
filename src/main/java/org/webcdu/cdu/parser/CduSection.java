package org.webcdu.cdu.parser;

import java.util.List;

/**
 * 一张图对应的行列表：第一行是图头，最后一行是 {@code FIMCDU}；注释行与空行已被剔除。
 */
public record CduSection(List<SourceLine> lines) {

    public CduSection {
        lines = List.copyOf(lines);
    }

    public SourceLine header() {
        return lines.get(0);
    }
}
