package org.webcdu.cdu.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CduDiagramTest {

    @Test
    void variables_collectsOutputsOfImportsEntriesAndInteriorBlocksOnly() {
        CduDiagram diagram = new CduDiagram(1, "TESTE", List.of(), List.of(),
                List.of(block(100, "IMPORT", List.of(), "W")),
                List.of(block(102, "EXPORT", List.of("VS"), "NAOUSA")),
                List.of(block(101, "ENTRAD", List.of(), "VREF")),
                List.of(block(1, "SOMA", List.of("W", "VREF"), "ERRO"), block(2, "GANHO", List.of("ERRO"), "")));

        assertThat(diagram.variables()).containsExactly("W", "VREF", "ERRO");
        assertThat(diagram.isVariable("erro")).isTrue();
        assertThat(diagram.isVariable(" W ")).isTrue();
        assertThat(diagram.isVariable("NAOUSA")).isFalse();
        assertThat(diagram.isVariable("")).isFalse();
        assertThat(diagram.isVariable(null)).isFalse();
    }

    @Test
    void allBlocks_ordersEntriesImportsInteriorExports() {
        CduDiagram diagram = new CduDiagram(1, "TESTE", List.of(), List.of(),
                List.of(block(20, "IMPORT", List.of(), "A")),
                List.of(block(40, "EXPORT", List.of("C"), "")),
                List.of(block(10, "ENTRAD", List.of(), "B")),
                List.of(block(30, "GANHO", List.of("A"), "C")));

        assertThat(diagram.allBlocks()).extracting(CduBlock::number).containsExactly(10, 20, 30, 40);
    }

    @Test
    void resolveParam_distinguishesMissingFromZero() {
        CduDiagram diagram = new CduDiagram(1, "TESTE",
                List.of(new CduParam("ZERO", 0.0, ""), new CduParam("K", 2.5, "ganho"), new CduParam("RUIM", null, "")),
                List.of(), List.of(), List.of(), List.of(), List.of());

        assertThat(diagram.resolveParam("zero")).isEqualTo(0.0);
        assertThat(diagram.resolveParam("K")).isEqualTo(2.5);
        assertThat(diagram.resolveParam("RUIM")).isEqualTo(CduDiagram.UNDEFINED);
        assertThat(diagram.resolveParam("NADA")).isEqualTo(CduDiagram.UNDEFINED);
        assertThat(diagram.resolveParam(null)).isEqualTo(CduDiagram.UNDEFINED);
    }

    @Test
    void resolveDefault_triesLiteralThenParameterName() {
        CduDiagram diagram = new CduDiagram(1, "TESTE",
                List.of(new CduParam("K", 7.0, "")),
                List.of(new CduDefaultValue("VAR", "X0", "1.5", ' ', ""),
                        new CduDefaultValue("VAR", "X1", "K", '*', "2.0"),
                        new CduDefaultValue("VAR", "X2", "FALTA", ' ', "")),
                List.of(), List.of(), List.of(), List.of());

        assertThat(diagram.resolveDefault("X0")).isEqualTo(1.5);
        assertThat(diagram.resolveDefault("x1")).isEqualTo(7.0);
        assertThat(diagram.resolveDefault("X2")).isEqualTo(CduDiagram.UNDEFINED);
        assertThat(diagram.resolveDefault("X9")).isEqualTo(CduDiagram.UNDEFINED);
    }

    static CduBlock block(int number, String type, List<String> inputs, String output) {
        return new CduBlock(number, ' ', type, ' ', "", List.of(' '), inputs, output,
                List.of(), List.of(), List.of(), List.of(), "", "", number);
    }
}
