package org.webcdu.cdu.generator;

import org.junit.jupiter.api.Test;
import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.dto.BlockDescriptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CduTextGeneratorTest {

    @Test
    void generate_writesOneLinePerKnownBlock() {
        CduTextGenerator.Generation generation = CduTextGenerator.generate(List.of(
                new BlockDescriptor("INPUT", "U1", List.of(), "x", Map.of()),
                new BlockDescriptor("GAIN", "G1", List.of("x"), "y", Map.of("K", 2.5)),
                new BlockDescriptor("integrator", "I1", List.of("y"), "z", Map.of("T", 0.1)),
                new BlockDescriptor("SUM", "S1", List.of("z", "x"), "w", null),
                new BlockDescriptor("OUTPUT", "O1", List.of("w", "ignorado"), null, null)));

        assertThat(generation.text()).isEqualTo(String.join("\n",
                "U1 INP x",
                "G1 GAIN x y K=2.5",
                "I1 INT y z T=0.1",
                "S1 SUM z,x w",
                "O1 OUT w"));
        assertThat(generation.lineCount()).isEqualTo(5);
        assertThat(generation.diagnostics()).isEmpty();
    }

    @Test
    void generate_defaultsMissingGainAndTimeConstant() {
        CduTextGenerator.Generation generation = CduTextGenerator.generate(List.of(
                new BlockDescriptor("GAIN", "G1", List.of("a"), "b", Map.of()),
                new BlockDescriptor("INTEGRATOR", "I1", List.of("b"), "c", null)));

        assertThat(generation.text()).isEqualTo("G1 GAIN a b K=1.0\nI1 INT b c T=1.0");
    }

    @Test
    void generate_unknownTypeBecomesCommentLine() {
        CduTextGenerator.Generation generation = CduTextGenerator.generate(List.of(
                new BlockDescriptor("Delay", "D1", List.of("a"), "b", Map.of())));

        assertThat(generation.text()).isEqualTo("* Unknown block type DELAY");
        assertThat(generation.text()).startsWith("*");
        assertThat(generation.diagnostics())
                .extracting(CduDiagnostic::kind)
                .containsExactly(CduDiagnostic.Kind.UNKNOWN_BLOCK_TYPE);
    }

    @Test
    void generate_outputWithoutInputIsReported() {
        CduTextGenerator.Generation generation = CduTextGenerator.generate(List.of(
                new BlockDescriptor("OUTPUT", "O1", null, null, null)));

        assertThat(generation.text()).isEqualTo("O1 OUT");
        assertThat(generation.diagnostics())
                .extracting(CduDiagnostic::kind)
                .containsExactly(CduDiagnostic.Kind.MISSING_INPUT);
    }

    @Test
    void generate_emptyListGivesEmptyText() {
        assertThat(CduTextGenerator.generate(List.of()).text()).isEmpty();
        assertThat(CduTextGenerator.generate(List.of()).lineCount()).isZero();
        assertThat(CduTextGenerator.generate(null).text()).isEmpty();
    }
}
