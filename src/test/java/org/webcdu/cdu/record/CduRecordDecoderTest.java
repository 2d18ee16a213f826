package org.webcdu.cdu.record;

import org.junit.jupiter.api.Test;
import org.webcdu.cdu.CduFieldFormatException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CduRecordDecoderTest {

    @Test
    void decodeBlock_slicesEveryFixedColumn() {
        String line = "0012" + "I" + "FUNCAO" + "O" + "X.**2 " + "s" + "ENT1  " + " " + "SAI1  " + " "
                + "P1VAL " + "P2VAL " + "P3VAL " + "P4VAL " + " " + "-1.0  " + " " + "1.0";

        CduRecordDecoder.BlockLine record = CduRecordDecoder.decodeBlock(line);

        assertThat(record.rawNumber()).isEqualTo("0012");
        assertThat(record.inputFlag()).isEqualTo('I');
        assertThat(record.blockType()).isEqualTo("FUNCAO");
        assertThat(record.outputFlag()).isEqualTo('O');
        assertThat(record.subtype()).isEqualTo("X**2");
        assertThat(record.stateFlag()).isEqualTo('s');
        assertThat(record.inputVar()).isEqualTo("ENT1");
        assertThat(record.outputVar()).isEqualTo("SAI1");
        assertThat(record.p1()).isEqualTo("P1VAL");
        assertThat(record.p2()).isEqualTo("P2VAL");
        assertThat(record.p3()).isEqualTo("P3VAL");
        assertThat(record.p4()).isEqualTo("P4VAL");
        assertThat(record.vmin()).isEqualTo("-1.0");
        assertThat(record.vmax()).isEqualTo("1.0");
    }

    @Test
    void decodeBlock_shortLineYieldsEmptyFieldsInsteadOfFailing() {
        CduRecordDecoder.BlockLine record = CduRecordDecoder.decodeBlock("   7 GANHO\r\n");

        assertThat(record.rawNumber()).isEqualTo("7");
        assertThat(record.blockType()).isEqualTo("GANHO");
        assertThat(record.inputFlag()).isEqualTo(' ');
        assertThat(record.inputVar()).isEmpty();
        assertThat(record.outputVar()).isEmpty();
        assertThat(record.vmax()).isEmpty();
        assertThat(record.hasBlockType()).isTrue();
    }

    @Test
    void decodeBlock_acceptsNullAndEmptyLines() {
        assertThat(CduRecordDecoder.decodeBlock(null).hasBlockType()).isFalse();
        assertThat(CduRecordDecoder.decodeBlock("").rawNumber()).isEmpty();
    }

    @Test
    void decodeHeader_keepsOnlyAlphanumericNameCharacters() {
        CduRecordDecoder.HeaderLine header = CduRecordDecoder.decodeHeader("000042 RT-FUNIL_v2 (teste)");

        assertThat(header.rawId()).isEqualTo("000042");
        assertThat(header.name()).isEqualTo("RTFUNILv2teste");
        assertThat(CduRecordDecoder.parseDiagramId(header.rawId())).isEqualTo(42);
    }

    @Test
    void decodeParam_readsNameValueAndFreeTextDescription() {
        String line = "DEFPAR " + "#K    " + " " + "12.5              " + "GANHO DO ESTABILIZADOR";

        CduRecordDecoder.ParamLine param = CduRecordDecoder.decodeParam(line);

        assertThat(param.name()).isEqualTo("#K");
        assertThat(param.rawValue()).isEqualTo("12.5");
        assertThat(param.description()).isEqualTo("GANHO DO ESTABILIZADOR");
        assertThat(CduRecordDecoder.parseParamValue(param.rawValue())).isEqualTo(12.5);
    }

    @Test
    void decodeDefaultValue_readsOperandsAndOperator() {
        String line = "DEFVAL " + "VAR   " + " " + "X0    " + " " + "#K    " + " " + "*" + "2.0";

        CduRecordDecoder.DefaultValueLine value = CduRecordDecoder.decodeDefaultValue(line);

        assertThat(value.subtype()).isEqualTo("VAR");
        assertThat(value.defaultVar()).isEqualTo("X0");
        assertThat(value.operand1()).isEqualTo("#K");
        assertThat(value.operator()).isEqualTo('*');
        assertThat(value.operand2()).isEqualTo("2.0");
    }

    @Test
    void numericFields_failExplicitlyWhenNotNumeric() {
        assertThatThrownBy(() -> CduRecordDecoder.parseDiagramId("ABC"))
                .isInstanceOf(CduFieldFormatException.class)
                .hasMessageContaining("ABC");
        assertThatThrownBy(() -> CduRecordDecoder.parseBlockNumber(""))
                .isInstanceOf(CduFieldFormatException.class);
        assertThatThrownBy(() -> CduRecordDecoder.parseBlockNumber("-3"))
                .isInstanceOf(CduFieldFormatException.class);
        assertThatThrownBy(() -> CduRecordDecoder.parseParamValue("K1"))
                .isInstanceOf(CduFieldFormatException.class)
                .extracting(e -> ((CduFieldFormatException) e).getField())
                .isEqualTo("value");
    }

    @Test
    void declarationLinesAreDetectedCaseInsensitively() {
        assertThat(CduRecordDecoder.isDefParLine("defpar K 1.0")).isTrue();
        assertThat(CduRecordDecoder.isDefValLine("DEFVAL VAR X0")).isTrue();
        assertThat(CduRecordDecoder.isDefParLine("   1 GANHO")).isFalse();
    }
}
