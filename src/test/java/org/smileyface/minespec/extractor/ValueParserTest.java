package org.smileyface.minespec.extractor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValueParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "180,000; 180000",
            "180.000; 180000",
            "180 000; 180000",
            "1,234,567; 1234567",
            "1.234,5; 1234.5",
            "1,234.5; 1234.5",
            "3,5; 3.5",
            "12.75; 12.75",
            "0,500; 0.5",
            "0.750; 0.75",
            "2.500; 2500",
            "432; 432"
    })
    void parsesNumbersWrittenInEitherConvention(String input, double expected) {
        assertThat(ValueParser.parseNumber(input)).hasValue(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "1.2.3,4,5x"})
    void rejectsNonNumbers(String input) {
        assertThat(ValueParser.parseNumber(input)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"N/A", "n/a", "TBD", "-", "—", "Contact dealer", "consultar", "On request.", "varies"})
    void recognisesPlaceholders(String input) {
        assertThat(ValueParser.isPlaceholder(input)).isTrue();
        assertThat(ValueParser.parseCell(input)).isEmpty();
    }

    @Test
    void numbersAreNotPlaceholders() {
        assertThat(ValueParser.isPlaceholder("180")).isFalse();
        assertThat(ValueParser.isPlaceholder("Cat C27")).isFalse();
    }

    @Test
    void cellKeepsUnitWrittenAfterTheNumber() {
        Optional<ValueParser.CellValue> cell = ValueParser.parseCell("180 000 kg (396,900 lb)");
        assertThat(cell).isPresent();
        assertThat(cell.get().value()).isEqualTo(180000.0);
        assertThat(cell.get().unitToken()).isEqualTo("kg");
    }

    @Test
    void rangeGivesLowerBoundWithTrailingUnit() {
        ValueParser.CellValue cell = ValueParser.parseCell("25 - 30 m3").orElseThrow();
        assertThat(cell.value()).isEqualTo(25.0);
        assertThat(cell.unitToken()).isEqualTo("m3");
    }

    @Test
    void leadingMinusIsKept() {
        assertThat(ValueParser.parseCell("-5").orElseThrow().value()).isEqualTo(-5.0);
        assertThat(ValueParser.parseCell("(-12 km/h)").orElseThrow().value()).isEqualTo(-12.0);
        // a hyphen inside a model name is not a sign
        assertThat(ValueParser.parseCell("C-27").orElseThrow().value()).isEqualTo(27.0);
    }

    @Test
    void unitTokenStopsAtAtAndSeparators() {
        assertThat(ValueParser.unitTokenAt("432 kW at 1800 rpm", 3)).isEqualTo("kW");
        assertThat(ValueParser.unitTokenAt("12 m; 14 m", 2)).isEqualTo("m");
        assertThat(ValueParser.unitTokenAt("4,5 cm2", 3)).isEqualTo("cm2");
    }

    @Test
    void cellWithoutNumberIsEmpty() {
        assertThat(ValueParser.parseCell("Cat")).isEmpty();
        assertThat(ValueParser.parseCell("1".repeat(300))).isEmpty();
    }

    @Test
    void decimalCommaInCell() {
        assertThat(ValueParser.parseCell("3,5 m³").orElseThrow().value()).isCloseTo(3.5, within(1e-9));
    }
}
