package com.asl.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class VariantListParserTest {

    private final VariantListParser parser = new VariantListParser(new ObjectMapper());

    @Test
    void parsesPlainJsonArray() {
        Optional<VariantListParser.ParseResult> result = parser.parse("[\"ev range\", \"ev price\"]");

        assertThat(result).isPresent();
        assertThat(result.get().getStage()).isEqualTo(VariantListParser.Stage.JSON);
        assertThat(result.get().getValues()).containsExactly("ev range", "ev price");
    }

    @Test
    void stripsCodeFenceBeforeRetrying() {
        Optional<VariantListParser.ParseResult> result = parser.parse("```json\n[\"ev range\", \"ev price\"]\n```");

        assertThat(result).isPresent();
        assertThat(result.get().getStage()).isEqualTo(VariantListParser.Stage.FENCED_JSON);
        assertThat(result.get().getValues()).containsExactly("ev range", "ev price");
    }

    @Test
    void splitsLinesAndRemovesBulletsAndNumbering() {
        Optional<VariantListParser.ParseResult> result = parser.parse("1. ev range\n- ev price\n* ev range\n\n");

        assertThat(result).isPresent();
        assertThat(result.get().getStage()).isEqualTo(VariantListParser.Stage.LINES);
        assertThat(result.get().getValues()).containsExactly("ev range", "ev price");
    }

    @Test
    void splitsOnCommas() {
        assertThat(parser.parseLines("ev range, ev price")).contains(List.of("ev range", "ev price"));
    }

    @Test
    void jsonObjectIsNotAList() {
        assertThat(parser.parseJsonArray("{\"a\":1}")).isEmpty();
    }

    @Test
    void blankInputFails() {
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("```\n```")).isEmpty();
    }
}
