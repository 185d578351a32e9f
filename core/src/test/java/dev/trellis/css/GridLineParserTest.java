/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.trellis.style.GridLine;

import static org.assertj.core.api.Assertions.assertThat;

class GridLineParserTest {

    @Test
    void testParseSingleValues() {
        assertThat(GridLineParser.parse(TokenCursor.of("auto"))).isEqualTo(GridLine.AUTO);
        assertThat(GridLineParser.parse(TokenCursor.of("3"))).isEqualTo(GridLine.line(3));
        assertThat(GridLineParser.parse(TokenCursor.of("-1"))).isEqualTo(GridLine.line(-1));
        assertThat(GridLineParser.parse(TokenCursor.of("span 4"))).isEqualTo(GridLine.span(4));
        assertThat(GridLineParser.parse(TokenCursor.of("span"))).isEqualTo(GridLine.span(1));
    }

    @Test
    void testSpanAloneLeavesEndAuto() {
        GridLineParser.LinePair pair = GridLineParser.parsePair(TokenCursor.of("span 2"));

        assertThat(pair).isEqualTo(new GridLineParser.LinePair(GridLine.span(2), GridLine.AUTO));
    }

    @Test
    void testParsePairWithSlash() {
        TokenCursor cursor = TokenCursor.of("2 / span 3");

        GridLineParser.LinePair pair = GridLineParser.parsePair(cursor);

        assertThat(pair.start()).isEqualTo(GridLine.line(2));
        assertThat(pair.end()).isEqualTo(GridLine.span(3));
        assertThat(cursor.atEnd()).isTrue();
    }

    @Test
    void testParsePairWithoutSpaces() {
        GridLineParser.LinePair pair = GridLineParser.parsePair(TokenCursor.of("1/3"));

        assertThat(pair).isEqualTo(new GridLineParser.LinePair(GridLine.line(1), GridLine.line(3)));
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "1.5", "span 0", "span -2", "bogus", "" })
    void testInvalidValuesFailAndRewind(String text) {
        TokenCursor cursor = TokenCursor.of(text);

        assertThat(GridLineParser.parse(cursor)).isNull();
        assertThat(cursor.position()).isZero();
    }

    @Test
    void testInvalidEndRewindsWholePair() {
        TokenCursor cursor = TokenCursor.of("1 / 0");

        assertThat(GridLineParser.parsePair(cursor)).isNull();
        assertThat(cursor.position()).isZero();
    }

    @Test
    void testSpanFollowedByOtherTokenKeepsThem() {
        TokenCursor cursor = TokenCursor.of("span / 2");

        GridLineParser.LinePair pair = GridLineParser.parsePair(cursor);

        assertThat(pair).isEqualTo(new GridLineParser.LinePair(GridLine.span(1), GridLine.line(2)));
    }
}
