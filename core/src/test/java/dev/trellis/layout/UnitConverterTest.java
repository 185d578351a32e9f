/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import org.junit.jupiter.api.Test;

import dev.trellis.style.CssUnit;
import dev.trellis.style.Length;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnitConverterTest {

    private static final UnitContext UNITS = UnitContext.DEFAULT;

    private static int px(double value, CssUnit unit) {
        return UnitConverter.toDevicePixels(new Length(value, unit), UNITS);
    }

    @Test
    void testAbsoluteUnits() {
        assertThat(px(10, CssUnit.PX)).isEqualTo(10);
        assertThat(px(1, CssUnit.IN)).isEqualTo(96);
        assertThat(px(72, CssUnit.PT)).isEqualTo(96);
        assertThat(px(1, CssUnit.PC)).isEqualTo(16);
        assertThat(px(1, CssUnit.CM)).isEqualTo(37);
        assertThat(px(10, CssUnit.MM)).isEqualTo(37);
        assertThat(px(40, CssUnit.Q)).isEqualTo(37);
    }

    @Test
    void testFontRelativeUnits() {
        UnitContext units = new UnitContext(96, 20, 10, 800, 600);

        assertThat(UnitConverter.toDevicePixels(new Length(2, CssUnit.EM), units)).isEqualTo(40);
        assertThat(UnitConverter.toDevicePixels(new Length(2, CssUnit.REM), units)).isEqualTo(20);
        assertThat(UnitConverter.toDevicePixels(new Length(2, CssUnit.EX), units)).isEqualTo(20);
        assertThat(UnitConverter.toDevicePixels(new Length(2, CssUnit.CH), units)).isEqualTo(20);
    }

    @Test
    void testViewportUnits() {
        UnitContext units = UNITS.withViewport(800, 600);

        assertThat(UnitConverter.toDevicePixels(new Length(50, CssUnit.VW), units)).isEqualTo(400);
        assertThat(UnitConverter.toDevicePixels(new Length(50, CssUnit.VH), units)).isEqualTo(300);
        assertThat(UnitConverter.toDevicePixels(new Length(10, CssUnit.VMIN), units)).isEqualTo(60);
        assertThat(UnitConverter.toDevicePixels(new Length(10, CssUnit.VMAX), units)).isEqualTo(80);
    }

    @Test
    void testDpiScalesResult() {
        UnitContext hiDpi = UNITS.withDpi(192);

        assertThat(UnitConverter.toDevicePixels(Length.px(10), hiDpi)).isEqualTo(20);
    }

    @Test
    void testFractionsAreTruncated() {
        assertThat(px(10.9, CssUnit.PX)).isEqualTo(10);
        assertThat(px(-10.9, CssUnit.PX)).isEqualTo(-10);
    }

    @Test
    void testPercentages() {
        assertThat(UnitConverter.toDevicePixels(Length.percent(25), 400, UNITS)).isEqualTo(100);
        assertThat(UnitConverter.toDevicePixels(Length.px(7), 400, UNITS)).isEqualTo(7);
        assertThatThrownBy(() -> UnitConverter.toDevicePixels(Length.percent(25), UNITS))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
