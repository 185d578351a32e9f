/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

/**
 * Configuration and collaborators shared by one or more layout passes.
 * <p>
 * Instances are immutable; the {@code with...} methods return modified copies.
 * {@link #create()} reads the grid size limits from the
 * {@value #MAX_IMPLICIT_ROWS_PROPERTY} and {@value #MAX_COLUMNS_PROPERTY}
 * system properties.
 * </p>
 */
public final class LayoutContext {

    public static final String MAX_IMPLICIT_ROWS_PROPERTY = "trellis.grid.maxImplicitRows";

    public static final String MAX_COLUMNS_PROPERTY = "trellis.grid.maxColumns";

    static final int DEFAULT_MAX_IMPLICIT_ROWS = 10_000;

    static final int DEFAULT_MAX_COLUMNS = 1_000;

    private static final System.Logger LOG = System.getLogger(LayoutContext.class.getName());

    private final UnitContext units;
    private final int maxImplicitRows;
    private final int maxColumns;
    private final LayoutDispatcher dispatcher;
    private final DimensionResolver dimensionResolver;
    private final FontMetrics fontMetrics;

    private LayoutContext(UnitContext units, int maxImplicitRows, int maxColumns, LayoutDispatcher dispatcher,
                          DimensionResolver dimensionResolver, FontMetrics fontMetrics) {
        if (units == null || dispatcher == null || dimensionResolver == null || fontMetrics == null) {
            throw new IllegalArgumentException("Layout collaborators must not be null");
        }
        if (maxImplicitRows < 1) {
            throw new IllegalArgumentException("Maximum implicit rows must be positive: " + maxImplicitRows);
        }
        if (maxColumns < 1) {
            throw new IllegalArgumentException("Maximum columns must be positive: " + maxColumns);
        }
        this.units = units;
        this.maxImplicitRows = maxImplicitRows;
        this.maxColumns = maxColumns;
        this.dispatcher = dispatcher;
        this.dimensionResolver = dimensionResolver;
        this.fontMetrics = fontMetrics;
    }

    /**
     * Create a context with default units, the default dispatcher and
     * dimension resolver, and fixed-width font metrics.
     */
    public static LayoutContext create() {
        return new LayoutContext(UnitContext.DEFAULT,
                limitFromSystemProperty(MAX_IMPLICIT_ROWS_PROPERTY, DEFAULT_MAX_IMPLICIT_ROWS),
                limitFromSystemProperty(MAX_COLUMNS_PROPERTY, DEFAULT_MAX_COLUMNS),
                DefaultLayoutDispatcher.INSTANCE, BasicDimensionResolver.INSTANCE, FixedWidthFontMetrics.DEFAULT);
    }

    private static int limitFromSystemProperty(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            int limit = Integer.parseInt(value.trim());
            if (limit > 0) {
                LOG.log(System.Logger.Level.DEBUG, "{0} set to {1}", property, limit);
                return limit;
            }
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring invalid {0} value ''{1}''", property, value);
            return defaultValue;
        }
        LOG.log(System.Logger.Level.WARNING, "Ignoring non-positive {0} value ''{1}''", property, value);
        return defaultValue;
    }

    public UnitContext units() {
        return units;
    }

    /**
     * Returns the number of rows a grid may grow to before layout fails.
     */
    public int maxImplicitRows() {
        return maxImplicitRows;
    }

    /**
     * Returns the number of columns a grid may grow to before layout fails.
     */
    public int maxColumns() {
        return maxColumns;
    }

    public LayoutDispatcher dispatcher() {
        return dispatcher;
    }

    public DimensionResolver dimensionResolver() {
        return dimensionResolver;
    }

    public FontMetrics fontMetrics() {
        return fontMetrics;
    }

    public LayoutContext withUnits(UnitContext units) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }

    public LayoutContext withMaxImplicitRows(int maxImplicitRows) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }

    public LayoutContext withMaxColumns(int maxColumns) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }

    public LayoutContext withDispatcher(LayoutDispatcher dispatcher) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }

    public LayoutContext withDimensionResolver(DimensionResolver dimensionResolver) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }

    public LayoutContext withFontMetrics(FontMetrics fontMetrics) {
        return new LayoutContext(units, maxImplicitRows, maxColumns, dispatcher, dimensionResolver, fontMetrics);
    }
}
