package com.largomodo.ksynth.core;

import java.util.Objects;

/**
 * A scalar parameter that is always inside the bounds of its {@link Category}.
 * <p>
 * Every construction path, including the canonical constructor, validates the
 * range and fails with {@link ParseError#RANGE}. Wire conversion applies the
 * category bias in one place, so {@code fromWireByte(c, v.toWireByte())}
 * returns {@code v} for every legal value.
 *
 * @param category bounds and bias rule
 * @param value    the logical (user-facing) value
 */
public record BoundedValue(Category category, int value) {

    public BoundedValue {
        Objects.requireNonNull(category, "category must not be null");
        if (!category.contains(value)) {
            throw SysexParseException.rangeError(category, value);
        }
    }

    /**
     * Validated construction from a logical value.
     *
     * @throws SysexParseException with kind RANGE if {@code n} is out of bounds
     */
    public static BoundedValue of(Category category, int n) {
        return new BoundedValue(category, n);
    }

    /**
     * The category's zero point.
     */
    public static BoundedValue zero(Category category) {
        return new BoundedValue(category, category.zero());
    }

    /**
     * Removes the category bias from a raw wire value and validates the result.
     *
     * @throws SysexParseException with kind RANGE if the unbiased value is out of bounds
     */
    public static BoundedValue fromWireByte(Category category, int wire) {
        Objects.requireNonNull(category, "category must not be null");
        return new BoundedValue(category, wire - category.bias());
    }

    /**
     * Applies the category bias. The result may exceed seven bits only for
     * categories whose composites spread the value over several bytes.
     */
    public int toWireByte() {
        return value + category.bias();
    }

    public BoundedValue withValue(int n) {
        return new BoundedValue(category, n);
    }

    /**
     * Guard for record components: rejects null and values of another category.
     *
     * @return the checked value
     */
    public static BoundedValue require(BoundedValue value, Category category, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.category != category) {
            throw new IllegalArgumentException(name + " must be " + category + ", got " + value.category);
        }
        return value;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
