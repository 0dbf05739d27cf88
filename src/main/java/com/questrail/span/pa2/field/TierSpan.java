package com.questrail.span.pa2.field;

/**
 * A start/end contract month pair describing one margin-rate tier,
 * e.g. {@code (202507, 202512)}.
 */
public record TierSpan(int startMonth, int endMonth)
{
    @Override
    public String toString() {
        return "(" + startMonth + ", " + endMonth + ")";
    }
}
