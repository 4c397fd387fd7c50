package org.truthtable.parser;

/**
 * Intervallo semiaperto [start, end) di caratteri a profondità 0.
 */
public final class UngroupedRange {

    private final int start;
    private final int end;

    public UngroupedRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Intervallo non valido: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UngroupedRange)) return false;
        UngroupedRange range = (UngroupedRange) other;
        return start == range.start && end == range.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
