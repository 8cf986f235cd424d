package com.example.slidereplace;

/** 扁平文本上的半开区间 [start, end) */
public final class MatchSpan {
    public final int start;
    public final int end;

    public MatchSpan(int start, int end) {
        if (start < 0 || end < start) throw new IllegalArgumentException("非法区间: [" + start + ", " + end + ")");
        this.start = start;
        this.end = end;
    }

    public int length() { return end - start; }

    public boolean isEmpty() { return start == end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchSpan)) return false;
        MatchSpan s = (MatchSpan) o;
        return start == s.start && end == s.end;
    }

    @Override
    public int hashCode() { return 31 * start + end; }

    @Override
    public String toString() { return "[" + start + ", " + end + ")"; }
}
