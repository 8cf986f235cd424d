package com.example.slidereplace;

/**
 * 扁平文本下标 → (runIndex, localOffset)。
 * 两个并行数组，每个字符一项；空 run 不占位。任何 run 被改写后即失效。
 */
public final class OffsetMap {
    private final int[] runIndexes;
    private final int[] localOffsets;
    private final int runCount;

    OffsetMap(int[] runIndexes, int[] localOffsets, int runCount) {
        this.runIndexes = runIndexes;
        this.localOffsets = localOffsets;
        this.runCount = runCount;
    }

    /** 扁平文本长度 */
    public int length() { return runIndexes.length; }

    /** 建图时的 run 数量（含空 run） */
    public int runCount() { return runCount; }

    public int runIndexAt(int offset) {
        check(offset);
        return runIndexes[offset];
    }

    public int localOffsetAt(int offset) {
        check(offset);
        return localOffsets[offset];
    }

    private void check(int offset) {
        if (offset < 0 || offset >= runIndexes.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " 超出扁平文本长度 " + runIndexes.length);
        }
    }
}
