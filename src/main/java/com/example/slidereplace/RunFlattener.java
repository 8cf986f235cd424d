package com.example.slidereplace;

import java.util.List;

/** 把有序 run 拼成一条逻辑字符串，并记录每个字符来自哪个 run；只读 */
public final class RunFlattener {
    private RunFlattener() {}

    public static FlattenedParagraph flatten(RunParagraph paragraph) {
        return flatten(paragraph.runs());
    }

    public static FlattenedParagraph flatten(List<TextRun> runs) {
        int total = 0;
        for (TextRun r : runs) total += r.text.length();

        StringBuilder sb = new StringBuilder(total);
        int[] runIdx = new int[total];
        int[] local = new int[total];
        int pos = 0;
        for (int i = 0; i < runs.size(); i++) {
            String t = runs.get(i).text;
            sb.append(t);
            for (int k = 0; k < t.length(); k++, pos++) {
                runIdx[pos] = i;
                local[pos] = k;
            }
        }
        return new FlattenedParagraph(sb.toString(), new OffsetMap(runIdx, local, runs.size()));
    }
}
