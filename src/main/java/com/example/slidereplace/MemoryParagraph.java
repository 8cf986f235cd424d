package com.example.slidereplace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 纯内存段落 */
public class MemoryParagraph implements RunParagraph {
    private final List<TextRun> runs = new ArrayList<>();

    public MemoryParagraph(List<TextRun> runs) {
        if (runs != null) this.runs.addAll(runs);
    }

    public static MemoryParagraph of(TextRun... runs) {
        List<TextRun> list = new ArrayList<>();
        Collections.addAll(list, runs);
        return new MemoryParagraph(list);
    }

    /** 单一格式的段落 */
    public static MemoryParagraph plain(String text) {
        return of(new TextRun(text, StyleKey.plain()));
    }

    @Override
    public List<TextRun> runs() {
        return Collections.unmodifiableList(runs);
    }

    @Override
    public void setRuns(List<TextRun> newRuns) {
        // newRuns 可能就是 runs() 返回的视图，先拷贝再清空
        List<TextRun> copy = newRuns == null ? List.of() : new ArrayList<>(newRuns);
        runs.clear();
        runs.addAll(copy);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (TextRun r : runs) sb.append(r.text);
        return sb.toString();
    }

    @Override
    public String toString() { return runs.toString(); }
}
