package com.example.slidereplace;

import java.util.List;

/** 段落：有序 run 序列；各 run 文本顺序拼接即为段落可见文本 */
public interface RunParagraph {

    List<TextRun> runs();

    /** 整体替换 run 序列 */
    void setRuns(List<TextRun> runs);
}
