package com.example.slidereplace;

/** 扁平化结果：整段文本 + 偏移映射 */
public final class FlattenedParagraph {
    public final String text;
    public final OffsetMap offsetMap;

    FlattenedParagraph(String text, OffsetMap offsetMap) {
        this.text = text;
        this.offsetMap = offsetMap;
    }
}
