package com.example.slidereplace;

import java.util.Objects;

/** 段内最小样式文本单元：(text, format) */
public final class TextRun {
    public final String text;
    public final RunFormat format;

    public TextRun(String text, RunFormat format) {
        this.text = text == null ? "" : text;
        this.format = format;
    }

    /** 同格式、新文本（拆分片段与替换 run 都走这里） */
    public TextRun withText(String newText) {
        return new TextRun(newText, format);
    }

    public boolean isEmpty() { return text.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextRun)) return false;
        TextRun other = (TextRun) o;
        return text.equals(other.text) && Objects.equals(format, other.format);
    }

    @Override
    public int hashCode() { return Objects.hash(text, format); }

    @Override
    public String toString() { return "TextRun{" + text + "|" + format + "}"; }
}
