package com.example.slidereplace;

import java.util.List;

/** 幻灯片：按 shape → 段落 的文档顺序给出全部文本段落 */
public interface DeckSlide {

    List<? extends RunParagraph> paragraphs();
}
