package com.example.slidereplace;

import java.util.OptionalInt;

/** 演示文稿：有序幻灯片 + “当前页”游标（1 起始，可能未设置） */
public interface SlideDeck {

    int slideCount();

    /** 1 起始下标；调用方负责先校验范围 */
    DeckSlide slide(int oneBasedIndex);

    OptionalInt cursor();
}
