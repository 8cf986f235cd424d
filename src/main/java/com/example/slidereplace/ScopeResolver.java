package com.example.slidereplace;

import java.util.ArrayList;
import java.util.List;

/** 把 “当前页 / 指定页 / 整个文稿” 解析成有序段落列表；不改动文档 */
public final class ScopeResolver {
    private ScopeResolver() {}

    /** slideIndex 为 null 时取文稿游标 */
    public static List<RunParagraph> resolveScope(SlideDeck deck, Integer slideIndex) {
        int idx = resolveSlideIndex(deck, slideIndex);
        return new ArrayList<>(deck.slide(idx).paragraphs());
    }

    /** 整个文稿：按页序拼接各页段落 */
    public static List<RunParagraph> resolveDocument(SlideDeck deck) {
        List<RunParagraph> out = new ArrayList<>();
        for (int i = 1; i <= deck.slideCount(); i++) out.addAll(deck.slide(i).paragraphs());
        return out;
    }

    public static int resolveSlideIndex(SlideDeck deck, Integer slideIndex) {
        int idx;
        if (slideIndex == null) {
            idx = deck.cursor().orElseThrow(NoCurrentSlideException::new);
        } else {
            idx = slideIndex;
        }
        if (idx < 1 || idx > deck.slideCount()) throw new SlideIndexOutOfRangeException(idx, deck.slideCount());
        return idx;
    }
}
