package com.example.slidereplace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/** 纯内存文稿；游标由调用方显式移动 */
public class MemoryDeck implements SlideDeck {
    private final List<MemorySlide> slides = new ArrayList<>();
    private Integer cursor;

    public MemoryDeck(MemorySlide... slides) {
        Collections.addAll(this.slides, slides);
    }

    /** 追加一页并把游标移到新页 */
    public MemoryDeck addSlide(MemorySlide slide) {
        slides.add(slide);
        cursor = slides.size();
        return this;
    }

    public MemoryDeck onSlide(int oneBasedIndex) {
        if (oneBasedIndex < 1 || oneBasedIndex > slides.size()) {
            throw new SlideIndexOutOfRangeException(oneBasedIndex, slides.size());
        }
        cursor = oneBasedIndex;
        return this;
    }

    public List<MemorySlide> slides() { return Collections.unmodifiableList(slides); }

    @Override
    public int slideCount() { return slides.size(); }

    @Override
    public MemorySlide slide(int oneBasedIndex) { return slides.get(oneBasedIndex - 1); }

    @Override
    public OptionalInt cursor() { return cursor == null ? OptionalInt.empty() : OptionalInt.of(cursor); }
}
