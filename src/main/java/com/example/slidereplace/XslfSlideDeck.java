package com.example.slidereplace;

import org.apache.poi.xslf.usermodel.XMLSlideShow;

import java.util.OptionalInt;

/** XMLSlideShow 适配；游标默认指向最后一页，空文稿时未设置 */
public class XslfSlideDeck implements SlideDeck {
    private final XMLSlideShow ppt;
    private Integer cursor;

    public XslfSlideDeck(XMLSlideShow ppt) {
        this.ppt = ppt;
        int n = ppt.getSlides().size();
        this.cursor = n > 0 ? n : null;
    }

    public XMLSlideShow getSlideShow() { return ppt; }

    public XslfSlideDeck onSlide(int oneBasedIndex) {
        int n = slideCount();
        if (oneBasedIndex < 1 || oneBasedIndex > n) throw new SlideIndexOutOfRangeException(oneBasedIndex, n);
        cursor = oneBasedIndex;
        return this;
    }

    @Override
    public int slideCount() { return ppt.getSlides().size(); }

    @Override
    public XslfSlide slide(int oneBasedIndex) {
        return new XslfSlide(ppt.getSlides().get(oneBasedIndex - 1));
    }

    @Override
    public OptionalInt cursor() { return cursor == null ? OptionalInt.empty() : OptionalInt.of(cursor); }
}
