package com.example.slidereplace;

public class SlideIndexOutOfRangeException extends SlideReplaceException {
    private final int slideIndex;
    private final int slideCount;

    public SlideIndexOutOfRangeException(int slideIndex, int slideCount) {
        super("幻灯片下标越界: " + slideIndex + "（共 " + slideCount + " 页，下标从 1 开始）");
        this.slideIndex = slideIndex;
        this.slideCount = slideCount;
    }

    public int getSlideIndex() { return slideIndex; }

    public int getSlideCount() { return slideCount; }
}
