package com.example.slidereplace;

public class NoCurrentSlideException extends SlideReplaceException {
    public NoCurrentSlideException() {
        super("未指定 slideIndex，且文稿没有当前页");
    }
}
