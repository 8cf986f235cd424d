package com.example.slidereplace;

/** 替换调用的结构性错误；抛出时文档尚未被改动 */
public class SlideReplaceException extends RuntimeException {
    public SlideReplaceException(String message) {
        super(message);
    }

    public SlideReplaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
