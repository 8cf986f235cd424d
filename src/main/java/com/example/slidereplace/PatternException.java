package com.example.slidereplace;

import java.util.regex.PatternSyntaxException;

/** 正则编译失败（仅非 literal 模式可能出现） */
public class PatternException extends SlideReplaceException {
    public PatternException(String pattern, PatternSyntaxException cause) {
        super("无法编译正则 \"" + pattern + "\": " + cause.getDescription(), cause);
    }
}
