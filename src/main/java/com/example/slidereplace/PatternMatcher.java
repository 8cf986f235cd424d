package com.example.slidereplace;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** 在整段扁平文本上做全局、不重叠、最左优先的匹配 */
public final class PatternMatcher {
    private PatternMatcher() {}

    /** 编译一次，整个范围复用；literal 模式下永不失败 */
    public static Pattern compile(String pattern, MatchOptions options) {
        String source = options.literal ? Pattern.quote(pattern) : pattern;
        try {
            return Pattern.compile(source, options.toFlags());
        } catch (PatternSyntaxException e) {
            throw new PatternException(pattern, e);
        }
    }

    public static List<MatchSpan> findMatches(String text, String pattern, MatchOptions options) {
        return findMatches(text, compile(pattern, options));
    }

    public static List<MatchSpan> findMatches(String text, Pattern pattern) {
        List<MatchSpan> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = pattern.matcher(text);
        int from = 0;
        int len = text.length();
        while (from <= len && m.find(from)) {
            int s = m.start(), e = m.end();
            out.add(new MatchSpan(s, e));
            if (e > s) {
                from = e;
            } else {
                // 零长匹配：前进一个码点，避免死循环
                if (e >= len) break;
                from = e + Character.charCount(text.codePointAt(e));
            }
        }
        return out;
    }
}
