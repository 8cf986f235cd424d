package com.example.slidereplace;

import java.util.regex.Pattern;

/** 匹配开关：literal / ignoreCase，以及直接透传给 java.util.regex 的标志 */
public final class MatchOptions {
    public final boolean literal;               // 按字面量匹配，元字符全部转义
    public final boolean ignoreCase;            // 忽略大小写（含 Unicode）
    public final boolean multiline;             // ^ $ 按行匹配
    public final boolean dotAll;                // . 匹配换行（a:br 在扁平文本中是 \n）
    public final boolean comments;              // 扩展语法：忽略空白与 # 注释
    public final boolean unicodeCharacterClass; // \w \b 等按 Unicode 判定

    private MatchOptions(Builder b) {
        this.literal = b.literal;
        this.ignoreCase = b.ignoreCase;
        this.multiline = b.multiline;
        this.dotAll = b.dotAll;
        this.comments = b.comments;
        this.unicodeCharacterClass = b.unicodeCharacterClass;
    }

    /** 默认：正则模式、区分大小写 */
    public static MatchOptions defaults() {
        return new Builder().build();
    }

    public static MatchOptions literalText() {
        return new Builder().literal(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    int toFlags() {
        int flags = 0;
        if (ignoreCase) flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        if (literal) return flags;
        if (multiline) flags |= Pattern.MULTILINE;
        if (dotAll) flags |= Pattern.DOTALL;
        if (comments) flags |= Pattern.COMMENTS;
        if (unicodeCharacterClass) flags |= Pattern.UNICODE_CHARACTER_CLASS;
        return flags;
    }

    @Override
    public String toString() {
        return "MatchOptions{literal=" + literal + ", ignoreCase=" + ignoreCase + ", multiline=" + multiline
            + ", dotAll=" + dotAll + ", comments=" + comments + ", unicodeCharacterClass=" + unicodeCharacterClass + "}";
    }

    public static final class Builder {
        private boolean literal = false;
        private boolean ignoreCase = false;
        private boolean multiline = false;
        private boolean dotAll = false;
        private boolean comments = false;
        private boolean unicodeCharacterClass = false;

        public Builder literal(boolean v){ this.literal=v; return this; }
        public Builder ignoreCase(boolean v){ this.ignoreCase=v; return this; }
        public Builder multiline(boolean v){ this.multiline=v; return this; }
        public Builder dotAll(boolean v){ this.dotAll=v; return this; }
        public Builder comments(boolean v){ this.comments=v; return this; }
        public Builder unicodeCharacterClass(boolean v){ this.unicodeCharacterClass=v; return this; }
        public MatchOptions build(){ return new MatchOptions(this); }
    }
}
