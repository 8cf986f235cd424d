package com.example.slidereplace;

/** 提示性信号：整个范围内没有任何替换发生。不是错误 */
public final class NoMatchWarning {
    public final String oldValue;
    public final String scope;
    public final int paragraphsScanned;

    public NoMatchWarning(String oldValue, String scope, int paragraphsScanned) {
        this.oldValue = oldValue;
        this.scope = scope;
        this.paragraphsScanned = paragraphsScanned;
    }

    public String message() {
        return "未找到 \"" + oldValue + "\"（" + scope + "，扫描 " + paragraphsScanned + " 个段落）";
    }

    @Override
    public String toString() { return message(); }
}
