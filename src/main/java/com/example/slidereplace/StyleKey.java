package com.example.slidereplace;

import java.util.Locale;
import java.util.Objects;

/** 内存文档用的样式指纹；值语义，拆分时原样共享 */
public final class StyleKey implements RunFormat {
    public final String fontFamily;
    public final Integer fontSizePt;
    public final boolean bold, italic, strike;
    public final String underline, colorHex;

    private StyleKey(Builder b) {
        this.fontFamily = nz(b.fontFamily);
        this.fontSizePt = (b.fontSizePt != null && b.fontSizePt >= 0) ? b.fontSizePt : null;
        this.bold = b.bold; this.italic = b.italic; this.strike = b.strike;
        this.underline = nz(b.underline);
        this.colorHex = normHex(b.colorHex);
    }

    public static StyleKey plain() { return new Builder().build(); }

    public static Builder builder() { return new Builder(); }

    private static String nz(String s){ return (s==null||s.isEmpty())?null:s; }
    private static String normHex(String s){
        if (s==null||s.isEmpty()) return null;
        String t = s.startsWith("#")?s.substring(1):s;
        if (t.length()==8) t=t.substring(2);
        return t.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StyleKey)) return false;
        StyleKey k = (StyleKey) o;
        return bold == k.bold && italic == k.italic && strike == k.strike
            && Objects.equals(fontFamily, k.fontFamily) && Objects.equals(fontSizePt, k.fontSizePt)
            && Objects.equals(underline, k.underline) && Objects.equals(colorHex, k.colorHex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontFamily, fontSizePt, bold, italic, strike, underline, colorHex);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (fontFamily != null) sb.append(fontFamily).append(' ');
        if (fontSizePt != null) sb.append(fontSizePt).append("pt ");
        sb.append(bold?"B":"b").append(italic?"I":"i").append(strike?"S":"s");
        if (underline != null) sb.append(" u=").append(underline);
        if (colorHex != null) sb.append(" #").append(colorHex);
        return sb.toString();
    }

    public static final class Builder {
        private String fontFamily;
        private Integer fontSizePt;
        private boolean bold, italic, strike;
        private String underline, colorHex;

        public Builder fontFamily(String v){ this.fontFamily=v; return this; }
        public Builder fontSizePt(Integer v){ this.fontSizePt=v; return this; }
        public Builder bold(boolean v){ this.bold=v; return this; }
        public Builder italic(boolean v){ this.italic=v; return this; }
        public Builder strike(boolean v){ this.strike=v; return this; }
        public Builder underline(String v){ this.underline=v; return this; }
        public Builder colorHex(String v){ this.colorHex=v; return this; }
        public StyleKey build(){ return new StyleKey(this); }
    }
}
