package com.example.slidereplace;

import org.apache.poi.xslf.usermodel.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextParagraph;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class XslfParagraphTest {

    private static XSLFTextParagraph newParagraph(XSLFSlide slide) {
        XSLFTextBox box = slide.createTextBox();
        box.clearText();
        return box.addNewTextParagraph();
    }

    private static XSLFTextRun addRun(XSLFTextParagraph p, String text) {
        XSLFTextRun r = p.addNewTextRun();
        r.setText(text);
        return r;
    }

    @Test
    @DisplayName("读取 run：a:r 文本、a:br 视为换行")
    void readsRuns() throws Exception {
        try (XMLSlideShow ppt = new XMLSlideShow()) {
            XSLFTextParagraph p = newParagraph(ppt.createSlide());
            addRun(p, "foo");
            p.addLineBreak();
            addRun(p, "bar");

            XslfParagraph adapter = new XslfParagraph(p);

            assertThat(adapter.runs()).extracting(r -> r.text).containsExactly("foo", "\n", "bar");
            assertThat(adapter.runs()).extracting(r -> ((XslfRunFormat) r.format).kind()).containsExactly("r", "br", "r");
            assertThat(adapter.text()).isEqualTo("foo\nbar");
        }
    }

    @Test
    @DisplayName("跨 run 替换：头尾片段保留各自 rPr，替换 run 复制起始 run 的 rPr")
    void rewritesRunsKeepingFormatting() throws Exception {
        try (XMLSlideShow ppt = new XMLSlideShow()) {
            XSLFTextParagraph p = newParagraph(ppt.createSlide());
            addRun(p, "hello ").setBold(true);
            addRun(p, "PER").setItalic(true);
            addRun(p, "SON. ").setFontSize(20.0);

            XslfSlideDeck deck = new XslfSlideDeck(ppt);
            new SlideTextReplacer().replaceTextOnSlide(deck, "PERSON", "Alice", null, true, MatchOptions.literalText());

            CTTextParagraph xml = p.getXmlObject();
            assertThat(new XslfParagraph(p).runs()).extracting(r -> r.text).containsExactly("hello ", "Alice", ". ");
            assertThat(xml.sizeOfRArray()).isEqualTo(3);
            assertThat(xml.getRArray(0).getRPr().getB()).isTrue();
            assertThat(xml.getRArray(1).getRPr().getI()).isTrue();
            assertThat(xml.getRArray(2).getRPr().getSz()).isEqualTo(2000);
            assertThat(xml.getRArray(2).getRPr().isSetI()).isFalse();
        }
    }

    @Test
    @DisplayName("未触及的换行保持为 a:br；被匹配吞掉的换行随之删除")
    void lineBreaks() throws Exception {
        try (XMLSlideShow ppt = new XMLSlideShow()) {
            XSLFSlide slide = ppt.createSlide();
            XSLFTextParagraph keep = newParagraph(slide);
            addRun(keep, "foo");
            keep.addLineBreak();
            addRun(keep, "bar");
            XSLFTextParagraph join = newParagraph(slide);
            addRun(join, "foo");
            join.addLineBreak();
            addRun(join, "bar");

            XslfParagraph keepAdapter = new XslfParagraph(keep);
            ReplacementOrchestrator.replaceInScope(List.of(keepAdapter),
                    PatternMatcher.compile("bar", MatchOptions.defaults()), "baz");
            assertThat(keepAdapter.runs()).extracting(r -> r.text).containsExactly("foo", "\n", "baz");
            assertThat(keep.getXmlObject().sizeOfBrArray()).isEqualTo(1);

            XslfParagraph joinAdapter = new XslfParagraph(join);
            ReplacementOrchestrator.replaceInScope(List.of(joinAdapter),
                    PatternMatcher.compile("o\\nb", MatchOptions.defaults()), " ");
            assertThat(joinAdapter.runs()).extracting(r -> r.text).containsExactly("fo", " ", "ar");
            assertThat(join.getXmlObject().sizeOfBrArray()).isZero();
        }
    }

    @Test
    @DisplayName("写出后重新打开，文本为替换后的结果")
    void roundTrip() throws Exception {
        byte[] bytes;
        try (XMLSlideShow ppt = new XMLSlideShow(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSLFSlide slide = ppt.createSlide();
            XSLFTextParagraph p = newParagraph(slide);
            addRun(p, "Hello, PER");
            addRun(p, "SON ").setBold(true);

            XslfSlideDeck deck = new XslfSlideDeck(ppt);
            new SlideTextReplacer().replaceTextInDocument(deck, "person", "Bob", true,
                    MatchOptions.builder().ignoreCase(true).build());
            ppt.write(out);
            bytes = out.toByteArray();
        }

        try (XMLSlideShow reopened = new XMLSlideShow(new ByteArrayInputStream(bytes))) {
            XslfSlideDeck deck = new XslfSlideDeck(reopened);
            XslfParagraph replaced = deck.slide(1).paragraphs().stream()
                    .filter(p -> !p.text().isEmpty()).findFirst().orElseThrow();
            assertThat(replaced.text()).isEqualTo("Hello, Bob ");
            assertThat(replaced.runs()).extracting(r -> r.text).containsExactly("Hello, ", "Bob", " ");
        }
    }

    @Test
    @DisplayName("组合图形与表格单元格中的段落也会被收集")
    void collectsGroupAndTableParagraphs() throws Exception {
        try (XMLSlideShow ppt = new XMLSlideShow()) {
            XSLFSlide slide = ppt.createSlide();
            XSLFTextParagraph top = newParagraph(slide);
            addRun(top, "top");

            XSLFGroupShape group = slide.createGroup();
            XSLFTextBox inGroup = group.createTextBox();
            inGroup.clearText();
            addRun(inGroup.addNewTextParagraph(), "grouped");

            XSLFTable table = slide.createTable(1, 2);
            table.getCell(0, 0).setText("c1");
            table.getCell(0, 1).setText("c2");

            XslfSlideDeck deck = new XslfSlideDeck(ppt);
            assertThat(deck.slide(1).paragraphs()).extracting(XslfParagraph::text)
                    .containsSubsequence("top", "grouped", "c1", "c2");
        }
    }

    @Test
    @DisplayName("游标默认指向最后一页")
    void cursorDefaultsToLastSlide() throws Exception {
        try (XMLSlideShow ppt = new XMLSlideShow()) {
            assertThat(new XslfSlideDeck(ppt).cursor()).isEmpty();
            ppt.createSlide();
            ppt.createSlide();
            XslfSlideDeck deck = new XslfSlideDeck(ppt);
            assertThat(deck.cursor()).hasValue(2);
            assertThat(deck.onSlide(1).cursor()).hasValue(1);
        }
    }
}
