package com.example.slidereplace;

import org.apache.poi.xslf.usermodel.*;

import java.util.ArrayList;
import java.util.List;

/** 一页 pptx：按 shape 顺序收集文本段落；组合图形递归，表格按行、列遍历单元格 */
public class XslfSlide implements DeckSlide {
    private final XSLFSlide slide;

    public XslfSlide(XSLFSlide slide) {
        this.slide = slide;
    }

    public XSLFSlide getSlide() { return slide; }

    @Override
    public List<XslfParagraph> paragraphs() {
        List<XslfParagraph> out = new ArrayList<>();
        for (XSLFShape shape : slide.getShapes()) collectFromShape(shape, out);
        return out;
    }

    private static void collectFromShape(XSLFShape shape, List<XslfParagraph> out) {
        if (shape instanceof XSLFGroupShape group) {
            for (XSLFShape child : group.getShapes()) collectFromShape(child, out);
            return;
        }

        if (shape instanceof XSLFTextShape textShape) {
            collectFromText(textShape, out);
        } else if (shape instanceof XSLFTable table) {
            for (XSLFTableRow row : table.getRows()) {
                for (XSLFTableCell cell : row.getCells()) collectFromText(cell, out);
            }
        }
    }

    private static void collectFromText(XSLFTextShape textShape, List<XslfParagraph> out) {
        for (XSLFTextParagraph paragraph : textShape.getTextParagraphs()) out.add(new XslfParagraph(paragraph));
    }
}
