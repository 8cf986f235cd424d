package com.example.slidereplace;

import org.apache.xmlbeans.XmlObject;

/**
 * pptx run 的格式：直接持有原始 run 元素（a:r / a:br / a:fld）作为模板。
 * 只在下一次对同一段落 setRuns 之前有效。
 */
public final class XslfRunFormat implements RunFormat {
    final XmlObject element;
    final String originalText;

    XslfRunFormat(XmlObject element, String originalText) {
        this.element = element;
        this.originalText = originalText;
    }

    /** 元素本地名：r / br / fld */
    public String kind() {
        return element.getDomNode().getLocalName();
    }

    @Override
    public String toString() { return "XslfRunFormat{" + kind() + "}"; }
}
