package com.example.slidereplace;

import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextParagraph;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;

/**
 * 直接读写 a:p 下的 run 元素。a:br 视为文本 "\n"，a:fld 取其 a:t。
 * 写回时：文本未变的 run 原样复制（换行、域保持原状），其余一律写成带模板 a:rPr 的 a:r。
 */
public class XslfParagraph implements RunParagraph {
    private static final String NS_A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    private static final QName QN_A_R    = new QName(NS_A, "r");
    private static final QName QN_A_BR   = new QName(NS_A, "br");
    private static final QName QN_A_FLD  = new QName(NS_A, "fld");
    private static final QName QN_A_T    = new QName(NS_A, "t");
    private static final QName QN_A_RPR  = new QName(NS_A, "rPr");
    private static final QName QN_A_END  = new QName(NS_A, "endParaRPr");

    private final CTTextParagraph p;

    public XslfParagraph(XSLFTextParagraph paragraph) {
        this(paragraph.getXmlObject());
    }

    XslfParagraph(CTTextParagraph p) {
        this.p = p;
    }

    public CTTextParagraph getXmlObject() { return p; }

    @Override
    public List<TextRun> runs() {
        List<TextRun> out = new ArrayList<>();
        for (XmlObject el : runElements()) {
            String text = runText(el);
            out.add(new TextRun(text, new XslfRunFormat(el, text)));
        }
        return out;
    }

    @Override
    public void setRuns(List<TextRun> runs) {
        List<XmlObject> old = runElements();
        try (XmlCursor dst = insertionPoint(old)) {
            for (TextRun r : runs) {
                XslfRunFormat f = (r.format instanceof XslfRunFormat) ? (XslfRunFormat) r.format : null;
                if (f != null && f.originalText.equals(r.text)) {
                    try (XmlCursor src = f.element.newCursor()) { src.copyXml(dst); }
                } else {
                    writeRegularRun(dst, f, r.text);
                }
            }
        }
        for (XmlObject el : old) {
            try (XmlCursor c = el.newCursor()) { c.removeXml(); }
        }
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (XmlObject el : runElements()) sb.append(runText(el));
        return sb.toString();
    }

    private List<XmlObject> runElements() {
        List<XmlObject> out = new ArrayList<>();
        try (XmlCursor c = p.newCursor()) {
            if (!c.toFirstChild()) return out;
            do {
                QName n = c.getName();
                if (QN_A_R.equals(n) || QN_A_BR.equals(n) || QN_A_FLD.equals(n)) out.add(c.getObject());
            } while (c.toNextSibling());
        }
        return out;
    }

    /** 新 run 紧跟在最后一个旧 run 之后（旧 run 随后整体删除）；段落无 run 时插在 endParaRPr 之前或段尾 */
    private XmlCursor insertionPoint(List<XmlObject> old) {
        if (!old.isEmpty()) {
            XmlCursor c = old.get(old.size() - 1).newCursor();
            c.toEndToken();
            c.toNextToken();
            return c;
        }
        XmlCursor c = p.newCursor();
        if (c.toChild(QN_A_END)) return c;
        c.toEndToken();
        return c;
    }

    private static String runText(XmlObject el) {
        try (XmlCursor c = el.newCursor()) {
            if (QN_A_BR.equals(c.getName())) return "\n";
            if (c.toChild(QN_A_T)) {
                String v = c.getTextValue();
                return v == null ? "" : v;
            }
        }
        return "";
    }

    /** <a:r>[a:rPr 复制自模板]<a:t>text</a:t></a:r>，写在 dst 之前 */
    private static void writeRegularRun(XmlCursor dst, XslfRunFormat template, String text) {
        dst.beginElement(QN_A_R);
        if (template != null) {
            try (XmlCursor src = template.element.newCursor()) {
                if (src.toChild(QN_A_RPR)) src.copyXml(dst);
            }
        }
        dst.beginElement(QN_A_T);
        dst.insertChars(text);
        dst.toNextToken(); // </a:t>
        dst.toNextToken(); // </a:r>
    }
}
