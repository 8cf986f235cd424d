package com.example.slidereplace;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 按匹配区间改写段落的 run 结构。
 * <p>
 * 对区间 [s, e)：保留起始 run 在 s 之前的部分、结束 run 在 e 之后的部分（各自原格式），
 * 删除中间全部 run，插入一个沿用起始 run 格式的替换 run（替换文本为空时不插入）。
 * 区间从右往左处理，左侧区间在建图时算出的偏移因此始终有效。
 * <p>
 * 边界约定：恰好落在 run 边界上的 s 归属于持有字符 s 的 run（即后一个 run）；
 * 零长区间插入到持有字符 s 的 run，s 等于文本长度时插入到最后一个 run 末尾。
 */
public final class ChunkRewriter {
    private ChunkRewriter() {}

    /** 一处替换：区间 + 替换文本（按字面写入） */
    public static final class Replacement {
        public final MatchSpan span;
        public final String text;

        public Replacement(MatchSpan span, String text) {
            this.span = span;
            this.text = text == null ? "" : text;
        }
    }

    private static final Comparator<Replacement> RIGHT_TO_LEFT =
        Comparator.<Replacement>comparingInt(r -> r.span.start).thenComparingInt(r -> r.span.end).reversed();

    /** 改写并写回段落；flattened 必须来自该段落当前的 run 序列 */
    public static void apply(RunParagraph paragraph, FlattenedParagraph flattened, List<Replacement> replacements) {
        if (replacements == null || replacements.isEmpty()) return;
        paragraph.setRuns(apply(paragraph.runs(), flattened.offsetMap, replacements));
    }

    /** 纯函数版本：返回新的 run 列表，未触及的 run 保持原实例 */
    public static List<TextRun> apply(List<TextRun> runs, OffsetMap map, List<Replacement> replacements) {
        List<TextRun> work = new ArrayList<>(runs);
        if (replacements == null || replacements.isEmpty()) return work;
        if (map.runCount() != runs.size()) {
            throw new IllegalArgumentException("偏移映射已过期: 建图时 " + map.runCount() + " 个 run，当前 " + runs.size());
        }
        if (runs.isEmpty()) throw new IllegalArgumentException("段落没有 run，无法插入替换文本");

        List<Replacement> ordered = new ArrayList<>(replacements);
        ordered.sort(RIGHT_TO_LEFT);

        int len = map.length();
        int leftBound = Integer.MAX_VALUE;
        for (Replacement rep : ordered) {
            MatchSpan sp = rep.span;
            if (sp.end > len) throw new IllegalArgumentException("区间 " + sp + " 超出文本长度 " + len);
            if (sp.end > leftBound) throw new IllegalArgumentException("区间重叠: " + sp);
            leftBound = sp.start;
            if (sp.isEmpty() && rep.text.isEmpty()) continue;
            rewriteOne(work, map, sp, rep.text);
        }
        return work;
    }

    private static void rewriteOne(List<TextRun> work, OffsetMap map, MatchSpan sp, String replacement) {
        int len = map.length();
        int rf, ls, rl, le;
        if (!sp.isEmpty()) {
            rf = map.runIndexAt(sp.start);
            ls = map.localOffsetAt(sp.start);
            rl = map.runIndexAt(sp.end - 1);
            le = map.localOffsetAt(sp.end - 1) + 1;
        } else if (sp.start < len) {
            rf = rl = map.runIndexAt(sp.start);
            ls = le = map.localOffsetAt(sp.start);
        } else if (len > 0) {
            rf = rl = map.runIndexAt(len - 1);
            ls = le = map.localOffsetAt(len - 1) + 1;
        } else {
            // 全部为空 run：插到最后一个
            rf = rl = work.size() - 1;
            ls = le = 0;
        }

        TextRun first = work.get(rf);
        TextRun last = work.get(rl);

        List<TextRun> pieces = new ArrayList<>(3);
        if (ls > 0) pieces.add(first.withText(first.text.substring(0, ls)));
        if (!replacement.isEmpty()) pieces.add(first.withText(replacement));
        if (le < last.text.length()) pieces.add(last.withText(last.text.substring(le)));

        work.subList(rf, rl + 1).clear();
        work.addAll(rf, pieces);
    }
}
