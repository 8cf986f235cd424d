package com.example.slidereplace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkRewriterTest {

    private static final StyleKey A = StyleKey.builder().bold(true).build();
    private static final StyleKey B = StyleKey.builder().italic(true).colorHex("#FF0000").build();
    private static final StyleKey C = StyleKey.builder().fontSizePt(20).build();

    private static List<TextRun> rewrite(List<TextRun> runs, ChunkRewriter.Replacement... reps) {
        return ChunkRewriter.apply(runs, RunFlattener.flatten(runs).offsetMap, List.of(reps));
    }

    private static ChunkRewriter.Replacement rep(int s, int e, String text) {
        return new ChunkRewriter.Replacement(new MatchSpan(s, e), text);
    }

    @Test
    @DisplayName("整 run 命中：直接替换，格式沿用原 run，两侧 run 原样保留")
    void wholeRunReplaced() {
        TextRun r0 = new TextRun("hello ", A), r1 = new TextRun("PERSON", B), r2 = new TextRun(". ", C);

        List<TextRun> out = rewrite(List.of(r0, r1, r2), rep(6, 12, "Alice"));

        assertThat(out).containsExactly(r0, new TextRun("Alice", B), r2);
        assertThat(out.get(0)).isSameAs(r0);
        assertThat(out.get(2)).isSameAs(r2);
    }

    @Test
    @DisplayName("跨 run：首 run 留头、末 run 留尾，替换文本用首 run 格式")
    void spanAcrossRuns() {
        List<TextRun> runs = List.of(new TextRun("hel", A), new TextRun("lo wo", B), new TextRun("rld", C));

        List<TextRun> out = rewrite(runs, rep(2, 9, "X"));

        assertThat(out).containsExactly(new TextRun("he", A), new TextRun("X", A), new TextRun("ld", C));
    }

    @Test
    @DisplayName("替换为空串即删除，不插入 run")
    void emptyReplacementDeletes() {
        List<TextRun> runs = List.of(new TextRun("hel", A), new TextRun("lo wo", B), new TextRun("rld", C));

        List<TextRun> out = rewrite(runs, rep(2, 9, ""));

        assertThat(out).containsExactly(new TextRun("he", A), new TextRun("ld", C));
    }

    @Test
    @DisplayName("同一 run 内多处匹配：从右往左处理，偏移不漂移")
    void severalMatchesInOneRun() {
        List<TextRun> runs = List.of(new TextRun("aXbXc", A));

        List<TextRun> out = rewrite(runs, rep(1, 2, "YY"), rep(3, 4, "YY"));

        assertThat(out).extracting(r -> r.text).containsExactly("a", "YY", "b", "YY", "c");
        assertThat(out).allMatch(r -> r.format.equals(A));
        assertThat(RunFlattener.flatten(out).text).isEqualTo("aYYbYYc");
    }

    @Test
    @DisplayName("区间内的空 run 删除，区间外的空 run 保留")
    void emptyRunsInsideAndOutside() {
        TextRun empty = new TextRun("", C);
        List<TextRun> runs = List.of(new TextRun("ab", A), new TextRun("", B), new TextRun("cd", B), empty,
                new TextRun("ef", C));

        List<TextRun> inside = rewrite(runs, rep(1, 5, "Z"));
        assertThat(inside).containsExactly(new TextRun("a", A), new TextRun("Z", A), new TextRun("f", C));

        List<TextRun> outside = rewrite(runs, rep(0, 1, "Z"));
        assertThat(outside).extracting(r -> r.text).containsExactly("Z", "b", "", "cd", "", "ef");
        assertThat(outside.get(4)).isSameAs(empty);
    }

    @Test
    @DisplayName("零长匹配落在 run 边界：插入后一个 run；落在文本末尾：插入最后一个 run")
    void zeroLengthInsertion() {
        TextRun ab = new TextRun("ab", A), cd = new TextRun("cd", B);

        assertThat(rewrite(List.of(ab, cd), rep(2, 2, "X")))
                .containsExactly(ab, new TextRun("X", B), new TextRun("cd", B));
        assertThat(rewrite(List.of(ab, cd), rep(4, 4, "X")))
                .containsExactly(ab, new TextRun("cd", B), new TextRun("X", B));
    }

    @Test
    @DisplayName("匹配从 run 边界开始：归属后一个 run")
    void boundaryBelongsToFollowingRun() {
        List<TextRun> runs = List.of(new TextRun("ab", A), new TextRun("cd", B));

        assertThat(rewrite(runs, rep(2, 3, "X")))
                .containsExactly(new TextRun("ab", A), new TextRun("X", B), new TextRun("d", B));
    }

    @Test
    @DisplayName("没有替换项：原样返回")
    void noReplacements() {
        List<TextRun> runs = List.of(new TextRun("ab", A));
        assertThat(ChunkRewriter.apply(runs, RunFlattener.flatten(runs).offsetMap, List.of()))
                .containsExactlyElementsOf(runs);
    }

    @Test
    @DisplayName("偏移映射过期或区间重叠时拒绝")
    void rejectsMisuse() {
        List<TextRun> two = List.of(new TextRun("ab", A), new TextRun("cd", B));
        OffsetMap stale = RunFlattener.flatten(List.of(new TextRun("abcd", A))).offsetMap;

        assertThatThrownBy(() -> ChunkRewriter.apply(two, stale, List.of(rep(0, 1, "x"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rewrite(two, rep(0, 3, "x"), rep(2, 4, "y")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rewrite(two, rep(3, 5, "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("写回段落")
    void appliesToParagraph() {
        MemoryParagraph p = MemoryParagraph.of(new TextRun("hello ", A), new TextRun("PERSON", B));

        ChunkRewriter.apply(p, RunFlattener.flatten(p), List.of(rep(6, 12, "Bob")));

        assertThat(p.text()).isEqualTo("hello Bob");
        assertThat(p.runs().get(1).format).isEqualTo(B);
    }
}
