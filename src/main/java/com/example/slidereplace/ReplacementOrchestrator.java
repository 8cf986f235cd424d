package com.example.slidereplace;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** 按文档顺序逐段：扁平化 → 匹配 → 改写；汇总替换次数 */
@Slf4j
public final class ReplacementOrchestrator {
    private ReplacementOrchestrator() {}

    /** 单次范围替换的汇总 */
    public static final class Outcome {
        public final int replacementCount;
        public final int paragraphsScanned;
        public final int paragraphsChanged;

        Outcome(int replacementCount, int paragraphsScanned, int paragraphsChanged) {
            this.replacementCount = replacementCount;
            this.paragraphsScanned = paragraphsScanned;
            this.paragraphsChanged = paragraphsChanged;
        }
    }

    public static int replaceInScope(List<? extends RunParagraph> paragraphs, Pattern pattern, String newValue) {
        return run(paragraphs, pattern, newValue).replacementCount;
    }

    /**
     * 同上；总次数为 0 且 warn 为 true 时通知 listener。
     * @param scope 仅用于提示文案，如 "slide 2"
     */
    public static Outcome replaceInScope(List<? extends RunParagraph> paragraphs, Pattern pattern, String newValue,
                                         String oldValue, String scope, boolean warn, ReplacementWarningListener listener) {
        Outcome outcome = run(paragraphs, pattern, newValue);
        if (outcome.replacementCount == 0 && warn && listener != null) {
            listener.onNoMatch(new NoMatchWarning(oldValue, scope, outcome.paragraphsScanned));
        }
        return outcome;
    }

    private static Outcome run(List<? extends RunParagraph> paragraphs, Pattern pattern, String newValue) {
        int total = 0, changed = 0;
        for (int pIdx = 0; pIdx < paragraphs.size(); pIdx++) {
            RunParagraph p = paragraphs.get(pIdx);
            if (p.runs().isEmpty()) continue;

            FlattenedParagraph flat = RunFlattener.flatten(p);
            List<MatchSpan> spans = PatternMatcher.findMatches(flat.text, pattern);
            if (spans.isEmpty()) continue;

            // newValue 一律按字面写入，不展开 $1 之类的分组引用
            List<ChunkRewriter.Replacement> reps = new ArrayList<>(spans.size());
            for (MatchSpan sp : spans) reps.add(new ChunkRewriter.Replacement(sp, newValue));

            ChunkRewriter.apply(p, flat, reps);
            total += spans.size();
            changed++;
            log.debug("paragraph #{}: {} 处替换, spans={}", pIdx, spans.size(), spans);
        }
        return new Outcome(total, paragraphs.size(), changed);
    }
}
