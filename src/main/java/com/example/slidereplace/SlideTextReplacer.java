package com.example.slidereplace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 替换入口：在当前页、指定页或整个文稿内把 oldValue 的所有匹配替换为 newValue。
 * <p>
 * 校验顺序：参数 → 编译正则 → 解析范围，全部通过后才开始改写段落；
 * 因此任何结构性错误都不会留下部分修改。newValue 始终按字面写入。
 */
@Slf4j
@Service
public class SlideTextReplacer {

    @Value("${slide-replace.warn-on-no-match:true}")
    private boolean warnByDefault = true;

    /** 默认 listener：只打日志 */
    public static final ReplacementWarningListener LOG_WARNING = w -> log.warn("{}", w.message());

    public boolean isWarnByDefault() { return warnByDefault; }

    /** 当前页、正则模式、按配置决定是否告警 */
    public <D extends SlideDeck> D replaceTextOnSlide(D deck, String oldValue, String newValue) {
        return replaceTextOnSlide(deck, oldValue, newValue, null, warnByDefault, MatchOptions.defaults());
    }

    public <D extends SlideDeck> D replaceTextOnSlide(D deck, String oldValue, String newValue,
                                                     Integer slideIndex, boolean warn, MatchOptions options) {
        return replaceTextOnSlide(deck, oldValue, newValue, slideIndex, warn, options, LOG_WARNING);
    }

    public <D extends SlideDeck> D replaceTextOnSlide(D deck, String oldValue, String newValue, Integer slideIndex,
                                                     boolean warn, MatchOptions options,
                                                     ReplacementWarningListener listener) {
        replaceOnSlide(deck, oldValue, newValue, slideIndex, warn, options, listener);
        return deck;
    }

    public <D extends SlideDeck> D replaceTextInDocument(D deck, String oldValue, String newValue,
                                                        boolean warn, MatchOptions options) {
        replaceInDocument(deck, oldValue, newValue, warn, options, LOG_WARNING);
        return deck;
    }

    /** 单页替换并返回统计 */
    public ReplacementReport replaceOnSlide(SlideDeck deck, String oldValue, String newValue, Integer slideIndex,
                                            boolean warn, MatchOptions options, ReplacementWarningListener listener) {
        checkArguments(deck, oldValue, newValue, options);
        Pattern pattern = PatternMatcher.compile(oldValue, options);
        int idx = ScopeResolver.resolveSlideIndex(deck, slideIndex);
        List<RunParagraph> paragraphs = ScopeResolver.resolveScope(deck, idx);
        return execute(paragraphs, pattern, oldValue, newValue, "slide " + idx, warn, options, listener);
    }

    /** 整个文稿替换并返回统计 */
    public ReplacementReport replaceInDocument(SlideDeck deck, String oldValue, String newValue,
                                               boolean warn, MatchOptions options, ReplacementWarningListener listener) {
        checkArguments(deck, oldValue, newValue, options);
        Pattern pattern = PatternMatcher.compile(oldValue, options);
        List<RunParagraph> paragraphs = ScopeResolver.resolveDocument(deck);
        return execute(paragraphs, pattern, oldValue, newValue, "document", warn, options, listener);
    }

    private ReplacementReport execute(List<RunParagraph> paragraphs, Pattern pattern, String oldValue, String newValue,
                                      String scope, boolean warn, MatchOptions options,
                                      ReplacementWarningListener listener) {
        List<NoMatchWarning> warnings = new ArrayList<>(1);
        ReplacementWarningListener sink = w -> {
            warnings.add(w);
            if (listener != null) listener.onNoMatch(w);
        };

        ReplacementOrchestrator.Outcome outcome = ReplacementOrchestrator.replaceInScope(
            paragraphs, pattern, newValue, oldValue, scope, warn, sink);
        log.info("replace \"{}\" -> \"{}\" on {}: {} 处替换, {}/{} 个段落改动, {}",
            oldValue, newValue, scope, outcome.replacementCount, outcome.paragraphsChanged,
            outcome.paragraphsScanned, options);
        return new ReplacementReport(scope, outcome.replacementCount, outcome.paragraphsScanned,
            outcome.paragraphsChanged, warnings);
    }

    private static void checkArguments(SlideDeck deck, String oldValue, String newValue, MatchOptions options) {
        if (deck == null) throw new InvalidArgumentException("deck 不能为空");
        if (oldValue == null) throw new InvalidArgumentException("oldValue 必须是字符串");
        if (oldValue.isEmpty()) throw new InvalidArgumentException("oldValue 不能为空串");
        if (newValue == null) throw new InvalidArgumentException("newValue 必须是字符串");
        if (options == null) throw new InvalidArgumentException("options 不能为空");
    }
}
