package com.example.slidereplace;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api")
public class ReplaceController {

    @Autowired
    private SlideTextReplacer replacer;

    @GetMapping("/")
    public String home() {
        return "Slide Text Replace is running!";
    }

    /** 上传 pptx，在指定页（默认当前页 = 最后一页）或全文替换后返回新文件 */
    @PostMapping("/replace")
    public ResponseEntity<byte[]> replace(
            @RequestParam("file") MultipartFile file,
            @RequestParam("oldValue") String oldValue,
            @RequestParam("newValue") String newValue,
            @RequestParam(value = "slideIndex", required = false) Integer slideIndex,
            @RequestParam(value = "allSlides", required = false, defaultValue = "false") boolean allSlides,
            @RequestParam(value = "warn", required = false) Boolean warn,
            @RequestParam(value = "literal", required = false, defaultValue = "false") boolean literal,
            @RequestParam(value = "ignoreCase", required = false, defaultValue = "false") boolean ignoreCase,
            @RequestParam(value = "multiline", required = false, defaultValue = "false") boolean multiline,
            @RequestParam(value = "dotAll", required = false, defaultValue = "false") boolean dotAll
    ) throws IOException {
        String filename = file.getOriginalFilename() == null ? "" : file.getOriginalFilename().toLowerCase(Locale.ROOT);
        if (!filename.endsWith(".pptx")) throw new InvalidArgumentException("不支持的文件格式: " + filename);
        log.info("开始处理文件: {}", filename);

        MatchOptions options = MatchOptions.builder()
                .literal(literal).ignoreCase(ignoreCase).multiline(multiline).dotAll(dotAll)
                .build();
        boolean doWarn = warn != null ? warn : replacer.isWarnByDefault();

        try (InputStream in = file.getInputStream();
             XMLSlideShow ppt = new XMLSlideShow(in);
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XslfSlideDeck deck = new XslfSlideDeck(ppt);
            ReplacementReport report = allSlides
                    ? replacer.replaceInDocument(deck, oldValue, newValue, doWarn, options, SlideTextReplacer.LOG_WARNING)
                    : replacer.replaceOnSlide(deck, oldValue, newValue, slideIndex, doWarn, options, SlideTextReplacer.LOG_WARNING);

            ppt.write(out);

            ResponseEntity.BodyBuilder ok = ResponseEntity.ok()
                    .header("Content-Disposition", "attachment; filename=replaced.pptx")
                    .header("X-Replacement-Count", String.valueOf(report.replacementCount));
            if (report.hasWarnings()) ok.header("X-Replacement-Warning", "NO_MATCH");
            return ok.body(out.toByteArray());
        }
    }
}
