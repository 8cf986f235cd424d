package com.example.slidereplace;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(InvalidArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(PatternException.class)
    public ResponseEntity<ErrorResponse> handlePattern(PatternException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_PATTERN", e.getMessage()));
    }

    @ExceptionHandler(SlideIndexOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleSlideIndex(SlideIndexOutOfRangeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("SLIDE_INDEX_OUT_OF_RANGE", e.getMessage()));
    }

    @ExceptionHandler(NoCurrentSlideException.class)
    public ResponseEntity<ErrorResponse> handleNoCurrentSlide(NoCurrentSlideException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NO_CURRENT_SLIDE", e.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException e) {
        log.warn("读取/写出 pptx 失败: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("UNREADABLE_DOCUMENT", e.getMessage()));
    }

    /** 上传内容不是合法的 OOXML 包（NotOfficeXmlFileException 等） */
    @ExceptionHandler({UnsupportedFileFormatException.class, EmptyFileException.class, POIXMLException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(RuntimeException e) {
        log.warn("无法解析 pptx: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("UNREADABLE_DOCUMENT", e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", "缺少参数: " + e.getParameterName()));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", "缺少上传文件: " + e.getRequestPartName()));
    }
}
