package com.example.slidereplace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class SlideReplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlideReplaceApplication.class, args);
        log.info("Slide Text Replace 启动成功");
    }
}
