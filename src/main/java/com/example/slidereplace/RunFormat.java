package com.example.slidereplace;

/** run 的格式（不透明值）；替换核心只做原样传递，从不读取其内容 */
public interface RunFormat {
}
