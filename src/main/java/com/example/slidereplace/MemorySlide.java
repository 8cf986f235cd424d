package com.example.slidereplace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MemorySlide implements DeckSlide {
    private final List<MemoryParagraph> paragraphs = new ArrayList<>();

    public MemorySlide(MemoryParagraph... paragraphs) {
        Collections.addAll(this.paragraphs, paragraphs);
    }

    public MemorySlide add(MemoryParagraph p) {
        paragraphs.add(p);
        return this;
    }

    @Override
    public List<MemoryParagraph> paragraphs() {
        return Collections.unmodifiableList(paragraphs);
    }
}
