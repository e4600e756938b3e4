package com.nevis.policy.ingest;

import com.nevis.policy.config.IngestionProperties;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PolicyTextChunker {

    private static final List<Pattern> SECTION_PATTERNS = List.of(
        Pattern.compile("(Chapter\\s+\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(Section\\s+\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(Para(?:graph)?\\s+\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(Table\\s+\\d+(?:[-.]\\d+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(Figure\\s+\\d+(?:[-.]\\d+)?)", Pattern.CASE_INSENSITIVE),
        // annex letters are uppercase only
        Pattern.compile("(Annex\\s+[A-Z])\\b")
    );

    private final DocumentSplitter splitter;

    public PolicyTextChunker(IngestionProperties properties) {
        this(properties.chunkSize(), properties.chunkOverlap());
    }

    PolicyTextChunker(int chunkSize, int chunkOverlap) {
        this.splitter = DocumentSplitters.recursive(chunkSize, chunkOverlap);
    }

    public List<TextChunk> chunk(List<PageText> pages) {
        List<TextChunk> chunks = new ArrayList<>();
        for (PageText page : pages) {
            if (page.text() == null || page.text().isBlank()) {
                continue;
            }
            for (TextSegment segment : splitter.split(Document.from(page.text()))) {
                String text = segment.text().trim();
                if (text.isEmpty()) {
                    continue;
                }
                chunks.add(new TextChunk(chunks.size(), text, sectionRef(text), page.pageNumber()));
            }
        }
        return chunks;
    }

    static String sectionRef(String text) {
        for (Pattern pattern : SECTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return normalizeKeyword(matcher.group(1).replaceAll("\\s+", " "));
            }
        }
        return "";
    }

    // "CHAPTER 5" and "chapter 5" are stored as "Chapter 5"
    private static String normalizeKeyword(String ref) {
        int space = ref.indexOf(' ');
        return Character.toUpperCase(ref.charAt(0)) + ref.substring(1, space).toLowerCase(Locale.ROOT) + ref.substring(space);
    }
}
