package com.cgi.medscrub.service;

import com.cgi.medscrub.config.ScrubberProperties;
import com.cgi.medscrub.model.TextChunk;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits a document into bounded, sentence-aligned chunks for the statistical detector.
 * Concatenating the chunks in order always gives back the original text.
 */
@Component
public class TextChunker {

    private final Locale locale;

    @Autowired
    public TextChunker(ScrubberProperties properties) {
        this(properties.getSentenceLocale());
    }

    /**
     * @param locale Locale for sentence segmentation, or null to use the punctuation heuristic
     */
    public TextChunker(Locale locale) {
        this.locale = locale;
    }

    /**
     * Splits a text into chunks of at most {@code maxChunkSize} characters.
     * Sentences are kept whole when they fit; longer ones are cut at the last whitespace before the limit.
     *
     * @param text Text to split
     * @param maxChunkSize Maximum chunk length
     * @return Ordered, non-overlapping chunks
     */
    public List<TextChunk> chunk(String text, int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        List<TextChunk> chunks = new ArrayList<>();
        int chunkStart = 0;
        int chunkEnd = 0;

        for (int[] sentence : sentenceBoundaries(text)) {
            int start = sentence[0];
            int end = sentence[1];

            if (end - start > maxChunkSize) {
                if (chunkEnd > chunkStart) {
                    chunks.add(new TextChunk(chunks.size(), chunkStart, text.substring(chunkStart, chunkEnd)));
                }
                splitOversized(text, start, end, maxChunkSize, chunks);
                chunkStart = end;
                chunkEnd = end;
            } else if (end - chunkStart > maxChunkSize) {
                chunks.add(new TextChunk(chunks.size(), chunkStart, text.substring(chunkStart, chunkEnd)));
                chunkStart = start;
                chunkEnd = end;
            } else {
                chunkEnd = end;
            }
        }

        if (chunkEnd > chunkStart) {
            chunks.add(new TextChunk(chunks.size(), chunkStart, text.substring(chunkStart, chunkEnd)));
        }
        return chunks;
    }

    /**
     * Sentence spans covering the whole text without gaps.
     */
    List<int[]> sentenceBoundaries(String text) {
        if (locale == null) {
            return punctuationBoundaries(text);
        }
        List<int[]> boundaries = new ArrayList<>();
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            boundaries.add(new int[]{start, end});
        }
        if (boundaries.isEmpty() || boundaries.get(boundaries.size() - 1)[1] != text.length()) {
            return punctuationBoundaries(text);
        }
        return boundaries;
    }

    /**
     * A sentence ends after a run of '.', '!' or '?' and the whitespace that follows it.
     * Trailing text without punctuation forms the last sentence.
     */
    static List<int[]> punctuationBoundaries(String text) {
        List<int[]> boundaries = new ArrayList<>();
        int start = 0;
        int i = 0;
        int length = text.length();
        while (i < length) {
            if (isTerminal(text.charAt(i))) {
                while (i < length && isTerminal(text.charAt(i))) {
                    i++;
                }
                while (i < length && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                boundaries.add(new int[]{start, i});
                start = i;
            } else {
                i++;
            }
        }
        if (start < length) {
            boundaries.add(new int[]{start, length});
        }
        return boundaries;
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static void splitOversized(String text, int start, int end, int maxChunkSize, List<TextChunk> chunks) {
        int pieceStart = start;
        while (end - pieceStart > maxChunkSize) {
            int limit = pieceStart + maxChunkSize;
            int cut = limit;
            for (int i = limit - 1; i > pieceStart; i--) {
                if (Character.isWhitespace(text.charAt(i))) {
                    cut = i + 1;
                    break;
                }
            }
            // Never separate a surrogate pair
            if (Character.isHighSurrogate(text.charAt(cut - 1)) && cut - 1 > pieceStart) {
                cut--;
            }
            chunks.add(new TextChunk(chunks.size(), pieceStart, text.substring(pieceStart, cut)));
            pieceStart = cut;
        }
        if (end > pieceStart) {
            chunks.add(new TextChunk(chunks.size(), pieceStart, text.substring(pieceStart, end)));
        }
    }
}
