package com.cgi.medscrub.model;

import lombok.Value;

/**
 * A contiguous slice of the document handed to the statistical detector.
 */
@Value
public class TextChunk {
    int index;
    int startOffset;
    String text;

    public int getEndOffset() {
        return startOffset + text.length();
    }
}
