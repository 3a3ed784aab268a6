package io.lawtext.parser.plaintext;

/**
 * Classification of a physical line of statute-convention text.
 */
public enum StatuteLineType {
    CHAPTER_HEADING,
    SECTION_ALONE,
    SECTION_INLINE,
    CONTENT,
    BLANK
}
