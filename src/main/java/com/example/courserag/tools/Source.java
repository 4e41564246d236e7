package com.example.courserag.tools;

import org.springframework.lang.Nullable;

/**
 * A citation shown to the end user next to an answer.
 */
public record Source(String text, @Nullable String link) {
}
