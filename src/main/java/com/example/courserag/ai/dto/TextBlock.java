package com.example.courserag.ai.dto;

public record TextBlock(String text) implements ContentBlock {
}
