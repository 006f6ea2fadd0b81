package com.example.facelandmarker.components.containers;

public record Category(int index, float score, String categoryName, String displayName) {
}
