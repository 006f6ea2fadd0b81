package com.example.facelandmarker.components.containers;

import java.util.List;

public record Classifications(List<Category> categories, int headIndex, String headName) {

    public Classifications {
        categories = List.copyOf(categories);
        headName = headName == null ? "" : headName;
    }
}
