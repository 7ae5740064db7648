package com.myorg.tocparser.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Root outline nodes per TOC page of the dump. Pages that produced no node have no entry;
 * {@link #roots(int)} treats an absent page and an empty page the same way.
 */
@Getter
@ToString
public final class PageForest {

    private static final PageForest EMPTY = new PageForest(Map.of(), List.of());

    private final SortedMap<Integer, List<OutlineNode>> pages;

    /** Duplicate sibling numbers and similar tree-level findings. */
    private final List<Diagnostic> diagnostics;

    public PageForest(Map<Integer, List<OutlineNode>> pages, List<Diagnostic> diagnostics) {
        TreeMap<Integer, List<OutlineNode>> copy = new TreeMap<>();
        pages.forEach((page, roots) -> {
            if (roots != null && !roots.isEmpty()) {
                copy.put(page, List.copyOf(roots));
            }
        });
        this.pages = Collections.unmodifiableSortedMap(copy);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static PageForest empty() {
        return EMPTY;
    }

    public List<OutlineNode> roots(int page) {
        return pages.getOrDefault(page, List.of());
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    /** Chapter nodes in page order, then line order within each page. */
    public List<OutlineNode> chapters() {
        List<OutlineNode> chapters = new ArrayList<>();
        for (List<OutlineNode> roots : pages.values()) {
            for (OutlineNode root : roots) {
                if (root.isChapter()) chapters.add(root);
            }
        }
        return chapters;
    }

    public int totalNodes() {
        int total = 0;
        for (List<OutlineNode> roots : pages.values()) {
            for (OutlineNode root : roots) {
                total += root.countNodes();
            }
        }
        return total;
    }
}
