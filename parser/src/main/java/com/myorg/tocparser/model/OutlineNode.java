package com.myorg.tocparser.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.Consumer;

/**
 * Immutable outline entry. Chapters and other entries sit at level 0; an item's level is the
 * number of dashes in its number ("1-1" is 1, "1-1-1" is 2).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OutlineNode {

    private final NodeKind kind;

    /** Chapter or item number; null for {@link NodeKind#OTHER}. */
    private final String number;

    private final String title;

    /** Printed target page parsed from the line, not the dump page it was found on. */
    private final int page;

    private final int level;

    private final List<OutlineNode> children;

    private OutlineNode(NodeKind kind, String number, String title, int page, List<OutlineNode> children) {
        this.kind = kind;
        this.number = number;
        this.title = title == null ? "" : title;
        this.page = page;
        this.level = kind == NodeKind.ITEM ? levelOf(number) : 0;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static OutlineNode chapter(String number, String title, int page) {
        return new OutlineNode(NodeKind.CHAPTER, number, title, page, List.of());
    }

    public static OutlineNode chapter(String number, String title, int page, List<OutlineNode> children) {
        return new OutlineNode(NodeKind.CHAPTER, number, title, page, children);
    }

    public static OutlineNode item(String number, String title, int page) {
        return new OutlineNode(NodeKind.ITEM, number, title, page, List.of());
    }

    public static OutlineNode item(String number, String title, int page, List<OutlineNode> children) {
        return new OutlineNode(NodeKind.ITEM, number, title, page, children);
    }

    public static OutlineNode other(String title, int page) {
        return new OutlineNode(NodeKind.OTHER, null, title, page, List.of());
    }

    public static int levelOf(String itemNumber) {
        if (itemNumber == null) return 0;
        return (int) itemNumber.chars().filter(ch -> ch == '-').count();
    }

    public boolean isChapter() {
        return kind == NodeKind.CHAPTER;
    }

    /**
     * Printed label of the entry: {@code 제3장 토공사} for chapters, {@code 1-1 일반사항} for items,
     * the bare title otherwise.
     */
    public String label() {
        switch (kind) {
            case CHAPTER:
                return title.isEmpty() ? "제" + number + "장" : "제" + number + "장 " + title;
            case ITEM:
                return title.isEmpty() ? number : number + " " + title;
            default:
                return title;
        }
    }

    /** Number of nodes in this subtree, this node included. */
    public int countNodes() {
        int total = 1;
        for (OutlineNode child : children) {
            total += child.countNodes();
        }
        return total;
    }

    /** Pre-order traversal. */
    public void walk(Consumer<OutlineNode> visitor) {
        visitor.accept(this);
        for (OutlineNode child : children) {
            child.walk(visitor);
        }
    }
}
