package com.myorg.tocparser.service.implementation;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Diagnostic;
import com.myorg.tocparser.model.DiagnosticType;
import com.myorg.tocparser.model.Line;
import com.myorg.tocparser.model.LineClassification;
import com.myorg.tocparser.model.NodeKind;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.PageForest;
import com.myorg.tocparser.service.LineClassifier;
import com.myorg.tocparser.service.OutlineTreeBuilder;
import com.myorg.tocparser.service.processing.InputContracts;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds one outline forest per TOC page with an open-node stack ordered by level.
 * <ul>
 *   <li>chapter: the stack is cleared, the chapter becomes a root and the only open node</li>
 *   <li>item of level L: nodes of level &gt;= L are closed; the item is attached to the new top
 *       (or made a root when nothing is open) and pushed</li>
 *   <li>other entry: appended as a root, the stack is left alone</li>
 * </ul>
 * Pages share no state, so the result does not depend on page processing order.
 */
@Slf4j
public class StackOutlineTreeBuilder implements OutlineTreeBuilder {

    private final LineClassifier classifier;

    public StackOutlineTreeBuilder(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public PageForest build(Set<Integer> tocPages, List<Line> lines) {
        if (tocPages == null) {
            throw new InputContractException("tocPages must not be null");
        }
        InputContracts.requirePageOrdered(lines);
        if (tocPages.isEmpty() || lines.isEmpty()) {
            return PageForest.empty();
        }

        Map<Integer, List<Line>> byPage = new LinkedHashMap<>();
        for (Line line : lines) {
            if (tocPages.contains(line.getPage())) {
                byPage.computeIfAbsent(line.getPage(), p -> new ArrayList<>()).add(line);
            }
        }

        Map<Integer, List<OutlineNode>> pages = new TreeMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        byPage.forEach((page, pageLines) -> {
            List<OutlineNode> roots = buildPage(pageLines, diagnostics);
            if (!roots.isEmpty()) {
                pages.put(page, roots);
            }
            log.debug("TOC page {}: {} lines -> {} root nodes", page, pageLines.size(), roots.size());
        });

        PageForest forest = new PageForest(pages, diagnostics);
        log.info("Built outline for {} TOC pages: {} nodes, {} chapters",
                forest.getPages().size(), forest.totalNodes(), forest.chapters().size());
        return forest;
    }

    private List<OutlineNode> buildPage(List<Line> pageLines, List<Diagnostic> diagnostics) {
        List<NodeDraft> roots = new ArrayList<>();
        Deque<NodeDraft> stack = new ArrayDeque<>();

        int i = 0;
        while (i < pageLines.size()) {
            Line line = pageLines.get(i);
            String next = i + 1 < pageLines.size() ? pageLines.get(i + 1).getText() : null;
            Optional<LineClassification> classified = classifier.classify(line.getText(), next);
            if (classified.isEmpty()) {
                i++;
                continue;
            }

            LineClassification c = classified.get();
            int target = c.hasTargetPage() ? c.getTargetPage() : line.getPage();
            switch (c.getKind()) {
                case CHAPTER: {
                    NodeDraft chapter = new NodeDraft(NodeKind.CHAPTER, c.getNumber(), c.getTitle(), target);
                    checkDuplicate(roots, chapter, line, diagnostics);
                    stack.clear();
                    roots.add(chapter);
                    stack.push(chapter);
                    break;
                }
                case ITEM: {
                    NodeDraft item = new NodeDraft(NodeKind.ITEM, c.getNumber(), c.getTitle(), target);
                    while (!stack.isEmpty() && stack.peek().level >= item.level) {
                        stack.pop();
                    }
                    List<NodeDraft> siblings = stack.isEmpty() ? roots : stack.peek().children;
                    checkDuplicate(siblings, item, line, diagnostics);
                    siblings.add(item);
                    stack.push(item);
                    break;
                }
                default:
                    roots.add(new NodeDraft(NodeKind.OTHER, null, c.getTitle(), target));
                    break;
            }
            i += c.getLinesConsumed();
        }

        List<OutlineNode> built = new ArrayList<>(roots.size());
        for (NodeDraft root : roots) {
            built.add(root.freeze());
        }
        return built;
    }

    private static void checkDuplicate(List<NodeDraft> siblings, NodeDraft candidate, Line line, List<Diagnostic> diagnostics) {
        for (NodeDraft sibling : siblings) {
            if (sibling.kind == candidate.kind && Objects.equals(sibling.number, candidate.number)) {
                String message = String.format("Duplicate %s number '%s' on page %d line %d (first seen with title '%s')",
                        candidate.kind.jsonName(), candidate.number, line.getPage(), line.getLineNumber(), sibling.title);
                log.debug("{}", message);
                diagnostics.add(Diagnostic.builder()
                        .type(DiagnosticType.DUPLICATE_SIBLING_NUMBER)
                        .message(message)
                        .page(line.getPage())
                        .lineNumber(line.getLineNumber())
                        .build());
                return;
            }
        }
    }

    /** Mutable node used only while one page is being built. */
    private static final class NodeDraft {
        final NodeKind kind;
        final String number;
        final String title;
        final int page;
        final int level;
        final List<NodeDraft> children = new ArrayList<>();

        NodeDraft(NodeKind kind, String number, String title, int page) {
            this.kind = kind;
            this.number = number;
            this.title = title;
            this.page = page;
            this.level = kind == NodeKind.ITEM ? OutlineNode.levelOf(number) : 0;
        }

        OutlineNode freeze() {
            List<OutlineNode> frozen = new ArrayList<>(children.size());
            for (NodeDraft child : children) {
                frozen.add(child.freeze());
            }
            switch (kind) {
                case CHAPTER:
                    return OutlineNode.chapter(number, title, page, frozen);
                case ITEM:
                    return OutlineNode.item(number, title, page, frozen);
                default:
                    return OutlineNode.other(title, page);
            }
        }
    }
}
