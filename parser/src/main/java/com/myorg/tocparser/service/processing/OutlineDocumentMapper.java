package com.myorg.tocparser.service.processing;

import com.myorg.tocparser.model.NodeKind;
import com.myorg.tocparser.model.OutlineDocument;
import com.myorg.tocparser.model.OutlineNode;
import com.myorg.tocparser.model.PageForest;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link PageForest} onto the persisted interchange document.
 */
public final class OutlineDocumentMapper {

    public static final String FORMAT_VERSION = "2.0";

    private OutlineDocumentMapper() {}

    public static OutlineDocument toDocument(String sourceName, LocalDateTime generatedAt, int totalPages, PageForest forest) {
        Map<String, List<OutlineDocument.Node>> tree = new LinkedHashMap<>();
        forest.getPages().forEach((page, roots) -> {
            List<OutlineDocument.Node> nodes = new ArrayList<>(roots.size());
            for (OutlineNode root : roots) {
                nodes.add(toNode(root));
            }
            tree.put(String.valueOf(page), nodes);
        });

        return OutlineDocument.builder()
                .metadata(OutlineDocument.Metadata.builder()
                        .sourceName(sourceName)
                        .generatedAt(generatedAt)
                        .totalPages(totalPages)
                        .version(FORMAT_VERSION)
                        .build())
                .tocTree(tree)
                .statistics(OutlineDocument.Statistics.builder()
                        .totalNodes(forest.totalNodes())
                        .build())
                .build();
    }

    static OutlineDocument.Node toNode(OutlineNode node) {
        List<OutlineDocument.Node> children = new ArrayList<>(node.getChildren().size());
        for (OutlineNode child : node.getChildren()) {
            children.add(toNode(child));
        }
        // chapters are keyed downstream by their printed label
        String title = node.getKind() == NodeKind.CHAPTER ? node.label() : node.getTitle();
        return OutlineDocument.Node.builder()
                .type(node.getKind().jsonName())
                .title(title)
                .page(node.getPage())
                .level(node.getLevel())
                .number(node.getKind() == NodeKind.ITEM ? node.getNumber() : null)
                .children(children)
                .build();
    }
}
