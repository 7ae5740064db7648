package com.myorg.tocparser.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutlineNodeTest {

    @Test
    void levelIsDashCountForItemsOnly() {
        assertThat(OutlineNode.item("1-1", "일반사항", 3).getLevel()).isEqualTo(1);
        assertThat(OutlineNode.item("1-1-1", "목적", 3).getLevel()).isEqualTo(2);
        assertThat(OutlineNode.chapter("1", "적용기준", 3).getLevel()).isZero();
        assertThat(OutlineNode.other("참 고 자 료", 58).getLevel()).isZero();
    }

    @Test
    void labelsFollowPrintedForm() {
        assertThat(OutlineNode.chapter("3", "토공사", 20).label()).isEqualTo("제3장 토공사");
        assertThat(OutlineNode.chapter("3", "", 20).label()).isEqualTo("제3장");
        assertThat(OutlineNode.item("3-1", "일반사항", 20).label()).isEqualTo("3-1 일반사항");
        assertThat(OutlineNode.other("부록", 99).label()).isEqualTo("부록");
    }

    @Test
    void walkVisitsPreOrder() {
        OutlineNode chapter = OutlineNode.chapter("1", "적용기준", 3, List.of(
                OutlineNode.item("1-1", "일반사항", 3, List.of(OutlineNode.item("1-1-1", "목적", 3))),
                OutlineNode.item("1-2", "수량", 4)));

        List<String> visited = new ArrayList<>();
        chapter.walk(node -> visited.add(node.label()));

        assertThat(visited).containsExactly("제1장 적용기준", "1-1 일반사항", "1-1-1 목적", "1-2 수량");
        assertThat(chapter.countNodes()).isEqualTo(4);
    }
}
