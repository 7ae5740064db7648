package com.myorg.tocparser.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The five fixed divisions of the price-list book, in document order. Each one owns the exact
 * printed chapter labels ({@code 제N장 title}) that belong to it.
 */
public enum Division {
    COMMON("common", "공통부문", List.of(
            "적용기준", "가설공사", "토공사", "조경공사", "기초공사", "철근콘크리트공사", "돌공사", "건설기계")),
    CIVIL("civil", "토목부문", List.of(
            "도로포장공사", "하천공사", "터널공사", "궤도공사", "강구조공사", "관부설 및 접합공사", "항만공사",
            "지반조사", "측 량")),
    ARCHITECTURE("architecture", "건축부문", List.of(
            "철골공사", "조적공사", "타일공사", "목공사", "수장공사", "방수공사", "지붕 및 홈통공사", "금속공사",
            "미장공사", "창호 및 유리공사", "칠공사")),
    MECHANICAL("mechanical", "기계설비부문", List.of(
            "배관공사", "덕트공사", "보온공사", "펌프 및 공기설비공사", "밸브설비공사", "측정기기공사",
            "위생기구설비공사", "공기조화설비공사", "기타공사", "소방설비공사", "가스설비공사", "자동제어설비공사",
            "플랜트설비공사")),
    MAINTENANCE("maintenance", "유지관리부문", List.of(
            "공 통", "토 목", "건 축", "기계설비"));

    private final String key;
    private final String displayName;
    private final Set<String> chapterLabels;

    Division(String key, String displayName, List<String> chapterTitles) {
        this.key = key;
        this.displayName = displayName;
        Set<String> labels = new LinkedHashSet<>();
        for (int i = 0; i < chapterTitles.size(); i++) {
            labels.add("제" + (i + 1) + "장 " + chapterTitles.get(i));
        }
        this.chapterLabels = Set.copyOf(labels);
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public Set<String> chapterLabels() {
        return chapterLabels;
    }

    /** Exact lookup of a printed chapter label; empty when no division lists it. */
    public static Optional<Division> forChapterLabel(String label) {
        if (label == null) return Optional.empty();
        for (Division division : values()) {
            if (division.chapterLabels.contains(label)) {
                return Optional.of(division);
            }
        }
        return Optional.empty();
    }
}
