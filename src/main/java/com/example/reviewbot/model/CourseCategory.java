package com.example.reviewbot.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Course categories, split over two keyboard pages.
 */
public enum CourseCategory {
    MAA("Mathematics", 1),
    PHY("Physics", 1),
    CSE("Computer Science", 1),
    ECO("Economics", 1),
    LAB("Laboratory", 1),
    HSS("Humanities and Social Sciences", 2),
    PDV("Personal Development", 2),
    BIO("Biology", 2),
    CHEM("Chemistry", 2),
    SPOFAL("Sports and Foreign Languages", 2),
    PRL("Professional Languages", 2);

    public static final int PAGE_COUNT = 2;

    private final String displayName;
    private final int page;

    CourseCategory(String displayName, int page) {
        this.displayName = displayName;
        this.page = page;
    }

    public String displayName() { return displayName; }
    public int page() { return page; }

    public static List<CourseCategory> onPage(int page) {
        return Arrays.stream(values()).filter(c -> c.page == page).collect(Collectors.toList());
    }

    public static Optional<CourseCategory> fromCode(String code) {
        return Arrays.stream(values()).filter(c -> c.name().equals(code)).findFirst();
    }
}
