package com.mapsheet.collection.resolve;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.matching.FilenameTokenizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keywords identifying each file category in file names.
 * Keyword order is the matching order, category by category.
 */
public final class CategoryVocabulary {

    private final Map<FileCategory, List<String>> keywords;
    private final Map<String, FileCategory> categoryByKeyword;

    public CategoryVocabulary(Map<FileCategory, List<String>> keywords) {
        Objects.requireNonNull(keywords, "keywords must not be null");
        this.keywords = new EnumMap<>(FileCategory.class);
        this.categoryByKeyword = new HashMap<>();
        for (FileCategory category : FileCategory.values()) {
            List<String> list = keywords.getOrDefault(category, List.of());
            for (String keyword : list) {
                if (keyword == null || FilenameTokenizer.canonical(keyword, false).isEmpty()) {
                    throw new IllegalArgumentException("Blank keyword for category " + category);
                }
                FileCategory previous = categoryByKeyword.putIfAbsent(keyword, category);
                if (previous != null && previous != category) {
                    throw new IllegalArgumentException("Keyword '" + keyword + "' claimed by both "
                            + previous + " and " + category);
                }
            }
            this.keywords.put(category, List.copyOf(list));
        }
        if (categoryByKeyword.isEmpty()) {
            throw new IllegalArgumentException("Category vocabulary has no keywords");
        }
    }

    /**
     * Keywords seen in field submissions.
     */
    public static CategoryVocabulary defaults() {
        Map<FileCategory, List<String>> keywords = new EnumMap<>(FileCategory.class);
        keywords.put(FileCategory.FINISHED_OBSERVATIONS, List.of(
                "finished_points_and_tracks",
                "finished points and tracks",
                "finished_points",
                "points_tracks",
                "completed_points"));
        keywords.put(FileCategory.PLANNED_ROUTES, List.of(
                "_plan_routes_",
                "plan routes",
                "planned_routes",
                "route_plan",
                "plan_route",
                "routes_planned"));
        return new CategoryVocabulary(keywords);
    }

    public List<String> keywordsFor(FileCategory category) {
        return keywords.get(category);
    }

    /**
     * All keywords, category by category in declaration order.
     */
    public List<String> allKeywords() {
        List<String> all = new ArrayList<>();
        for (List<String> list : keywords.values()) {
            all.addAll(list);
        }
        return all;
    }

    public Optional<FileCategory> categoryOf(String keyword) {
        return Optional.ofNullable(categoryByKeyword.get(keyword));
    }
}
