package com.trading.sdg.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard produced by a reporter operation: summary cards, named chart
 * series and tables.
 */
@Data
@NoArgsConstructor
public final class Report {
    private List<Card> cards = new ArrayList<>();
    private Map<String, List<Double>> charts = new LinkedHashMap<>();
    private Map<String, Table> tables = new LinkedHashMap<>();

    /** One summary value. {@code group} and {@code groupSize} are assigned on read-back. */
    @Data
    @NoArgsConstructor
    public static final class Card {
        private String category;
        private String title;
        private Object value;
        private int group;
        private int groupSize;

        public Card(String category, String title, Object value) {
            this.category = category;
            this.title = title;
            this.value = value;
        }

        Card copy() {
            Card c = new Card(category, title, value);
            c.group = group;
            c.groupSize = groupSize;
            return c;
        }
    }

    public Report addCard(Card card) {
        cards.add(card);
        return this;
    }

    public boolean isEmpty() {
        return cards.isEmpty() && charts.isEmpty() && tables.isEmpty();
    }

    /** Appends cards and adds charts and tables; entries of {@code other} win on key clashes. */
    public void mergeFrom(Report other) {
        for (Card c : other.cards)
            cards.add(c.copy());
        charts.putAll(other.charts);
        tables.putAll(other.tables);
    }

    public Report copy() {
        Report r = new Report();
        r.mergeFrom(this);
        return r;
    }

    /**
     * Groups cards by category, orders each group by title and stamps every
     * card with its position and the group size.
     */
    public void assignCardGroups() {
        Map<String, List<Card>> byCategory = new LinkedHashMap<>();
        for (Card c : cards)
            byCategory.computeIfAbsent(String.valueOf(c.getCategory()), k -> new ArrayList<>()).add(c);
        for (List<Card> group : byCategory.values()) {
            group.sort(Comparator.comparing(c -> c.getTitle() == null ? "" : c.getTitle()));
            for (int i = 0; i < group.size(); i++) {
                group.get(i).setGroup(i);
                group.get(i).setGroupSize(group.size());
            }
        }
    }
}
