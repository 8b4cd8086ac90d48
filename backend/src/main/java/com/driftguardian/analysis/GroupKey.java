package com.driftguardian.analysis;

import java.util.List;

/**
 * Composite key made of one value per attribute of a combination.
 */
public record GroupKey(List<String> values) implements Comparable<GroupKey> {

    public static final String SEPARATOR = "×";

    public GroupKey {
        values = List.copyOf(values);
    }

    public String label() {
        return String.join(SEPARATOR, values);
    }

    @Override
    public int compareTo(GroupKey other) {
        int n = Math.min(values.size(), other.values.size());
        for (int i = 0; i < n; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return label();
    }
}
