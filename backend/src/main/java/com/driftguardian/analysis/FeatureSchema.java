package com.driftguardian.analysis;

import com.driftguardian.exception.InputValidationException;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Value
public class FeatureSchema {
    List<String> numericalFeatures;
    List<String> categoricalFeatures;

    private FeatureSchema(List<String> numericalFeatures, List<String> categoricalFeatures) {
        this.numericalFeatures = List.copyOf(numericalFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    public static FeatureSchema of(List<String> numerical, List<String> categorical) {
        List<String> num = numerical != null ? numerical : List.of();
        List<String> cat = categorical != null ? categorical : List.of();
        if (num.isEmpty() && cat.isEmpty()) {
            throw new InputValidationException("Feature schema must reference at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (String name : concat(num, cat)) {
            if (name == null || name.isBlank()) {
                throw new InputValidationException("Feature names must not be blank");
            }
            if (!seen.add(name)) {
                throw new InputValidationException("Feature '" + name + "' is declared more than once");
            }
        }
        return new FeatureSchema(num, cat);
    }

    public List<String> allFeatures() {
        return concat(numericalFeatures, categoricalFeatures);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a.size() + b.size());
        all.addAll(a);
        all.addAll(b);
        return all;
    }
}
