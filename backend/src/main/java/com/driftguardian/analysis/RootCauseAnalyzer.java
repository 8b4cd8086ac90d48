package com.driftguardian.analysis;

import com.driftguardian.exception.DriftGuardianException;
import com.driftguardian.exception.InputValidationException;
import com.driftguardian.exception.UnsupportedModelException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Explains drift by comparing mean absolute attribution per feature between a
 * baseline sample and a current sample. The result is advisory: every failure
 * of the attribution engine is reported as an unavailable result.
 */
@Slf4j
public class RootCauseAnalyzer {

    public static final int DEFAULT_SAMPLE_SIZE = 100;
    public static final int DEFAULT_TOP_K = 3;
    public static final int MIN_ATTRIBUTION_ROWS = 10;
    public static final long DEFAULT_SEED = 42L;

    private final AttributionEngine engine;
    private final List<String> features;
    private final long seed;

    public RootCauseAnalyzer(AttributionEngine engine, List<String> features) {
        this(engine, features, DEFAULT_SEED);
    }

    public RootCauseAnalyzer(AttributionEngine engine, List<String> features, long seed) {
        this.engine = engine;
        this.features = List.copyOf(features);
        this.seed = seed;
    }

    public AttributionDriftReport explainDrift(ModelReference model,
                                               List<Map<String, Object>> baselineSample,
                                               List<Map<String, Object>> currentSample) {
        return explainDrift(model, baselineSample, currentSample, DEFAULT_SAMPLE_SIZE, DEFAULT_TOP_K);
    }

    public AttributionDriftReport explainDrift(ModelReference model,
                                               List<Map<String, Object>> baselineSample,
                                               List<Map<String, Object>> currentSample,
                                               int sampleSize, int topK) {
        if (sampleSize < 1 || topK < 1) {
            throw new InputValidationException("sampleSize and topK must be >= 1, got "
                + sampleSize + " and " + topK);
        }
        String modelType = model != null ? model.modelType() : null;
        if (model == null || engine == null) {
            return AttributionDriftReport.unavailable(modelType, "Model artifact not available for attribution analysis");
        }
        int baseRows = baselineSample != null ? baselineSample.size() : 0;
        int curRows = currentSample != null ? currentSample.size() : 0;
        if (Math.min(baseRows, curRows) < MIN_ATTRIBUTION_ROWS) {
            return AttributionDriftReport.unavailable(modelType, "Insufficient data for attribution analysis: need at least "
                + MIN_ATTRIBUTION_ROWS + " rows per sample, got " + baseRows + " and " + curRows);
        }

        List<Map<String, Object>> base = subsample(baselineSample, sampleSize, "baseline");
        List<Map<String, Object>> cur = subsample(currentSample, sampleSize, "current");

        FeatureAttributions baseAttr;
        FeatureAttributions curAttr;
        try {
            baseAttr = engine.attribute(model, features, base);
            curAttr = engine.attribute(model, features, cur);
        } catch (UnsupportedModelException ex) {
            log.warn("Root cause unavailable | modelId={} | modelType={}", model.modelId(), modelType);
            return AttributionDriftReport.unavailable(modelType, "Root cause unavailable for this model type");
        } catch (DriftGuardianException ex) {
            log.warn("Attribution engine failed | modelId={} | code={} | reason={}",
                     model.modelId(), ex.getErrorCode(), ex.getMessage());
            return AttributionDriftReport.unavailable(modelType, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected attribution failure | modelId={}", model.modelId(), ex);
            return AttributionDriftReport.unavailable(modelType,
                "Attribution engine failed: " + ex.getClass().getSimpleName());
        }

        List<FeatureAttributionDrift> ranked = rank(baseAttr, curAttr);
        List<FeatureAttributionDrift> top = ranked.subList(0, Math.min(topK, ranked.size()));

        return AttributionDriftReport.builder()
            .status(RootCauseStatus.AVAILABLE)
            .modelType(modelType)
            .baselineSampleSize(base.size())
            .currentSampleSize(cur.size())
            .features(List.copyOf(ranked))
            .topContributors(List.copyOf(top))
            .report(narrate(top))
            .build();
    }

    static List<FeatureAttributionDrift> rank(FeatureAttributions baseline, FeatureAttributions current) {
        double[] baseMeans = baseline.meanAbsolute();
        double[] curMeans = current.meanAbsolute();
        List<FeatureAttributionDrift> drifts = new ArrayList<>();
        for (int i = 0; i < baseline.features().size(); i++) {
            String feature = baseline.features().get(i);
            int j = current.features().indexOf(feature);
            if (j < 0) {
                continue;
            }
            double delta = curMeans[j] - baseMeans[i];
            drifts.add(FeatureAttributionDrift.builder()
                .feature(feature)
                .baselineMeanAbsAttribution(baseMeans[i])
                .currentMeanAbsAttribution(curMeans[j])
                .delta(delta)
                .direction(ChangeDirection.of(delta))
                .build());
        }
        drifts.sort(Comparator.comparingDouble((FeatureAttributionDrift d) -> Math.abs(d.getDelta())).reversed());
        return drifts;
    }

    private List<Map<String, Object>> subsample(List<Map<String, Object>> rows, int size, String side) {
        if (rows.size() <= size) {
            if (rows.size() < size) {
                log.warn("Sample smaller than requested; using all rows | side={} | rows={} | requested={}",
                         side, rows.size(), size);
            }
            return rows;
        }
        List<Integer> indices = new ArrayList<>(IntStream.range(0, rows.size()).boxed().toList());
        Collections.shuffle(indices, new Random(seed));
        return indices.subList(0, size).stream().map(rows::get).toList();
    }

    private static String narrate(List<FeatureAttributionDrift> top) {
        if (top.isEmpty()) {
            return "No significant feature importance drift detected.";
        }
        StringBuilder sb = new StringBuilder("Root cause analysis:\n")
            .append("The model's reliance on features has shifted. Most-changed contributors:\n");
        for (FeatureAttributionDrift d : top) {
            sb.append(String.format(Locale.ROOT, "- %s: importance %s by %.4f (baseline %.4f -> current %.4f)%n",
                d.getFeature(), d.getDirection().name().toLowerCase(Locale.ROOT), Math.abs(d.getDelta()),
                d.getBaselineMeanAbsAttribution(), d.getCurrentMeanAbsAttribution()));
        }
        sb.append("\nRecommendation: check whether the distribution of these features changed "
            + "or whether their relationship with the outcome did.");
        return sb.toString();
    }
}
