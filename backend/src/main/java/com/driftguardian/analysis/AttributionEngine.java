package com.driftguardian.analysis;

import com.driftguardian.exception.UnsupportedModelException;

import java.util.List;
import java.util.Map;

/**
 * Model-agnostic feature attribution, e.g. a SHAP explainer behind a service.
 */
public interface AttributionEngine {

    /**
     * @throws UnsupportedModelException when the engine cannot introspect the model
     */
    FeatureAttributions attribute(ModelReference model, List<String> features, List<Map<String, Object>> sample);
}
