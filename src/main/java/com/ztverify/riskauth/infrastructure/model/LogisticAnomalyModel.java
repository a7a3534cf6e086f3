package com.ztverify.riskauth.infrastructure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ztverify.riskauth.domain.risk.AnomalyModel;
import com.ztverify.riskauth.domain.risk.RiskFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Pretrained logistic classifier over the numeric feature vector plus one-hot country and
 * device type. Numeric inputs are standardised with the training means and scales when present.
 *
 * <pre>
 * {
 *   "version": "2024-05",
 *   "intercept": -2.0,
 *   "numericWeights": {"hourOfDay": 0.01, "knownDevice": -1.2, ...},
 *   "numericMeans":   {"hourOfDay": 11.5, ...},
 *   "numericScales":  {"hourOfDay": 6.9, ...},
 *   "countryWeights": {"RU": 1.4, "AE": -0.6},
 *   "deviceTypeWeights": {"mobile": 0.1}
 * }
 * </pre>
 */
public class LogisticAnomalyModel implements AnomalyModel {

    private static final Logger log = LoggerFactory.getLogger(LogisticAnomalyModel.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Weights(String version,
                          double intercept,
                          Map<String, Double> numericWeights,
                          Map<String, Double> numericMeans,
                          Map<String, Double> numericScales,
                          Map<String, Double> countryWeights,
                          Map<String, Double> deviceTypeWeights) {

        public Weights {
            numericWeights = numericWeights == null ? Map.of() : Map.copyOf(numericWeights);
            numericMeans = numericMeans == null ? Map.of() : Map.copyOf(numericMeans);
            numericScales = numericScales == null ? Map.of() : Map.copyOf(numericScales);
            countryWeights = countryWeights == null ? Map.of() : Map.copyOf(countryWeights);
            deviceTypeWeights = deviceTypeWeights == null ? Map.of() : Map.copyOf(deviceTypeWeights);
        }
    }

    private final Weights weights;

    public LogisticAnomalyModel(Weights weights) {
        this.weights = weights;
    }

    public static LogisticAnomalyModel load(InputStream json, ObjectMapper objectMapper) throws IOException {
        Weights weights = objectMapper.readValue(json, Weights.class);
        if (weights.numericWeights().isEmpty()) {
            throw new IOException("Model file defines no numeric weights");
        }
        log.info("Loaded logistic anomaly model version {} ({} numeric, {} country, {} device-type weights)",
                weights.version(), weights.numericWeights().size(), weights.countryWeights().size(),
                weights.deviceTypeWeights().size());
        return new LogisticAnomalyModel(weights);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public OptionalDouble predictProbability(RiskFeatures features) {
        double[] vector = features.vector();
        double z = weights.intercept();
        for (int i = 0; i < vector.length; i++) {
            String name = RiskFeatures.VECTOR_NAMES[i];
            Double w = weights.numericWeights().get(name);
            if (w == null) {
                continue;
            }
            double mean = weights.numericMeans().getOrDefault(name, 0.0);
            double scale = weights.numericScales().getOrDefault(name, 1.0);
            z += w * ((vector[i] - mean) / (scale == 0.0 ? 1.0 : scale));
        }
        z += weights.countryWeights().getOrDefault(features.countryCode(), 0.0);
        z += weights.deviceTypeWeights().getOrDefault(features.deviceType(), 0.0);
        return OptionalDouble.of(1.0 / (1.0 + Math.exp(-z)));
    }

    public String getVersion() {
        return weights.version();
    }
}
