package com.sandy.fleet.health.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandy.fleet.health.vo.Recommendation;
import com.sandy.fleet.health.vo.RiskFactor;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

/** Concrete JSON column converters (JPA needs a non-generic class per attribute type). */
public final class JsonConverters {

    private JsonConverters() {
    }

    @Converter
    public static class RiskFactorList extends JsonAttributeConverter<List<RiskFactor>> {
        public RiskFactorList() { super(new TypeReference<>() {}); }
    }

    @Converter
    public static class RecommendationList extends JsonAttributeConverter<List<Recommendation>> {
        public RecommendationList() { super(new TypeReference<>() {}); }
    }

    @Converter
    public static class ContextMap extends JsonAttributeConverter<Map<String, Object>> {
        public ContextMap() { super(new TypeReference<>() {}); }
    }
}
