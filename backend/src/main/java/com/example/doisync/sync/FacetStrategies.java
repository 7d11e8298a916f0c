package com.example.doisync.sync;

import com.example.doisync.model.Facet;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class FacetStrategies {

    private final Map<Facet, FacetStrategy> byFacet = new EnumMap<>(Facet.class);

    public FacetStrategies(List<FacetStrategy> strategies) {
        for (FacetStrategy s : strategies) {
            byFacet.put(s.facet(), s);
        }
    }

    public FacetStrategy forFacet(Facet facet) {
        FacetStrategy s = byFacet.get(facet);
        if (s == null) {
            throw new IllegalArgumentException("No sync strategy for facet " + facet);
        }
        return s;
    }

    public static FacetStrategies defaults() {
        return new FacetStrategies(List.of(new CreatorsStrategy(), new ContributorsStrategy(), new PublisherStrategy()));
    }
}
