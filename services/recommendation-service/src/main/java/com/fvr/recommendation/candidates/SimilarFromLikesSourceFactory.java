package com.fvr.recommendation.candidates;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class SimilarFromLikesSourceFactory {
    private final Map<String, SimilarFromLikesSource> sources = new LinkedHashMap<>();

    public SimilarFromLikesSourceFactory(List<SimilarFromLikesSource> available) {
        for (SimilarFromLikesSource source : available) {
            sources.put(source.name(), source);
        }
    }

    public SimilarFromLikesSource create(String name) {
        SimilarFromLikesSource source = name == null ? null : sources.get(name.trim());
        if (source == null) {
            throw new IllegalArgumentException("Unknown similar-from-likes source: " + name);
        }
        return source;
    }
}
