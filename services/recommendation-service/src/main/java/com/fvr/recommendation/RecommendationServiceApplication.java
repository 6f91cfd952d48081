package com.fvr.recommendation;

import com.fvr.recommendation.config.AnnProperties;
import com.fvr.recommendation.config.ModerationProperties;
import com.fvr.recommendation.config.PopularityProperties;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.SimilarityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    RecommendationProperties.class,
    SimilarityProperties.class,
    AnnProperties.class,
    ModerationProperties.class,
    PopularityProperties.class
})
public class RecommendationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecommendationServiceApplication.class, args);
    }
}
