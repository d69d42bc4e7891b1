package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.application.RecordStatistics;
import com.cardiorecords.domain.model.Classification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordStatisticsResponse {

    private long totalAnalyses;
    private Instant lastAnalysisDate;
    private Classification lastClassification;
    private List<ClassificationCount> byClassification;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClassificationCount {
        private Classification classification;
        private long count;
        private Double avgConfidence;
        private Double avgHeartRate;
    }

    public static RecordStatisticsResponse from(RecordStatistics statistics) {
        return RecordStatisticsResponse.builder()
            .totalAnalyses(statistics.getTotalAnalyses())
            .lastAnalysisDate(statistics.getLastAnalysisAt())
            .lastClassification(statistics.getLastClassification())
            .byClassification(statistics.getByClassification().stream()
                .map(s -> ClassificationCount.builder()
                    .classification(s.getClassification())
                    .count(s.getCount())
                    .avgConfidence(s.getAverageConfidence())
                    .avgHeartRate(s.getAverageHeartRate())
                    .build())
                .collect(Collectors.toList()))
            .build();
    }
}
