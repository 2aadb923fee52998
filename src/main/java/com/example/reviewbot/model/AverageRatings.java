package com.example.reviewbot.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AverageRatings {
    private double overall;
    private double quality;
    private double difficulty;
}
