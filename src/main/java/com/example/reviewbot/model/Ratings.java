package com.example.reviewbot.model;

import lombok.*;

/**
 * Three 1-5 ratings. Fields are nullable while a draft is being filled in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Ratings {
    private Integer overall;
    private Integer quality;
    private Integer difficulty;

    public Integer valueOf(RatingDimension dimension) {
        switch (dimension) {
            case OVERALL: return overall;
            case QUALITY: return quality;
            case DIFFICULTY: return difficulty;
            default: throw new IllegalArgumentException("Unknown dimension " + dimension);
        }
    }

    public void put(RatingDimension dimension, Integer value) {
        switch (dimension) {
            case OVERALL: overall = value; break;
            case QUALITY: quality = value; break;
            case DIFFICULTY: difficulty = value; break;
            default: throw new IllegalArgumentException("Unknown dimension " + dimension);
        }
    }

    public Ratings copy() {
        return toBuilder().build();
    }
}
