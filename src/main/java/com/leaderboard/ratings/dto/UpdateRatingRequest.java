package com.leaderboard.ratings.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Out-of-range ratings are accepted and clamped by the service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRatingRequest {
    @NotNull(message = "Rating cannot be null")
    private Integer rating;
}
