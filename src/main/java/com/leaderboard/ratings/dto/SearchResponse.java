package com.leaderboard.ratings.dto;

import com.leaderboard.ratings.model.RankedUser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private List<RankedUser> results;
    private int count;
}
