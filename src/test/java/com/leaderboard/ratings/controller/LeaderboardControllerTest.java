package com.leaderboard.ratings.controller;

import com.leaderboard.ratings.model.RankedUser;
import com.leaderboard.ratings.service.LeaderboardService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaderboardService leaderboardService;

    @Test
    void testGetLeaderboard_DefaultParameters() throws Exception {
        // Arrange
        when(leaderboardService.getLeaderboard(1, 50)).thenReturn(List.of(
            new RankedUser("raj", 5000, 1), new RankedUser("anita", 5000, 1), new RankedUser("rohan", 4990, 3)));
        when(leaderboardService.getTotalUsers()).thenReturn(3L);

        // Act & Assert
        mockMvc.perform(get("/api/leaderboard"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.page").value(1))
            .andExpect(jsonPath("$.pageSize").value(50))
            .andExpect(jsonPath("$.totalUsers").value(3))
            .andExpect(jsonPath("$.users", hasSize(3)))
            .andExpect(jsonPath("$.users[0].username").value("raj"))
            .andExpect(jsonPath("$.users[2].rank").value(3));
    }

    @Test
    void testGetLeaderboard_OutOfRangeParametersFallBackToDefaults() throws Exception {
        when(leaderboardService.getLeaderboard(1, 50)).thenReturn(List.of());

        mockMvc.perform(get("/api/leaderboard").param("page", "0").param("pageSize", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.page").value(1))
            .andExpect(jsonPath("$.pageSize").value(50));

        verify(leaderboardService).getLeaderboard(1, 50);
    }

    @Test
    void testGetLeaderboard_UnparsableParametersFallBackToDefaults() throws Exception {
        when(leaderboardService.getLeaderboard(1, 50)).thenReturn(List.of());

        mockMvc.perform(get("/api/leaderboard").param("page", "abc").param("pageSize", "-"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.page").value(1))
            .andExpect(jsonPath("$.pageSize").value(50));
    }

    @Test
    void testGetLeaderboard_ValidParametersPassedThrough() throws Exception {
        when(leaderboardService.getLeaderboard(3, 100)).thenReturn(List.of());

        mockMvc.perform(get("/api/leaderboard").param("page", "3").param("pageSize", "100"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.page").value(3))
            .andExpect(jsonPath("$.pageSize").value(100))
            .andExpect(jsonPath("$.users", hasSize(0)));
    }

    @Test
    void testSearch_MissingQueryIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("query parameter 'q' is required"))
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/search").param("q", ""))
            .andExpect(status().isBadRequest());

        verify(leaderboardService, never()).searchUsers(anyString());
    }

    @Test
    void testSearch_ReturnsResultsAndCount() throws Exception {
        when(leaderboardService.searchUsers("RAJ")).thenReturn(List.of(
            new RankedUser("raj", 4000, 2), new RankedUser("rajesh", 3000, 3)));

        mockMvc.perform(get("/api/search").param("q", "RAJ"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(2))
            .andExpect(jsonPath("$.results[0].username").value("raj"))
            .andExpect(jsonPath("$.results[1].rank").value(3));
    }

    @Test
    void testStats() throws Exception {
        when(leaderboardService.getTotalUsers()).thenReturn(10000L);

        mockMvc.perform(get("/api/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalUsers").value(10000))
            .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void testApiRoot() throws Exception {
        when(leaderboardService.getTotalUsers()).thenReturn(42L);

        mockMvc.perform(get("/api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.users").value(42));
    }

    @Test
    void testGetUser_Found() throws Exception {
        when(leaderboardService.findUser("RAJ")).thenReturn(Optional.of(new RankedUser("raj", 4000, 2)));

        mockMvc.perform(get("/api/users/RAJ"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.username").value("raj"))
            .andExpect(jsonPath("$.rating").value(4000))
            .andExpect(jsonPath("$.rank").value(2));
    }

    @Test
    void testGetUser_NotFound() throws Exception {
        when(leaderboardService.findUser("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/users/ghost"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("USER_NOT_FOUND"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testCorsPreflight() throws Exception {
        mockMvc.perform(options("/api/leaderboard")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
    }
}
