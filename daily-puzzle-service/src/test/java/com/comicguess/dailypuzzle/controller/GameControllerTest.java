package com.comicguess.dailypuzzle.controller;

import com.comicguess.dailypuzzle.dto.DailyProgressResponse;
import com.comicguess.dailypuzzle.dto.GuessResponse;
import com.comicguess.dailypuzzle.dto.PuzzleResponse;
import com.comicguess.dailypuzzle.dto.PuzzleStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakMaintenanceStatus;
import com.comicguess.dailypuzzle.dto.StreakStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakSummary;
import com.comicguess.dailypuzzle.dto.UniverseProgress;
import com.comicguess.dailypuzzle.exception.AlreadySolvedException;
import com.comicguess.dailypuzzle.exception.EmptyPoolException;
import com.comicguess.dailypuzzle.exception.InvalidDateException;
import com.comicguess.dailypuzzle.exception.InvalidUniverseException;
import com.comicguess.dailypuzzle.exception.GameplayExceptionAdvice;
import com.comicguess.dailypuzzle.model.GameState;
import com.comicguess.dailypuzzle.model.StreakMaintenance;
import com.comicguess.dailypuzzle.model.Universe;
import com.comicguess.dailypuzzle.security.JwtUtil;
import com.comicguess.dailypuzzle.service.GameService;
import io.jsonwebtoken.MalformedJwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class GameControllerTest {

    private static final String GUESS_BODY = "{\"universe\": \"marvel\", \"guess\": \"spiderman\"}";

    @Mock
    private GameService gameService;

    @Mock
    private JwtUtil jwtUtil;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new GameController(gameService, jwtUtil))
                .setControllerAdvice(new GameplayExceptionAdvice())
                .addPlaceholderValue("cors.allowed.origins", "*")
                .build();
    }

    @Test
    void todaysPuzzleHidesAnswer() throws Exception {
        when(gameService.getTodaysPuzzle("marvel")).thenReturn(PuzzleResponse.builder()
                .puzzleId("20240115-marvel").universe("marvel").activeDate(LocalDate.of(2024, 1, 15)).build());

        mockMvc.perform(get("/api/game/marvel/today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.puzzle_id").value("20240115-marvel"))
                .andExpect(jsonPath("$.universe").value("marvel"))
                .andExpect(jsonPath("$.character").doesNotExist());
    }

    @Test
    void unknownUniverseIsBadRequest() throws Exception {
        when(gameService.getTodaysPuzzle("valiant")).thenThrow(new InvalidUniverseException("valiant"));

        mockMvc.perform(get("/api/game/valiant/today"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("invalid_universe"))
                .andExpect(jsonPath("$.path").value("/api/game/valiant/today"));
    }

    @Test
    void correctGuessReturnsSnakeCaseResult() throws Exception {
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.submitGuess("user-1", "marvel", "spiderman")).thenReturn(GuessResponse.builder()
                .puzzleId("20240115-marvel")
                .correct(true)
                .character("Spider-Man")
                .imageKey("marvel/spider-man.jpg")
                .attemptNumber(1)
                .attemptsRemaining(5)
                .maxAttempts(6)
                .gameOver(true)
                .streak(1)
                .build());

        mockMvc.perform(post("/api/game/guess")
                        .header("Authorization", "Bearer good-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GUESS_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(true))
                .andExpect(jsonPath("$.character").value("Spider-Man"))
                .andExpect(jsonPath("$.attempt_number").value(1))
                .andExpect(jsonPath("$.attempts_remaining").value(5))
                .andExpect(jsonPath("$.game_over").value(true))
                .andExpect(jsonPath("$.image_key").value("marvel/spider-man.jpg"));
    }

    @Test
    void guessWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/game/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GUESS_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthenticated"));
        verifyNoInteractions(gameService);
    }

    @Test
    void guessWithBadTokenIsUnauthorized() throws Exception {
        when(jwtUtil.extractUserId("garbage")).thenThrow(new MalformedJwtException("bad token"));

        mockMvc.perform(post("/api/game/guess")
                        .header("Authorization", "Bearer garbage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GUESS_BODY))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(gameService);
    }

    @Test
    void guessAfterSolveIsConflict() throws Exception {
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.submitGuess(any(), any(), any())).thenThrow(new AlreadySolvedException("20240115-marvel"));

        mockMvc.perform(post("/api/game/guess")
                        .header("Authorization", "Bearer good-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GUESS_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("already_solved"));
    }

    @Test
    void emptyPoolIsServerError() throws Exception {
        when(gameService.getTodaysPuzzle("image")).thenThrow(new EmptyPoolException(Universe.IMAGE));

        mockMvc.perform(get("/api/game/image/today"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("empty_pool"));
    }

    @Test
    void unavailableStorageIsServiceUnavailable() throws Exception {
        when(gameService.getTodaysPuzzle("dc")).thenThrow(new QueryTimeoutException("timeout"));

        mockMvc.perform(get("/api/game/dc/today"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("repository_unavailable"));
    }

    @Test
    void statusReportsProgress() throws Exception {
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getPuzzleStatus("user-1", "20240115-marvel")).thenReturn(PuzzleStatusResponse.builder()
                .puzzleId("20240115-marvel")
                .state(GameState.IN_PROGRESS)
                .canGuess(true)
                .solved(false)
                .attemptsUsed(2)
                .attemptsRemaining(4)
                .maxAttempts(6)
                .guesses(List.of("Thor", "Hulk"))
                .build());

        mockMvc.perform(get("/api/game/puzzles/20240115-marvel/status")
                        .header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.can_guess").value(true))
                .andExpect(jsonPath("$.is_solved").value(false))
                .andExpect(jsonPath("$.attempts_used").value(2))
                .andExpect(jsonPath("$.state").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.guesses[1]").value("Hulk"));
    }

    @Test
    void streaksAreKeyedByUniverse() throws Exception {
        Map<String, StreakSummary> streaks = new LinkedHashMap<>();
        streaks.put("marvel", StreakSummary.builder().current(3).longest(5).build());
        streaks.put("dc", StreakSummary.builder().current(0).longest(0).build());
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getStreaks("user-1")).thenReturn(streaks);

        mockMvc.perform(get("/api/game/streaks/me").header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.marvel.current").value(3))
                .andExpect(jsonPath("$.marvel.longest").value(5))
                .andExpect(jsonPath("$.dc.current").value(0));
    }

    @Test
    void publisherStreakForCurrentUser() throws Exception {
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getStreak("user-1", "dc")).thenReturn(StreakSummary.builder().current(2).longest(4).build());

        mockMvc.perform(get("/api/game/streaks/publisher").param("publisher", "dc")
                        .header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current").value(2))
                .andExpect(jsonPath("$.longest").value(4));
    }

    @Test
    void publisherStreakWithoutPublisherIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/game/streaks/publisher").header("Authorization", "Bearer good-token"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
        verifyNoInteractions(gameService);
    }

    @Test
    void dailyProgressRendersEachUniverse() throws Exception {
        Map<String, UniverseProgress> universes = new LinkedHashMap<>();
        universes.put("marvel", UniverseProgress.builder()
                .puzzleAvailable(true).puzzleId("20240115-marvel").solved(true)
                .attemptsUsed(1).attemptsRemaining(5).canGuess(false).guesses(List.of("Spidey")).build());
        universes.put("dc", UniverseProgress.builder().puzzleAvailable(false).puzzleId("20240115-dc").build());
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getDailyProgress("user-1", "2024-01-15")).thenReturn(DailyProgressResponse.builder()
                .date(LocalDate.of(2024, 1, 15)).userId("user-1").universes(universes).build());

        mockMvc.perform(get("/api/game/daily-progress").param("date", "2024-01-15")
                        .header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value("user-1"))
                .andExpect(jsonPath("$.universes.marvel.puzzle_available").value(true))
                .andExpect(jsonPath("$.universes.marvel.is_solved").value(true))
                .andExpect(jsonPath("$.universes.marvel.guesses[0]").value("Spidey"))
                .andExpect(jsonPath("$.universes.dc.puzzle_available").value(false))
                .andExpect(jsonPath("$.universes.dc.attempts_used").doesNotExist());
    }

    @Test
    void dailyProgressWithBadDateIsBadRequest() throws Exception {
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getDailyProgress("user-1", "yesterday")).thenThrow(new InvalidDateException("yesterday"));

        mockMvc.perform(get("/api/game/daily-progress").param("date", "yesterday")
                        .header("Authorization", "Bearer good-token"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_date"));
    }

    @Test
    void streakStatusRendersMaintenanceCodes() throws Exception {
        Map<String, StreakMaintenanceStatus> maintenance = new LinkedHashMap<>();
        maintenance.put("marvel", StreakMaintenanceStatus.builder()
                .status(StreakMaintenance.PENDING).message(StreakMaintenance.PENDING.getMessage()).attemptsRemaining(4).build());
        maintenance.put("image", StreakMaintenanceStatus.builder()
                .status(StreakMaintenance.NO_PUZZLE).message(StreakMaintenance.NO_PUZZLE.getMessage()).build());
        when(jwtUtil.extractUserId("good-token")).thenReturn("user-1");
        when(gameService.getStreakStatus("user-1")).thenReturn(StreakStatusResponse.builder()
                .userId("user-1")
                .date(LocalDate.of(2024, 1, 15))
                .streaks(Map.of("marvel", StreakSummary.builder().current(3).longest(3).build()))
                .maintenance(maintenance)
                .build());

        mockMvc.perform(get("/api/game/streak-status").header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.streaks.marvel.current").value(3))
                .andExpect(jsonPath("$.maintenance.marvel.status").value("pending"))
                .andExpect(jsonPath("$.maintenance.marvel.attempts_remaining").value(4))
                .andExpect(jsonPath("$.maintenance.image.status").value("no_puzzle"));
    }
}
