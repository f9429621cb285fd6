package com.comicguess.dailypuzzle.controller;

import com.comicguess.dailypuzzle.dto.DailyProgressResponse;
import com.comicguess.dailypuzzle.dto.GuessRequest;
import com.comicguess.dailypuzzle.dto.GuessResponse;
import com.comicguess.dailypuzzle.dto.PuzzleResponse;
import com.comicguess.dailypuzzle.dto.PuzzleStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakStatusResponse;
import com.comicguess.dailypuzzle.dto.StreakSummary;
import com.comicguess.dailypuzzle.exception.AuthenticationRequiredException;
import com.comicguess.dailypuzzle.security.JwtUtil;
import com.comicguess.dailypuzzle.service.GameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/game")
@CrossOrigin(origins = "${cors.allowed.origins}")
public class GameController {

    private final GameService gameService;
    private final JwtUtil jwtUtil;

    public GameController(GameService gameService, JwtUtil jwtUtil) {
        this.gameService = gameService;
        this.jwtUtil = jwtUtil;
    }

    /**
     * GET /api/game/{universe}/today
     * Get today's puzzle of a universe
     */
    @GetMapping("/{universe}/today")
    public ResponseEntity<PuzzleResponse> getTodaysPuzzle(@PathVariable String universe) {
        return ResponseEntity.ok(gameService.getTodaysPuzzle(universe));
    }

    /**
     * POST /api/game/guess
     * Submit a guess for today's puzzle
     */
    @PostMapping("/guess")
    public ResponseEntity<GuessResponse> submitGuess(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestBody GuessRequest request) {

        String userId = extractUserId(authHeader);
        GuessResponse response = gameService.submitGuess(userId, request.getUniverse(), request.getGuess());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/game/puzzles/{puzzleId}/status
     * Get the current user's progress on a puzzle
     */
    @GetMapping("/puzzles/{puzzleId}/status")
    public ResponseEntity<PuzzleStatusResponse> getPuzzleStatus(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @PathVariable String puzzleId) {

        String userId = extractUserId(authHeader);
        return ResponseEntity.ok(gameService.getPuzzleStatus(userId, puzzleId));
    }

    /**
     * GET /api/game/streaks/me
     * Get the current user's streaks per universe
     */
    @GetMapping("/streaks/me")
    public ResponseEntity<Map<String, StreakSummary>> getMyStreaks(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        String userId = extractUserId(authHeader);
        return ResponseEntity.ok(gameService.getStreaks(userId));
    }

    /**
     * GET /api/game/streaks/publisher?publisher=marvel
     * Get the current user's streak in one universe
     */
    @GetMapping("/streaks/publisher")
    public ResponseEntity<StreakSummary> getMyStreak(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam String publisher) {

        String userId = extractUserId(authHeader);
        return ResponseEntity.ok(gameService.getStreak(userId, publisher));
    }

    /**
     * GET /api/game/daily-progress?date=YYYY-MM-DD
     * Get the current user's progress on every universe for a day (defaults to today)
     */
    @GetMapping("/daily-progress")
    public ResponseEntity<DailyProgressResponse> getDailyProgress(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam(required = false) String date) {

        String userId = extractUserId(authHeader);
        return ResponseEntity.ok(gameService.getDailyProgress(userId, date));
    }

    /**
     * GET /api/game/streak-status
     * Get the current user's streaks and whether today's play keeps them
     */
    @GetMapping("/streak-status")
    public ResponseEntity<StreakStatusResponse> getStreakStatus(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        String userId = extractUserId(authHeader);
        return ResponseEntity.ok(gameService.getStreakStatus(userId));
    }

    /**
     * Extract user ID from JWT token
     */
    private String extractUserId(String authHeader) {
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            throw new AuthenticationRequiredException("Missing or invalid authorization header");
        }
        String token = authHeader.substring(7);
        return jwtUtil.extractUserId(token);
    }
}
