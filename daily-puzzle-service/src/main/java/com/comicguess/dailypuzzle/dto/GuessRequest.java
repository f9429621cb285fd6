package com.comicguess.dailypuzzle.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GuessRequest {
    private String universe; // marvel, dc or image
    private String guess;
}
