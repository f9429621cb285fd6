package com.comicguess.dailypuzzle.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a universe's character pool
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CharacterProfile {
    private String name;
    @Builder.Default
    private List<String> aliases = new ArrayList<>();
    private String imageKey; // object storage path, e.g. marvel/spider-man.jpg
}
