package com.singkhmer.controller;

import com.singkhmer.data.RomanizationTrie;
import com.singkhmer.service.TransliterationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Typo-tolerant lookup. maxDistance is capped at {@link TransliterationService#MAX_FUZZY_DISTANCE}.
 */
@RestController
@RequestMapping("/api")
public class SpellingController {

    private final TransliterationService service;

    @Autowired
    public SpellingController(TransliterationService service) {
        this.service = service;
    }

    @GetMapping("/spellcheck")
    public ResponseEntity<SearchResponse> spellcheck(
            @RequestParam(value = "q", required = false) String q,
            @RequestParam(value = "maxDistance", defaultValue = "" + RomanizationTrie.DEFAULT_MAX_DISTANCE) int maxDistance
    ) {
        return ResponseEntity.ok(new SearchResponse(q, "fuzzy", service.searchFuzzy(q, maxDistance)));
    }
}
