package com.singkhmer.controller;

import com.singkhmer.service.TransliterationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class TransliterationController {

    private final TransliterationService service;

    @Autowired
    public TransliterationController(TransliterationService service) {
        this.service = service;
    }

    @GetMapping("/suggest")
    public ResponseEntity<SuggestResponse> suggest(@RequestParam(value = "q", required = false) String q) {
        TransliterationService.Suggestions s = service.suggest(q);
        return ResponseEntity.ok(new SuggestResponse(q == null ? "" : q, s.words(), new Meta(s.fromCache(), s.tookMs())));
    }

    @GetMapping("/search/exact")
    public ResponseEntity<SearchResponse> exact(@RequestParam(value = "q", required = false) String q) {
        return ResponseEntity.ok(new SearchResponse(q, "exact", service.searchExact(q)));
    }

    @GetMapping("/search/prefix")
    public ResponseEntity<SearchResponse> prefix(
            @RequestParam(value = "q", required = false) String q,
            @RequestParam(value = "limit", defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(new SearchResponse(q, "prefix", service.searchPrefix(q, limit)));
    }

    @PostMapping("/accept")
    public ResponseEntity<Map<String, Boolean>> accept(@RequestBody(required = false) AcceptRequest req) {
        if (req == null || req.getRomanization() == null || req.getWord() == null) {
            return ResponseEntity.badRequest().build();
        }
        boolean learned = service.accept(req.getRomanization(), req.getWord());
        return ResponseEntity.ok(Map.of("learned", learned));
    }

    @GetMapping("/stats")
    public ResponseEntity<TransliterationService.Stats> stats() {
        return ResponseEntity.ok(service.stats());
    }

    // DTOs
    public static class AcceptRequest {
        private String romanization;
        private String word;
        public String getRomanization() { return romanization; }
        public void setRomanization(String romanization) { this.romanization = romanization; }
        public String getWord() { return word; }
        public void setWord(String word) { this.word = word; }
    }

    public static class SuggestResponse {
        private final String input;
        private final List<String> suggestions;
        private final Meta meta;
        public SuggestResponse(String input, List<String> suggestions, Meta meta) {
            this.input = input; this.suggestions = suggestions; this.meta = meta;
        }
        public String getInput() { return input; }
        public List<String> getSuggestions() { return suggestions; }
        public Meta getMeta() { return meta; }
    }

    public static class Meta {
        private final boolean fromCache;
        private final long tookMs;
        public Meta(boolean fromCache, long tookMs) {
            this.fromCache = fromCache; this.tookMs = tookMs;
        }
        public boolean isFromCache() { return fromCache; }
        public long getTookMs() { return tookMs; }
    }
}
