package com.singkhmer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "transliterator")
public class TransliteratorProperties {

    /** Corpus of "khmer word: romanization1, romanization2" lines. */
    private String datasetLocation = "classpath:dataset.txt";

    /** Optional CSV (romanization,word,frequency) of ranking priors. Empty disables it. */
    private String priorsLocation = "";

    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
        private long maximumSize = 10_000;
        private Duration expireAfterWrite = Duration.ofMinutes(10);
    }
}
