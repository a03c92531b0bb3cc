package com.singkhmer.config;

import com.singkhmer.data.CorpusLoader;
import com.singkhmer.data.RomanizationTrie;
import com.singkhmer.service.SuggestionComposer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The index is built completely by {@link CorpusLoader} before it is published as a bean.
 */
@Configuration
@EnableConfigurationProperties(TransliteratorProperties.class)
public class TransliteratorConfig {

    @Bean
    public RomanizationTrie romanizationTrie(CorpusLoader corpusLoader) {
        return corpusLoader.load();
    }

    @Bean
    public SuggestionComposer suggestionComposer(RomanizationTrie trie) {
        return new SuggestionComposer(trie);
    }
}
