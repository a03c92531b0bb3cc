package com.singkhmer.config;

import com.singkhmer.data.RomanizationTrie;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {
    @Autowired
    public MetricsConfig(MeterRegistry registry, RomanizationTrie trie) {
        registry.counter("transliterator.startups", "app", "sing-khmer").increment();
        Gauge.builder("transliterator.index.keys", trie, RomanizationTrie::keyCount)
                .description("distinct romanizations in the index")
                .register(registry);
        Gauge.builder("transliterator.index.pairs", trie, RomanizationTrie::pairCount)
                .description("distinct romanization/word pairs in the index")
                .register(registry);
    }
}
