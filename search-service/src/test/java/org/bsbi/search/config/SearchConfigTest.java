package org.bsbi.search.config;

import org.bsbi.core.codec.VbePostingsCodec;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchConfigTest {

    @Test
    public void testDefaults() {
        SearchConfig config = SearchConfig.load(new Properties());

        assertEquals("main_index", config.indexName());
        assertInstanceOf(VbePostingsCodec.class, config.postingsCodec());
        assertEquals(10, config.defaultK());
        assertEquals(1.2, config.bm25().k1(), 1e-9);
        assertEquals(0.75, config.bm25().b(), 1e-9);
        assertTrue(config.text().stemming());
    }

    @Test
    public void testOverridesAndValidation() {
        Properties overrides = new Properties();
        overrides.setProperty("search.bm25.b", "0.5");
        assertEquals(0.5, SearchConfig.load(overrides).bm25().b(), 1e-9);

        Properties bad = new Properties();
        bad.setProperty("search.bm25.k1", "high");
        assertThrows(IllegalStateException.class, () -> SearchConfig.load(bad));
    }

    @Test
    public void testInvalidCodecAndStemmingFailFast() {
        Properties codec = new Properties();
        codec.setProperty("index.codec", "zip");
        assertThrows(IllegalStateException.class, () -> SearchConfig.load(codec));

        Properties stemming = new Properties();
        stemming.setProperty("text.stemming", "yes");
        assertThrows(IllegalStateException.class, () -> SearchConfig.load(stemming));

        Properties upper = new Properties();
        upper.setProperty("index.codec", " Standard ");
        assertEquals("standard", SearchConfig.load(upper).codec());
    }
}
