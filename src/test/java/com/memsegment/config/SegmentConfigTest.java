package com.memsegment.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SegmentConfigTest {

    @Test
    void testDefaults() {
        SegmentConfig config = SegmentConfig.defaults();

        assertEquals(Constants.IDENTITY_FIELD, config.getIdentityField());
        assertFalse(config.isEnableStopWords());
        assertTrue(config.isIncludeTermVectors());
        assertTrue(config.isOptimizeBitmaps());
    }

    @Test
    void testSetters() {
        SegmentConfig config = new SegmentConfig();
        config.setIdentityField("key");
        config.setEnableStopWords(true);
        config.setIncludeTermVectors(false);
        config.setOptimizeBitmaps(false);

        assertEquals("key", config.getIdentityField());
        assertTrue(config.isEnableStopWords());
        assertFalse(config.isIncludeTermVectors());
        assertFalse(config.isOptimizeBitmaps());
    }

    @Test
    void testRejectEmptyIdentityField() {
        SegmentConfig config = new SegmentConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setIdentityField(null));
        assertThrows(IllegalArgumentException.class, () -> config.setIdentityField(""));
    }
}
