package com.memsegment.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals("_id", Constants.IDENTITY_FIELD);
        assertEquals(2, Constants.MIN_TERM_LENGTH);

        assertEquals(8, Constants.SIZE_OF_REFERENCE);
        assertEquals(4, Constants.SIZE_OF_INT);
        assertEquals(4, Constants.SIZE_OF_FLOAT);

        assertEquals(1_000_000, Constants.MAX_BATCH_DOCUMENTS);
        assertEquals(100, Constants.DEFAULT_TERMS_LIMIT);
        assertEquals(100_000, Constants.MAX_TERMS_LIMIT);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
