package com.openforge.kairn;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import static org.junit.jupiter.api.Assertions.*;

class KairnApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(KairnApplication.class.getAnnotation(SpringBootApplication.class));
        EnableConfigurationProperties props = KairnApplication.class.getAnnotation(EnableConfigurationProperties.class);
        assertNotNull(props);
        assertEquals(5, props.value().length);
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(KairnApplication.class.getMethod("main", String[].class));
    }
}
