package com.apiserver.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BeanInputFilterTest {

    private static ValidatorFactory validatorFactory;

    private BeanInputFilter<Input> filter;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        filter = new BeanInputFilter<>(Input.class, new ObjectMapper(), validatorFactory.getValidator());
    }

    @Test
    void testFilter_ValidInputIncludesDefaults() {
        FilterResult result = filter.filter(Map.of("a", "x", "b", "y"), null);

        assertTrue(result.isValid());
        assertEquals("x", result.values().get("a"));
        assertEquals("y", result.values().get("b"));
        assertEquals("default", result.values().get("note"));
        assertTrue(result.values().containsKey("count"));
        assertNull(result.values().get("count"));
    }

    @Test
    void testFilter_MissingRequiredFields() {
        FilterResult result = filter.filter(Map.of(), null);

        assertFalse(result.isValid());
        assertEquals(Map.of(
            "a", List.of("a is required"),
            "b", List.of("b is required")), result.messages());
        assertTrue(result.values().isEmpty());
    }

    @Test
    void testFilter_ValidationGroupOnlyChecksSubmittedFields() {
        FilterResult result = filter.filter(Map.of("a", "x"), Set.of("a"));

        assertTrue(result.isValid());
        assertEquals("x", result.values().get("a"));
    }

    @Test
    void testFilter_ValidationGroupStillRejectsSubmittedField() {
        FilterResult result = filter.filter(Map.of("count", 0), Set.of("count", "unknown"));

        assertEquals(Map.of("count", List.of("count must be positive")), result.messages());
    }

    @Test
    void testFilter_TypeMismatch() {
        FilterResult result = filter.filter(Map.of("a", "x", "b", "y", "count", "many"), null);

        assertEquals(Map.of("count", List.of("Value must be of type Integer")), result.messages());
    }

    @Test
    void testFilter_UnknownPropertiesAreIgnored() {
        FilterResult result = filter.filter(Map.of("a", "x", "b", "y", "extra", 1), null);

        assertTrue(result.isValid());
        assertFalse(result.values().containsKey("extra"));
    }

    public static class Input {
        @NotBlank(message = "a is required")
        private String a;

        @NotBlank(message = "b is required")
        private String b;

        @Min(value = 1, message = "count must be positive")
        private Integer count;

        private String note = "default";

        public String getA() {
            return a;
        }

        public void setA(String a) {
            this.a = a;
        }

        public String getB() {
            return b;
        }

        public void setB(String b) {
            this.b = b;
        }

        public Integer getCount() {
            return count;
        }

        public void setCount(Integer count) {
            this.count = count;
        }

        public String getNote() {
            return note;
        }

        public void setNote(String note) {
            this.note = note;
        }
    }
}
