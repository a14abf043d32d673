package com.fintech.papertrading.api;

import com.fintech.papertrading.ledger.DuplicateAccountException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Status mapping of {@link GlobalExceptionHandler} against a controller that only throws.
 */
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ThrowingController())
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should map a taken user id to 409")
    void testDuplicateAccount() throws Exception {
        mockMvc.perform(get("/duplicate"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONFLICT"))
            .andExpect(jsonPath("$.message").value("Account already exists: alice"));
    }

    @Test
    @DisplayName("Should treat a broken ledger invariant as a server error")
    void testInvariantViolation() throws Exception {
        mockMvc.perform(get("/invariant"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @RestController
    static class ThrowingController {

        @GetMapping("/duplicate")
        String duplicate() {
            throw new DuplicateAccountException("alice");
        }

        @GetMapping("/invariant")
        String invariant() {
            throw new IllegalStateException("Balance of USD would become negative");
        }
    }
}
