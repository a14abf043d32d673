package com.fintech.papertrading.api;

import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.state.TradingState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("TradingController Integration Tests")
class TradingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TradingState state;

    private String userId;

    @BeforeEach
    void setUp() throws Exception {
        state.ingest(new PriceTick(System.currentTimeMillis(), "BTC", 50_000.0));
        userId = "user_" + UUID.randomUUID().toString().substring(0, 8);
        postJson("/api/v1/accounts", "{\"userId\":\"" + userId + "\",\"username\":\"Tester\"}")
            .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("Should open an account seeded with the starting balance")
    void testOpenAccount() throws Exception {
        String other = userId + "_b";

        postJson("/api/v1/accounts", "{\"userId\":\"" + other + "\",\"username\":\"Other\"}")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.userId").value(other))
            .andExpect(jsonPath("$.username").value("Other"))
            .andExpect(jsonPath("$.balances.USD").value(10_000.0))
            .andExpect(jsonPath("$.totalValue").value(10_000.0))
            .andExpect(jsonPath("$.transactions", hasSize(0)));
    }

    @Test
    @DisplayName("Should return 409 for a taken user id")
    void testDuplicateAccount() throws Exception {
        postJson("/api/v1/accounts", "{\"userId\":\"" + userId + "\",\"username\":\"Again\"}")
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONFLICT"));
    }

    @Test
    @DisplayName("Should reject malformed user ids")
    void testInvalidUserId() throws Exception {
        postJson("/api/v1/accounts", "{\"userId\":\"a!\",\"username\":\"Bad\"}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should serve the demo portfolio when no user id is given")
    void testDemoPortfolio() throws Exception {
        mockMvc.perform(get("/api/v1/portfolio"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value("demo_user"))
            .andExpect(jsonPath("$.username").value("Demo User"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown user")
    void testUnknownPortfolio() throws Exception {
        mockMvc.perform(get("/api/v1/portfolio").param("userId", "nobody_here"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should execute a buy and reflect it in the portfolio")
    void testBuy() throws Exception {
        postJson("/api/v1/trade", trade("btc", "usd", "BUY", 0.1))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("TRADE"))
            .andExpect(jsonPath("$.side").value("BUY"))
            .andExpect(jsonPath("$.baseAsset").value("BTC"))
            .andExpect(jsonPath("$.price").value(50_000.0))
            .andExpect(jsonPath("$.executedBy").doesNotExist());

        mockMvc.perform(get("/api/v1/portfolio").param("userId", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balances.BTC").value(closeTo(0.1, 1e-12)))
            .andExpect(jsonPath("$.balances.USD").value(closeTo(5_000.0, 1e-6)))
            .andExpect(jsonPath("$.totalValue").value(closeTo(10_000.0, 1e-6)))
            .andExpect(jsonPath("$.transactions", hasSize(1)));
    }

    @Test
    @DisplayName("Should map ledger rejections to 400 with the error code")
    void testLedgerRejections() throws Exception {
        postJson("/api/v1/trade", trade("BTC", "USD", "BUY", 1.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));
        postJson("/api/v1/trade", trade("BTC", "USD", "SELL", 1.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_ASSETS"));
        postJson("/api/v1/trade", trade("BTC", "USD", "BUY", -1.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_QUANTITY"));
        postJson("/api/v1/trade", trade("NOPE", "USD", "BUY", 1.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("PRICE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Should reject requests with missing fields or unknown sides")
    void testMalformedTrade() throws Exception {
        postJson("/api/v1/trade", "{\"userId\":\"" + userId + "\",\"baseAsset\":\"BTC\",\"quoteAsset\":\"USD\",\"quantity\":1}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        postJson("/api/v1/trade", trade("BTC", "USD", "HOLD", 1.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("Should deposit within limits and reject amounts outside them")
    void testDeposit() throws Exception {
        postJson("/api/v1/deposit", amount(500.0))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("DEPOSIT"))
            .andExpect(jsonPath("$.quantity").value(500.0));
        postJson("/api/v1/deposit", amount(5.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("DEPOSIT_TOO_SMALL"));
        postJson("/api/v1/deposit", amount(200_000.0))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("DEPOSIT_TOO_LARGE"));

        mockMvc.perform(get("/api/v1/portfolio").param("userId", userId))
            .andExpect(jsonPath("$.balances.USD").value(10_500.0));
    }

    @Test
    @DisplayName("Should withdraw up to the balance")
    void testWithdraw() throws Exception {
        postJson("/api/v1/withdraw", amount(10_000.01))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("WITHDRAWAL_EXCEEDS_BALANCE"));
        postJson("/api/v1/withdraw", amount(1_000.0))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("WITHDRAWAL"))
            .andExpect(jsonPath("$.side").value("SELL"));
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private String trade(String base, String quote, String side, double quantity) {
        return String.format("{\"userId\":\"%s\",\"baseAsset\":\"%s\",\"quoteAsset\":\"%s\",\"side\":\"%s\",\"quantity\":%s}",
            userId, base, quote, side, quantity);
    }

    private String amount(double value) {
        return String.format("{\"userId\":\"%s\",\"amount\":%s}", userId, value);
    }
}
