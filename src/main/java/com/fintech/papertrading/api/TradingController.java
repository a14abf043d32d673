package com.fintech.papertrading.api;

import com.fintech.papertrading.api.dto.AmountRequest;
import com.fintech.papertrading.api.dto.OpenAccountRequest;
import com.fintech.papertrading.api.dto.PortfolioResponse;
import com.fintech.papertrading.api.dto.TradeRequest;
import com.fintech.papertrading.config.TradingProperties;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.Transaction;
import com.fintech.papertrading.ledger.LedgerService;
import com.fintech.papertrading.ledger.TradeError;
import com.fintech.papertrading.ledger.TradeException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accounts, portfolio, manual trades and cash movements. Requests without a user id
 * act on the demo user.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Trading", description = "Portfolio, trades, deposits and withdrawals")
public class TradingController {

    private final LedgerService ledger;
    private final TradingProperties properties;

    public TradingController(LedgerService ledger, TradingProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    @Operation(summary = "Get balances, total value and transaction history")
    @GetMapping("/portfolio")
    public ResponseEntity<PortfolioResponse> getPortfolio(
            @Parameter(description = "Trading user, defaults to the demo user")
            @RequestParam(required = false) String userId) {
        String user = userOrDemo(userId);
        Account account = ledger.account(user).orElseThrow(() -> new TradeException(TradeError.USER_NOT_FOUND));
        double totalValue = ledger.portfolioValue(user).orElse(0.0);
        return ResponseEntity.ok(PortfolioResponse.of(user, account, totalValue));
    }

    @Operation(
        summary = "Execute a market order at the current pair price",
        description = "Buys debit the quote asset by price * quantity; sells debit the base asset by quantity."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Trade recorded"),
        @ApiResponse(
            responseCode = "400",
            description = "INVALID_QUANTITY, PRICE_UNAVAILABLE, INSUFFICIENT_FUNDS or INSUFFICIENT_ASSETS",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "USER_NOT_FOUND",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping("/trade")
    public ResponseEntity<Transaction> trade(@Valid @RequestBody TradeRequest request) {
        Transaction trade = ledger.executeTrade(
            userOrDemo(request.userId()),
            MarketDataController.normalize(request.baseAsset()),
            MarketDataController.normalize(request.quoteAsset()),
            request.side(),
            request.quantity()
        );
        return ResponseEntity.ok(trade);
    }

    @Operation(summary = "Deposit reference currency", description = "Amount must be between the configured limits.")
    @PostMapping("/deposit")
    public ResponseEntity<Transaction> deposit(@Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(ledger.deposit(userOrDemo(request.userId()), request.amount()));
    }

    @Operation(summary = "Withdraw reference currency")
    @PostMapping("/withdraw")
    public ResponseEntity<Transaction> withdraw(@Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(ledger.withdraw(userOrDemo(request.userId()), request.amount()));
    }

    @Operation(summary = "Open an account seeded with the starting balance")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Account created"),
        @ApiResponse(
            responseCode = "409",
            description = "User id already taken",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping("/accounts")
    public ResponseEntity<PortfolioResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        Account account = ledger.openAccount(request.userId(), request.username());
        double totalValue = ledger.portfolioValue(request.userId()).orElse(0.0);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PortfolioResponse.of(request.userId(), account, totalValue));
    }

    private String userOrDemo(String userId) {
        return userId == null || userId.isBlank() ? properties.getDemoUserId() : userId;
    }
}
