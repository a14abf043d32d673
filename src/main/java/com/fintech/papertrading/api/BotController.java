package com.fintech.papertrading.api;

import com.fintech.papertrading.api.dto.BotActionResponse;
import com.fintech.papertrading.api.dto.StartBotRequest;
import com.fintech.papertrading.bot.BotStatus;
import com.fintech.papertrading.bot.BotSupervisor;
import com.fintech.papertrading.config.TradingProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/bot")
@Tag(name = "Bots", description = "Start, stop and inspect autonomous trading bots")
public class BotController {

    private final BotSupervisor supervisor;
    private final TradingProperties properties;

    public BotController(BotSupervisor supervisor, TradingProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    @Operation(summary = "Start a bot", description = "One bot per user. The bot stops itself once the portfolio "
        + "has lost at least the stoploss amount since start.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Bot started"),
        @ApiResponse(responseCode = "400", description = "Non-positive stoploss or unknown bot",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown user",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "User already has an active bot",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/start")
    public ResponseEntity<BotActionResponse> start(@Valid @RequestBody StartBotRequest request) {
        BotStatus status = supervisor.start(
            userOrDemo(request.userId()),
            request.botName(),
            MarketDataController.normalize(request.baseAsset()),
            MarketDataController.normalize(request.quoteAsset()),
            request.stoplossAmount()
        );
        String message = String.format("Bot '%s' started on %s with $%.2f stoploss",
            status.botName(), status.tradingPair(), status.stoplossAmount());
        return ResponseEntity.ok(new BotActionResponse(true, message, status));
    }

    @Operation(summary = "Stop the user's bot")
    @PostMapping("/stop")
    public ResponseEntity<BotActionResponse> stop(@RequestParam(required = false) String userId) {
        BotStatus status = supervisor.stop(userOrDemo(userId));
        return ResponseEntity.ok(new BotActionResponse(true, "Bot '" + status.botName() + "' stopped", status));
    }

    @Operation(summary = "Get the user's bot status")
    @GetMapping("/status")
    public ResponseEntity<BotStatus> status(@RequestParam(required = false) String userId) {
        return ResponseEntity.ok(supervisor.status(userOrDemo(userId)));
    }

    private String userOrDemo(String userId) {
        return userId == null || userId.isBlank() ? properties.getDemoUserId() : userId;
    }
}
