package com.fintech.papertrading.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI paperTradingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Paper Trading Service API")
                        .description("""
                                Paper trading against live crypto prices.

                                **Features:**
                                - Spot price, price history, 1m/5m candles
                                - SMA/EMA/RSI indicators over the last hour
                                - Multi-asset portfolio, trades, deposits and withdrawals
                                - Autonomous trading bots with a hard stoploss

                                No authentication: requests name the user id and default to the demo user.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
