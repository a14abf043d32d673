package com.fintech.papertrading.cucumber;

import com.fintech.papertrading.bot.BotException;
import com.fintech.papertrading.bot.BotSupervisor;
import com.fintech.papertrading.domain.Account;
import com.fintech.papertrading.domain.PriceTick;
import com.fintech.papertrading.domain.TradeSide;
import com.fintech.papertrading.ledger.LedgerService;
import com.fintech.papertrading.ledger.TradeException;
import com.fintech.papertrading.state.TradingState;
import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.within;

/**
 * Cucumber step definitions for paper trading scenarios.
 *
 * Runs against the full Spring context with live ingestion disabled; prices are
 * injected directly into the trading state. Bots tick every 100ms so stoploss
 * scenarios finish quickly.
 */
@CucumberContextConfiguration
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = "trading.bot.tick-interval=100ms"
)
@ActiveProfiles("test")
public class PaperTradingSteps {

    @Autowired
    private LedgerService ledger;

    @Autowired
    private BotSupervisor supervisor;

    @Autowired
    private TradingState state;

    private String userId;
    private Throwable lastFailure;

    @Before
    public void setUp() {
        userId = "cuke_" + UUID.randomUUID().toString().substring(0, 8);
        lastFailure = null;
    }

    @After
    public void tearDown() {
        if (supervisor.status(userId).active()) {
            supervisor.stop(userId);
        }
    }

    // ================ Background Steps ================

    @Given("the paper trading service is running")
    public void thePaperTradingServiceIsRunning() {
        assertThat(ledger).isNotNull();
        assertThat(supervisor).isNotNull();
        assertThat(ledger.account("demo_user")).isPresent();
    }

    @Given("I have a fresh account")
    public void iHaveAFreshAccount() {
        Account account = ledger.openAccount(userId, "Cucumber");
        assertThat(account.balance("USD")).isEqualTo(10_000.0);
    }

    // ================ Market Steps ================

    @Given("the {string} price is {double}")
    public void thePriceIs(String asset, double price) {
        state.ingest(new PriceTick(System.currentTimeMillis(), asset, price));
    }

    // ================ Ledger Steps ================

    @When("I buy {double} {string} with {string}")
    public void iBuy(double quantity, String base, String quote) {
        ledger.executeTrade(userId, base, quote, TradeSide.BUY, quantity);
    }

    @When("I sell {double} {string} for {string}")
    public void iSell(double quantity, String base, String quote) {
        ledger.executeTrade(userId, base, quote, TradeSide.SELL, quantity);
    }

    @When("I try to sell {double} {string} for {string}")
    public void iTryToSell(double quantity, String base, String quote) {
        lastFailure = catchThrowable(() -> ledger.executeTrade(userId, base, quote, TradeSide.SELL, quantity));
    }

    @When("I try to deposit {double}")
    public void iTryToDeposit(double amount) {
        lastFailure = catchThrowable(() -> ledger.deposit(userId, amount));
    }

    @Then("the request should be rejected with {string}")
    public void theRequestShouldBeRejectedWith(String error) {
        assertThat(lastFailure).isInstanceOf(TradeException.class);
        assertThat(((TradeException) lastFailure).getError().name()).isEqualTo(error);
    }

    @Then("my {string} balance should be {double}")
    public void myBalanceShouldBe(String asset, double expected) {
        assertThat(account().balance(asset)).isCloseTo(expected, within(1e-9));
    }

    @Then("my portfolio should be worth {double}")
    public void myPortfolioShouldBeWorth(double expected) {
        assertThat(ledger.portfolioValue(userId).orElseThrow()).isCloseTo(expected, within(1e-6));
    }

    @Then("my history should contain {int} transaction(s)")
    public void myHistoryShouldContain(int count) {
        assertThat(account().getHistory()).hasSize(count);
    }

    // ================ Bot Steps ================

    @Given("I start the {string} bot on {string} against {string} with a stoploss of {double}")
    public void iStartTheBot(String botName, String base, String quote, double stoploss) {
        assertThat(supervisor.start(userId, botName, base, quote, stoploss).active()).isTrue();
    }

    @When("I try to start the {string} bot on {string} against {string} with a stoploss of {double}")
    public void iTryToStartTheBot(String botName, String base, String quote, double stoploss) {
        lastFailure = catchThrowable(() -> supervisor.start(userId, botName, base, quote, stoploss));
    }

    @Then("the bot request should be rejected with {string}")
    public void theBotRequestShouldBeRejectedWith(String reason) {
        assertThat(lastFailure).isInstanceOf(BotException.class);
        assertThat(((BotException) lastFailure).getReason().name()).isEqualTo(reason);
    }

    @When("I stop my bot")
    public void iStopMyBot() {
        supervisor.stop(userId);
    }

    @Then("my bot should not be active")
    public void myBotShouldNotBeActive() {
        assertThat(supervisor.status(userId).active()).isFalse();
    }

    @Then("my bot should stop within {int} seconds")
    public void myBotShouldStopWithin(int seconds) {
        long deadline = System.currentTimeMillis() + seconds * 1000L;
        while (supervisor.status(userId).active() && System.currentTimeMillis() < deadline) {
            sleep(50);
        }
        assertThat(supervisor.status(userId).active()).isFalse();
    }

    @Then("starting the {string} bot again should succeed")
    public void startingTheBotAgainShouldSucceed(String botName) {
        assertThat(supervisor.start(userId, botName, "BTC", "USD", 10_000.0).active()).isTrue();
    }

    private Account account() {
        return ledger.account(userId).orElseThrow();
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
