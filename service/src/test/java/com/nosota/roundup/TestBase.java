package com.nosota.roundup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.provider.BasiqAuthArtifact;
import com.nosota.roundup.api.provider.BasiqTransaction;
import com.nosota.roundup.api.provider.PlaidAuthArtifact;
import com.nosota.roundup.api.provider.PlaidTransaction;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.api.request.CreateRoundUpConfigRequest;
import com.nosota.roundup.client.bank.BankAggregatorRegistry;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.fake.FakeBankAggregatorClient;
import com.nosota.roundup.fake.FakeCauseDirectoryClient;
import com.nosota.roundup.fake.FakePaymentProcessorClient;
import com.nosota.roundup.fake.MutableClock;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.DonationRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import com.nosota.roundup.repository.RoundUpTransactionRepository;
import com.nosota.roundup.service.BankConnectionService;
import com.nosota.roundup.service.RoundUpConfigService;
import com.nosota.roundup.service.RoundUpIngestionService;
import com.nosota.roundup.service.SettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@SpringBootTest(
        classes = RoundupApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Import(TestClientsConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {

    @Autowired
    protected BankConnectionService bankConnectionService;

    @Autowired
    protected RoundUpConfigService roundUpConfigService;

    @Autowired
    protected RoundUpIngestionService ingestionService;

    @Autowired
    protected SettlementService settlementService;

    @Autowired
    protected BankConnectionRepository bankConnectionRepository;

    @Autowired
    protected RoundUpConfigRepository roundUpConfigRepository;

    @Autowired
    protected RoundUpTransactionRepository roundUpTransactionRepository;

    @Autowired
    protected DonationRepository donationRepository;

    @Autowired
    protected BankAggregatorRegistry aggregatorRegistry;

    @Autowired
    protected FakePaymentProcessorClient paymentProcessor;

    @Autowired
    protected FakeCauseDirectoryClient causeDirectory;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    // Counter for generating unique user, organization and cause IDs in tests
    private static final AtomicLong idCounter = new AtomicLong(1000);

    @BeforeEach
    void resetCollaborators() {
        plaid().reset();
        basiq().reset();
        paymentProcessor.reset();
        causeDirectory.reset();
        clock.reset();
    }

    protected FakeBankAggregatorClient plaid() {
        return (FakeBankAggregatorClient) aggregatorRegistry.get(BankProvider.PLAID);
    }

    protected FakeBankAggregatorClient basiq() {
        return (FakeBankAggregatorClient) aggregatorRegistry.get(BankProvider.BASIQ);
    }

    protected static long nextId() {
        return idCounter.getAndIncrement();
    }

    protected static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    /**
     * Links a new Plaid account for a new user.
     */
    protected BankConnection linkPlaidAccount() throws Exception {
        String accountId = uniqueId("acc");
        plaid().addAccount(accountId);
        return bankConnectionService.linkBankAccount(nextId(), new PlaidAuthArtifact(uniqueId("public"), accountId));
    }

    /**
     * Links a new Basiq account for a new user.
     */
    protected BankConnection linkBasiqAccount() throws Exception {
        String accountId = uniqueId("acc");
        basiq().addAccount(accountId);
        return bankConnectionService.linkBankAccount(nextId(),
                new BasiqAuthArtifact(uniqueId("user"), uniqueId("conn"), accountId));
    }

    /**
     * Sets up round-ups on a connection, towards a freshly registered verified cause.
     */
    protected RoundUpConfig setupRoundUps(BankConnection connection, String threshold) throws Exception {
        return setupRoundUps(connection, threshold, false);
    }

    protected RoundUpConfig setupRoundUps(BankConnection connection, String threshold, boolean coverFees)
            throws Exception {
        long organizationId = nextId();
        long causeId = nextId();
        causeDirectory.addVerifiedCause(organizationId, causeId);
        return roundUpConfigService.createRoundUpConfig(new CreateRoundUpConfigRequest(
                connection.getUserId(),
                connection.getId(),
                organizationId,
                causeId,
                threshold != null ? new BigDecimal(threshold) : null,
                "pm_card_visa",
                coverFees,
                null
        ));
    }

    /**
     * Posted Plaid card purchase; Plaid reports outflows as positive amounts.
     */
    protected PlaidTransaction plaidPurchase(BankConnection connection, String amount) {
        return plaidPurchase(connection, uniqueId("txn"), amount);
    }

    protected PlaidTransaction plaidPurchase(BankConnection connection, String transactionId, String amount) {
        return new PlaidTransaction(
                transactionId,
                connection.getProviderAccountId(),
                new BigDecimal(amount),
                "USD",
                null,
                LocalDate.now(clock),
                "Blue Bottle Coffee",
                "Blue Bottle Coffee",
                List.of("Food and Drink", "Restaurants"),
                new PlaidTransaction.PersonalFinanceCategory("FOOD_AND_DRINK", "FOOD_AND_DRINK_COFFEE"),
                false,
                "place",
                "in store"
        );
    }

    /**
     * Posted Basiq card payment; Basiq reports outflows as negative amounts.
     */
    protected BasiqTransaction basiqPayment(BankConnection connection, String amount) {
        return new BasiqTransaction(
                uniqueId("txn"),
                connection.getProviderAccountId(),
                "posted",
                "WOOLWORTHS 1234 SYDNEY",
                amount,
                "AUD",
                "debit",
                "payment",
                new BasiqTransaction.SubClass("Supermarket and Grocery Stores", "411"),
                LocalDate.now(clock) + "T00:00:00Z",
                null
        );
    }

    protected IngestionSummary ingest(BankConnection connection, ProviderTransaction... transactions) throws Exception {
        return ingestionService.ingestProviderTransactions(connection.getId(), List.of(transactions));
    }

    protected RoundUpConfig reload(RoundUpConfig config) {
        return roundUpConfigRepository.findById(config.getId()).orElseThrow();
    }

    protected BankConnection reload(BankConnection connection) {
        return bankConnectionRepository.findById(connection.getId()).orElseThrow();
    }
}
