package com.nosota.roundup;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.fake.FakeBankAggregatorClient;
import com.nosota.roundup.fake.FakeCauseDirectoryClient;
import com.nosota.roundup.fake.FakePaymentProcessorClient;
import com.nosota.roundup.fake.MutableClock;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * In-memory stand-ins for the external collaborators; the HTTP clients are switched off in the test profile.
 */
@TestConfiguration
public class TestClientsConfig {

    @Bean
    public FakeBankAggregatorClient fakePlaidAggregator() {
        return new FakeBankAggregatorClient(BankProvider.PLAID);
    }

    @Bean
    public FakeBankAggregatorClient fakeBasiqAggregator() {
        return new FakeBankAggregatorClient(BankProvider.BASIQ);
    }

    @Bean
    public FakePaymentProcessorClient fakePaymentProcessor() {
        return new FakePaymentProcessorClient();
    }

    @Bean
    public FakeCauseDirectoryClient fakeCauseDirectory() {
        return new FakeCauseDirectoryClient();
    }

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock();
    }
}
