package com.nosota.roundup.client.bank;

import com.nosota.roundup.api.model.BankProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the aggregator client for a provider.
 */
@Component
public class BankAggregatorRegistry {

    private final Map<BankProvider, BankAggregatorClient> clients = new EnumMap<>(BankProvider.class);

    public BankAggregatorRegistry(List<BankAggregatorClient> clients) {
        for (BankAggregatorClient client : clients) {
            BankAggregatorClient previous = this.clients.put(client.provider(), client);
            if (previous != null) {
                throw new IllegalStateException("Duplicate aggregator client for " + client.provider());
            }
        }
    }

    public BankAggregatorClient get(BankProvider provider) {
        BankAggregatorClient client = clients.get(provider);
        if (client == null) {
            throw new IllegalStateException("No aggregator client configured for " + provider);
        }
        return client;
    }
}
