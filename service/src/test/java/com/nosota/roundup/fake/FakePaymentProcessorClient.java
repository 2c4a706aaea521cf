package com.nosota.roundup.fake;

import com.nosota.roundup.client.payment.ChargeRequest;
import com.nosota.roundup.client.payment.ChargeResult;
import com.nosota.roundup.client.payment.ChargeStatus;
import com.nosota.roundup.client.payment.PaymentProcessorClient;
import com.nosota.roundup.error.ProcessorException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory payment processor. Accepted charges stay PROCESSING until a confirmation is sent.
 */
public class FakePaymentProcessorClient implements PaymentProcessorClient {

    public enum Mode {
        ACCEPT,
        DECLINE,
        REJECT,
        TIMEOUT
    }

    private final List<ChargeRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, ChargeResult> chargesByDonation = new ConcurrentHashMap<>();
    private volatile Mode mode = Mode.ACCEPT;

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public List<ChargeRequest> getRequests() {
        return requests;
    }

    /**
     * Makes a charge visible to lookups by donation id, as if it had been created before a timeout.
     */
    public void putCharge(String donationId, ChargeResult charge) {
        chargesByDonation.put(donationId, charge);
    }

    public void reset() {
        requests.clear();
        chargesByDonation.clear();
        mode = Mode.ACCEPT;
    }

    @Override
    public ChargeResult createCharge(ChargeRequest request) throws ProcessorException {
        requests.add(request);
        String donationId = request.metadata().get("donationId");
        String chargeId = "pi_" + request.idempotencyKey().hashCode();

        switch (mode) {
            case DECLINE -> {
                ChargeResult declined = new ChargeResult(chargeId, ChargeStatus.FAILED, "Your card was declined.");
                chargesByDonation.put(donationId, declined);
                return declined;
            }
            case REJECT -> throw new ProcessorException("No such payment method", false);
            case TIMEOUT -> throw new ProcessorException("Payment processor did not answer in time", true);
            default -> {
                ChargeResult accepted = new ChargeResult(chargeId, ChargeStatus.PROCESSING, null);
                chargesByDonation.put(donationId, accepted);
                return accepted;
            }
        }
    }

    @Override
    public Optional<ChargeResult> findChargeByDonationId(String donationId) {
        return Optional.ofNullable(chargesByDonation.get(donationId));
    }
}
