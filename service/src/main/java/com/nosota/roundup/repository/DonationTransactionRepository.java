package com.nosota.roundup.repository;

import com.nosota.roundup.model.DonationTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DonationTransactionRepository extends JpaRepository<DonationTransaction, Long> {

    List<DonationTransaction> findByDonationId(UUID donationId);
}
