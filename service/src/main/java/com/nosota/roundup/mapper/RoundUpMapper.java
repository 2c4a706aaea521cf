package com.nosota.roundup.mapper;

import com.nosota.roundup.api.response.BankConnectionResponse;
import com.nosota.roundup.api.response.DonationResponse;
import com.nosota.roundup.api.response.RoundUpConfigResponse;
import com.nosota.roundup.api.response.RoundUpTransactionResponse;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.Donation;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.model.RoundUpTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from round-up entities to API responses.
 */
@Mapper
public interface RoundUpMapper {

    RoundUpMapper INSTANCE = Mappers.getMapper(RoundUpMapper.class);

    BankConnectionResponse toResponse(BankConnection connection);

    RoundUpConfigResponse toResponse(RoundUpConfig config);

    DonationResponse toResponse(Donation donation);

    RoundUpTransactionResponse toResponse(RoundUpTransaction transaction);

    List<RoundUpConfigResponse> toConfigResponses(List<RoundUpConfig> configs);

    List<DonationResponse> toDonationResponses(List<Donation> donations);

    List<RoundUpTransactionResponse> toTransactionResponses(List<RoundUpTransaction> transactions);
}
