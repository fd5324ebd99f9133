package com.chainpulse.common.validation;

import com.chainpulse.common.dto.AnalyticsRequest;
import com.chainpulse.common.dto.ContractInput;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Cross-field checks that Bean Validation annotations cannot express.
 * Runs before normalization; anything rejected here never reaches the cache or the queue.
 */
@Component
@Slf4j
public class AnalyticsRequestValidator {

	public static final int MAX_CONTRACTS = 500;

	/**
	 * Validates and returns a descriptive message if invalid.
	 *
	 * @param request the request to validate
	 * @return validation error message or null if valid
	 */
	public String validate(AnalyticsRequest request) {
		if (request == null) {
			return "Request body cannot be null";
		}
		if (request.getContracts() == null || request.getContracts().isEmpty()) {
			return "contracts must contain at least one entry";
		}
		if (request.getContracts().size() > MAX_CONTRACTS) {
			return String.format("contracts must not exceed %d entries", MAX_CONTRACTS);
		}
		for (ContractInput contract : request.getContracts()) {
			if (contract == null || StringUtils.isBlank(contract.getChain()) || StringUtils.isBlank(contract.getAddress())) {
				return "every contract needs a chain and an address";
			}
		}
		if (request.getStartTimestamp() == null || request.getStartTimestamp() <= 0) {
			return "startTimestamp must be a positive number of seconds";
		}
		if (request.getEndTimestamp() == null || request.getEndTimestamp() <= 0) {
			return "endTimestamp must be a positive number of seconds";
		}
		if (request.getEndTimestamp() < request.getStartTimestamp()) {
			return "endTimestamp must not be before startTimestamp";
		}
		return null; // Valid
	}

	/**
	 * @throws IllegalArgumentException with the first violation found
	 */
	public void validateInput(AnalyticsRequest request) {
		String violation = validate(request);
		if (violation != null) {
			log.debug("Rejected analytics request: {}", violation);
			throw new IllegalArgumentException(violation);
		}
	}
}
