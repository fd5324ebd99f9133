package com.chainpulse.common.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One contract to aggregate over: the chain it lives on and its address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractInput {
	
	@NotBlank(message = "chain is required")
	private String chain;
	
	@NotBlank(message = "address is required")
	private String address;
}
