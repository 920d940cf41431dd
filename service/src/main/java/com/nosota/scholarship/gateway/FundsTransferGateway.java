package com.nosota.scholarship.gateway;

/**
 * External funds transfer (DBT) boundary.
 *
 * <p>Implementations report every problem as a failed {@link TransferOutcome} instead of
 * throwing, and never retry on their own.
 */
public interface FundsTransferGateway {

    TransferOutcome transfer(TransferInstruction instruction);
}
