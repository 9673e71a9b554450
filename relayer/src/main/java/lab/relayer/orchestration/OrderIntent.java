package lab.relayer.orchestration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * A maker's swap intent, registered before the source leg is locked.
 * Durations are capped at seven days, the longest timelock an escrow ledger accepts.
 */
public record OrderIntent(
        @NotBlank String orderId,
        @NotBlank @Pattern(regexp = "^0x[a-fA-F0-9]{40}$") String maker,
        @NotBlank @Pattern(regexp = "^0x[a-fA-F0-9]{40}$") String receiver,
        @NotBlank String srcChain,
        @NotBlank String destChain,
        @NotBlank @Pattern(regexp = "^0x[a-fA-F0-9]{40}$") String srcAsset,
        @NotBlank @Pattern(regexp = "^0x[a-fA-F0-9]{40}$") String destAsset,
        @NotNull @Positive BigInteger srcAmount,
        @NotNull @Positive BigInteger destAmount,
        @NotBlank @Pattern(regexp = "^0x[a-fA-F0-9]{64}$") String secretHash,
        @Positive @Max(604_800) long timelockSeconds,
        @Positive @Max(604_800) long auctionDurationSeconds,
        @NotNull @Positive BigInteger startRate,
        @NotNull @Positive BigInteger endRate
) {}
