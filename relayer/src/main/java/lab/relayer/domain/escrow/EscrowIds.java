package lab.relayer.domain.escrow;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Hashing helpers shared by the ledger and off-chain observers.
 * <p>
 * Escrow ids are keccak256 over the packed semantic fields only, so anyone holding the order
 * parameters can recompute the id of either leg.
 */
public final class EscrowIds {

    public static final String NATIVE_ASSET = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final Pattern HASH_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{64}$");

    private EscrowIds() {
    }

    public static String derive(
            String sender,
            String receiver,
            String asset,
            BigInteger amount,
            String secretHash,
            Instant timelock,
            String orderId
    ) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.writeBytes(Numeric.hexStringToByteArray(sender));
        packed.writeBytes(Numeric.hexStringToByteArray(receiver));
        packed.writeBytes(Numeric.hexStringToByteArray(asset));
        packed.writeBytes(Numeric.toBytesPadded(amount, 32));
        packed.writeBytes(Numeric.hexStringToByteArray(secretHash));
        packed.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(timelock.getEpochSecond()), 32));
        packed.writeBytes(orderId.getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexString(Hash.sha3(packed.toByteArray()));
    }

    public static String hashSecret(String secret) {
        return Hash.sha3String(secret);
    }

    public static boolean secretMatches(String secret, String secretHash) {
        return secret != null && secretHash != null && hashSecret(secret).equalsIgnoreCase(secretHash);
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    public static boolean isValidHash(String hash) {
        return hash != null && HASH_PATTERN.matcher(hash).matches();
    }

    public static boolean isZeroAddress(String address) {
        return NATIVE_ASSET.equalsIgnoreCase(address);
    }
}
