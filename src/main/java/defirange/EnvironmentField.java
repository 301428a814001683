package defirange;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import defirange.intervals.Interval;
import defirange.intervals.Intervals;

import static defirange.intervals.Intervals.powerOfTen;
import static defirange.intervals.Intervals.powerOfTwo;

/**
 * Pseudo fields of the execution environment with their canonical intervals
 */
public enum EnvironmentField {
    /**
     * Wei sent with the call
     */
    MSG_VALUE("msg", "value", Intervals.UINT256),
    /**
     * Seconds since the epoch, bounded by the start of the year 2100
     */
    BLOCK_TIMESTAMP("block", "timestamp", Interval.of(0, 4102444800L)),
    BLOCK_NUMBER("block", "number", Interval.of(BigInteger.ZERO, powerOfTwo(64).subtract(BigInteger.ONE))),
    BLOCK_GAS_LIMIT("block", "gaslimit", Interval.of(BigInteger.ZERO, powerOfTwo(64).subtract(BigInteger.ONE))),
    BLOCK_CHAIN_ID("block", "chainid", Interval.of(BigInteger.ZERO, powerOfTwo(64).subtract(BigInteger.ONE))),
    /**
     * At most one ether per gas
     */
    BLOCK_BASE_FEE("block", "basefee", Interval.of(BigInteger.ZERO, powerOfTen(18))),
    TX_GAS_PRICE("tx", "gasprice", Interval.of(BigInteger.ZERO, powerOfTen(18))),
    /**
     * Balance of any address
     */
    BALANCE(null, "balance", Intervals.UINT256);

    /**
     * null matches every base
     */
    private final String base;
    private final String member;
    public final Interval interval;

    EnvironmentField(String base, String member, Interval interval) {
        this.base = base;
        this.member = member;
        this.interval = interval;
    }

    public static Optional<EnvironmentField> lookup(String base, String member) {
        String b = base.toLowerCase(Locale.ROOT);
        String m = member.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> (f.base == null || f.base.equals(b)) && f.member.equals(m)).findFirst();
    }

    @Override
    public String toString() {
        return (base == null ? "<address>" : base) + "." + member;
    }
}
