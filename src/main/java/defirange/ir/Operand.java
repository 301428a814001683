package defirange.ir;

/**
 * Operand of an instruction or a branch condition, either a {@link Variable} or a {@link Constant}
 */
public interface Operand {

    /**
     * Textual form used in messages
     */
    String text();
}
