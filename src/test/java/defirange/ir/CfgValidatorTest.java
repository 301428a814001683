package defirange.ir;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import defirange.MalformedCfgError;

import static org.junit.jupiter.api.Assertions.*;

public class CfgValidatorTest {

    private final Variable x = new Variable("x", "uint256", Variable.Kind.LOCAL);

    private Function function(Node... nodes) {
        Function function = new Function("f");
        new Contract("C").addFunction(function);
        Arrays.stream(nodes).forEach(function::addNode);
        return function;
    }

    @Test
    public void testValidGraph() {
        Node first = new Node(0);
        Node second = new Node(1);
        first.addSuccessor(second).add(new Instruction.Assignment(x, Constant.of(1)));
        second.addSuccessor(first);
        assertDoesNotThrow(() -> CfgValidator.validate(function(first, second)));
    }

    @Test
    public void testDuplicateIds() {
        MalformedCfgError error = assertThrows(MalformedCfgError.class,
                () -> CfgValidator.validate(function(new Node(3), new Node(3))));
        assertEquals("Malformed control flow graph of C.f: node id 3 is used twice", error.getMessage());
    }

    @Test
    public void testForeignSuccessor() {
        Node node = new Node(0).addSuccessor(new Node(1));
        assertThrows(MalformedCfgError.class, () -> CfgValidator.validate(function(node)));
    }

    @Test
    public void testMissingTarget() {
        Node node = new Node(0).add(new Instruction.Assignment(null, Constant.of(1)));
        assertThrows(MalformedCfgError.class, () -> CfgValidator.validate(function(node)));
    }

    @Test
    public void testMissingOperand() {
        Node node = new Node(0).add(new Instruction.BinaryOp(x, BinaryOperator.ADD, x, null));
        assertThrows(MalformedCfgError.class, () -> CfgValidator.validate(function(node)));
    }

    @Test
    public void testNullNodeAndInstruction() {
        assertThrows(MalformedCfgError.class, () -> CfgValidator.validate(function((Node) null)));
        assertThrows(MalformedCfgError.class, () -> CfgValidator.validate(function(new Node(0).add(null))));
    }
}
