package defirange.typing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticTypeTest {

    @ParameterizedTest
    @CsvSource({"uint8,UNSIGNED,8", "uint,UNSIGNED,256", "int,SIGNED,256", "int64,SIGNED,64", "UINT256,UNSIGNED,256"})
    public void testIntegers(String name, SemanticType.Kind kind, int width) {
        SemanticType type = SemanticType.parse(name);
        assertEquals(kind, type.kind);
        assertEquals(width, type.width);
        assertTrue(type.isInteger());
    }

    @Test
    public void testAddressAndBool() {
        assertEquals(SemanticType.ADDRESS, SemanticType.parse("address"));
        assertEquals(SemanticType.ADDRESS, SemanticType.parse("address payable"));
        assertEquals(SemanticType.BOOL, SemanticType.parse("bool"));
        assertTrue(SemanticType.BOOL.isNumeric());
        assertFalse(SemanticType.BOOL.isInteger());
    }

    @ParameterizedTest
    @ValueSource(strings = {"IERC20", "string", "uint0", "uint512", "uint99999999999", "mapping(address => uint256)", "bytes32"})
    public void testOther(String name) {
        SemanticType type = SemanticType.parse(name);
        assertEquals(SemanticType.Kind.OTHER, type.kind);
        assertEquals(name, type.name);
        assertFalse(type.isNumeric());
    }

    @Test
    public void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> SemanticType.unsigned(0));
        assertThrows(IllegalArgumentException.class, () -> SemanticType.signed(257));
    }

    @Test
    public void testEquality() {
        assertEquals(SemanticType.unsigned(256), SemanticType.UINT256);
        assertNotEquals(SemanticType.unsigned(8), SemanticType.signed(8));
    }
}
