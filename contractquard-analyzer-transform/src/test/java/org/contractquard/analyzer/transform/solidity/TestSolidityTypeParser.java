package org.contractquard.analyzer.transform.solidity;

import org.contractquard.analyzer.ir.type.IRType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestSolidityTypeParser {
    private final SolidityTypeParser parser = new SolidityTypeParser();

    @Test
    public void testPrimitives() {
        for (String s : new String[]{"uint256", "int8", "uint", "bool", "address", "address payable", "string",
                "bytes", "bytes32"}) {
            IRType type = parser.parse(s);
            assertTrue(type.primitive(), s);
            assertEquals(s, type.name());
        }
        assertEquals("string", parser.parse("string memory").name());
        assertEquals("int_const", parser.parse("int_const 100").name());
        assertEquals("string", parser.parse("literal_string \"abc\"").name());
        assertSame(IRType.UNKNOWN, parser.parse(null));
        assertEquals("unknown", parser.parse("  ").name());
    }

    @Test
    public void testArrays() {
        IRType dynamic = parser.parse("uint256[] storage ref");
        assertTrue(dynamic.array());
        assertNull(dynamic.arraySize());
        assertEquals("uint256", dynamic.elementType().name());

        IRType fixed = parser.parse("address[4] memory");
        assertEquals(4, fixed.arraySize());
        assertEquals("address[4]", fixed.toString());

        IRType nested = parser.parse("uint8[][3]");
        assertEquals(3, nested.arraySize());
        assertTrue(nested.elementType().array());
        assertNull(nested.elementType().arraySize());

        IRType symbolic = parser.parse("uint256[N]");
        assertTrue(symbolic.array());
        assertNull(symbolic.arraySize());
    }

    @Test
    public void testMappings() {
        IRType nested = parser.parse("mapping(address => mapping(address => uint256))");
        assertTrue(nested.mapping());
        assertEquals("address", nested.keyType().name());
        assertTrue(nested.valueType().mapping());
        assertEquals("uint256", nested.valueType().valueType().name());

        IRType ofArrays = parser.parse("mapping(uint256 => struct Vault.Deposit[])");
        assertTrue(ofArrays.valueType().array());
        IRType deposit = ofArrays.valueType().elementType();
        assertTrue(deposit.struct());
        assertEquals("Vault.Deposit", deposit.name());

        IRType arrayOfMappings = parser.parse("mapping(address => bool)[]");
        assertTrue(arrayOfMappings.array());
        assertTrue(arrayOfMappings.elementType().mapping());
    }

    @Test
    public void testNamed() {
        assertTrue(parser.parse("contract IERC20").struct());
        assertEquals("IERC20", parser.parse("contract IERC20").name());
        assertTrue(parser.parse("enum Vault.State").struct());
        IRType function = parser.parse("function (uint256) external returns (bool)");
        assertFalse(function.primitive());
        assertFalse(function.array());
        assertEquals("function (uint256) external returns (bool)", function.name());
    }
}
