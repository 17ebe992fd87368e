package org.contractquard.analyzer.transform.solidity;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.contractquard.analyzer.ir.info.IRModule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;

public class CommonTest {
    protected static final ObjectMapper MAPPER = new ObjectMapper();
    protected SolidityTransformer transformer;

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(SolidityTransformer.class)).setLevel(Level.DEBUG);
    }

    @BeforeEach
    public void beforeEach() {
        transformer = new SolidityTransformer();
    }

    protected static JsonNode json(String input) {
        try {
            return MAPPER.readTree(input);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    protected IRModule transform(String input) {
        return transformer.transform(json(input), "Vault.sol");
    }
}
