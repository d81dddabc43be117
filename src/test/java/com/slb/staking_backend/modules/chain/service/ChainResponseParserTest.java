package com.slb.staking_backend.modules.chain.service;

import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChainResponseParserTest {

    private final ChainResponseParser parser = new ChainResponseParser();

    @Test
    void success_withTxHash() {
        ChainCallResult result = parser.parse("{\"success\":true,\"txHash\":\"0xabc\",\"error\":null}");

        assertTrue(result.success());
        assertEquals("0xabc", result.txHash());
        assertNull(result.error());
    }

    @Test
    void reportedFailure_keepsGatewayError() {
        ChainCallResult result = parser.parse("{\"success\":false,\"error\":\"execution reverted\"}");

        assertFalse(result.success());
        assertEquals("execution reverted", result.error());
    }

    @Test
    void missingOrNonBooleanSuccess_isFailure() {
        assertFalse(parser.parse("{\"txHash\":\"0xabc\"}").success());
        assertFalse(parser.parse("{\"success\":\"true\"}").success());
        assertFalse(parser.parse("[1,2,3]").success());
    }

    @Test
    void emptyOrMalformedBody_isFailure() {
        assertEquals("empty gateway response", parser.parse("").error());
        assertEquals("empty gateway response", parser.parse(null).error());
        assertFalse(parser.parse("{not json").success());
    }

    @Test
    void transfer_foundAndSuccessful() {
        Optional<IncomingTransfer> transfer = parser.parseTransfer("{\"found\":true,\"txHash\":\"0xaa\","
                + "\"from\":\"0x11\",\"to\":\"0xdd\",\"valueWei\":\"32000000000000000000\","
                + "\"confirmations\":14,\"status\":\"SUCCESS\"}");

        assertTrue(transfer.isPresent());
        assertEquals(new BigInteger("32000000000000000000"), transfer.get().valueWei());
        assertEquals(14L, transfer.get().confirmations());
        assertTrue(transfer.get().success());
    }

    @Test
    void transfer_revertedStatusIsNotSuccess() {
        Optional<IncomingTransfer> transfer = parser.parseTransfer("{\"txHash\":\"0xaa\",\"from\":\"0x11\","
                + "\"to\":\"0xdd\",\"valueWei\":\"1\",\"confirmations\":3,\"status\":\"REVERTED\"}");

        assertFalse(transfer.orElseThrow().success());
    }

    @Test
    void transfer_notFound() {
        assertTrue(parser.parseTransfer("{\"found\":false}").isEmpty());
    }

    @Test
    void transfer_incompleteOrMalformed_throws() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseTransfer("{\"found\":true,\"txHash\":\"0xaa\"}"));
        assertThrows(IllegalArgumentException.class, () -> parser.parseTransfer(""));
    }
}
