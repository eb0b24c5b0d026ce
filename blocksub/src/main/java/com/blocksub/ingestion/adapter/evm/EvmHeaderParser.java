package com.blocksub.ingestion.adapter.evm;

import com.blocksub.domain.BlockHeader;
import com.blocksub.ingestion.adapter.RpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

/**
 * Maps EVM JSON-RPC header objects (eth_getBlockByNumber result, newHeads notification) to {@link BlockHeader}.
 */
@RequiredArgsConstructor
public class EvmHeaderParser {

    private final ObjectMapper objectMapper;

    public JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Invalid JSON-RPC payload", e);
        }
    }

    /**
     * Unwraps a JSON-RPC response and parses its header result.
     *
     * @throws RpcException on JSON-RPC error, null result or malformed header
     */
    public BlockHeader parseResponse(String json, String method) {
        if (json == null) {
            throw new RpcException(method + " returned null");
        }
        JsonNode root = readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return parseHeader(result);
    }

    public BlockHeader parseHeader(JsonNode header) {
        String hash = header.path("hash").asText(null);
        if (hash == null || !hash.startsWith("0x")) {
            throw new RpcException("Header without valid hash: " + header);
        }
        long number = parseQuantity(header.path("number").asText(null), "number");
        String parentHash = header.path("parentHash").asText(null);
        JsonNode ts = header.path("timestamp");
        long timestamp = ts.isMissingNode() || ts.isNull() ? 0L : parseQuantity(ts.asText(null), "timestamp");
        return new BlockHeader(number, hash, parentHash, timestamp, header);
    }

    /** Hex quantity ("0x1b4") as unsigned 64-bit value. */
    static long parseQuantity(String value, String field) {
        if (value == null || !value.startsWith("0x") || value.length() < 3) {
            throw new RpcException("Invalid " + field + ": " + value);
        }
        try {
            return Long.parseUnsignedLong(value.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid " + field + ": " + value, e);
        }
    }
}
