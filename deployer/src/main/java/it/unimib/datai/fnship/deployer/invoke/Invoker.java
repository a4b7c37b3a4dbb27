package it.unimib.datai.fnship.deployer.invoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import it.unimib.datai.fnship.deployer.compute.ComputeService;
import it.unimib.datai.fnship.deployer.compute.FunctionNames;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;
import it.unimib.datai.fnship.deployer.error.MalformedResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a JSON payload to a function and decodes the JSON it returns.
 */
public class Invoker {
    private static final Logger log = LoggerFactory.getLogger(Invoker.class);
    static final String OPERATION = "invoke";

    private final ComputeService compute;
    private final ObjectMapper mapper;
    private final ObjectReader responseReader;

    public Invoker(ComputeService compute, ObjectMapper mapper) {
        this.compute = compute;
        this.mapper = mapper;
        this.responseReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * A function that returns no bytes yields an empty JSON object. A {@code null} payload is sent as {@code {}}.
     * Anything after the first JSON value in the response makes it malformed.
     */
    public CompletableFuture<JsonNode> invoke(String name, Object payload) {
        byte[] body;
        try {
            FunctionNames.require(name);
            body = encode(payload);
        } catch (InvalidInputException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<JsonNode> result = FunctionErrors.guard(() -> compute.invokeResource(name, body))
                .thenApply(response -> decode(name, response));
        return FunctionErrors.wrapFailures(result, OPERATION, name);
    }

    private byte[] encode(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload == null ? mapper.createObjectNode() : payload);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Payload cannot be serialized to JSON", e);
        }
    }

    private JsonNode decode(String name, byte[] response) {
        if (response == null || response.length == 0) {
            log.debug("Function {} returned an empty response", name);
            return mapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = responseReader.readTree(response);
        } catch (IOException e) {
            throw new MalformedResponseException(name, e);
        }
        return node == null || node.isMissingNode() ? mapper.createObjectNode() : node;
    }
}
