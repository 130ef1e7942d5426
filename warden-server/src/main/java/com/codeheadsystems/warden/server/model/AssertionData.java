package com.codeheadsystems.warden.server.model;

/**
 * Evidence submitted with a request made by an already attested device key.
 *
 * @param assertion  the assertion, base64 encoded as received
 * @param clientData request-bound data the assertion signs
 * @param keyId      the registered key identifier
 */
public record AssertionData(String assertion, byte[] clientData, String keyId) {
}
