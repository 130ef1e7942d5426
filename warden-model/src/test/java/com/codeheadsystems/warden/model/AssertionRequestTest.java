package com.codeheadsystems.warden.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class AssertionRequestTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void clientData_decodesBase64() {
    String encoded = Base64.getEncoder().encodeToString("GET /profile".getBytes(StandardCharsets.UTF_8));
    AssertionRequest req = new AssertionRequest("YXNzZXJ0aW9u", encoded, "key-1");

    assertThat(new String(req.clientData(), StandardCharsets.UTF_8)).isEqualTo("GET /profile");
  }

  @Test
  void clientData_null_throwsIAE() {
    AssertionRequest req = new AssertionRequest("YXNzZXJ0aW9u", null, "key-1");
    assertThatThrownBy(req::clientData)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required field");
  }

  @Test
  void clientData_invalidBase64_throwsIAE() {
    AssertionRequest req = new AssertionRequest("YXNzZXJ0aW9u", "not!valid!base64!", "key-1");
    assertThatThrownBy(req::clientData)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid base64");
  }

  @Test
  void json_usesWireFieldNames() throws Exception {
    String json = "{\"assertion\":\"YQ==\",\"clientData\":\"Yg==\",\"keyId\":\"key-1\"}";

    AssertionRequest req = mapper.readValue(json, AssertionRequest.class);

    assertThat(req.assertion()).isEqualTo("YQ==");
    assertThat(req.clientDataBase64()).isEqualTo("Yg==");
    assertThat(req.keyId()).isEqualTo("key-1");
  }
}
