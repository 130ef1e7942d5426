package com.codeheadsystems.warden.server.verifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlayIntegrityAccessorTest {

  private static final String PACKAGE = "com.example.app";
  private static final String RESPONSE_JSON = """
      {
        "tokenPayloadExternal": {
          "requestDetails": {
            "requestPackageName": "com.example.app",
            "nonce": "bm9uY2U",
            "timestampMillis": "1767268800000"
          },
          "appIntegrity": {
            "appRecognitionVerdict": "PLAY_RECOGNIZED",
            "packageName": "com.example.app",
            "certificateSha256Digest": ["c2hhMjU2"],
            "versionCode": "42"
          },
          "deviceIntegrity": {
            "deviceRecognitionVerdict": ["MEETS_DEVICE_INTEGRITY"]
          },
          "accountDetails": {
            "appLicensingVerdict": "LICENSED"
          },
          "environmentDetails": {
            "playProtectVerdict": "NO_ISSUES"
          }
        }
      }
      """;

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private PlayIntegrityAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new PlayIntegrityAccessor(httpClient, new ObjectMapper(), PlayIntegrityAccessor.DEFAULT_ENDPOINT,
        () -> "access-token", Duration.ofSeconds(5));
  }

  @Test
  void decodeUri_appendsPackageAndMethod() {
    assertThat(accessor.decodeUri(PACKAGE))
        .isEqualTo(URI.create("https://playintegrity.googleapis.com/v1/com.example.app:decodeIntegrityToken"));
  }

  @Test
  void decodeUri_endpointWithoutTrailingSlash() {
    PlayIntegrityAccessor custom = new PlayIntegrityAccessor(httpClient, new ObjectMapper(),
        URI.create("http://localhost:9999/v1"), () -> "access-token", Duration.ofSeconds(5));

    assertThat(custom.decodeUri(PACKAGE))
        .isEqualTo(URI.create("http://localhost:9999/v1/com.example.app:decodeIntegrityToken"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void decode_success_parsesVerdictAndSendsBearerToken() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn(RESPONSE_JSON);

    PlayIntegrityVerdict verdict = accessor.decode(PACKAGE, "integrity-token");

    assertThat(verdict.tokenPayloadExternal().requestDetails().nonce()).isEqualTo("bm9uY2U");
    assertThat(verdict.tokenPayloadExternal().requestDetails().timestampMillis()).isEqualTo(1_767_268_800_000L);
    assertThat(verdict.tokenPayloadExternal().appIntegrity().appRecognitionVerdict()).isEqualTo("PLAY_RECOGNIZED");
    assertThat(verdict.tokenPayloadExternal().deviceIntegrity().deviceRecognitionVerdict())
        .containsExactly("MEETS_DEVICE_INTEGRITY");

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), any(HttpResponse.BodyHandler.class));
    assertThat(request.getValue().method()).isEqualTo("POST");
    assertThat(request.getValue().uri()).isEqualTo(accessor.decodeUri(PACKAGE));
    assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer access-token");
  }

  @Test
  @SuppressWarnings("unchecked")
  void decode_errorStatus_throwsAccessorException() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
    when(httpResponse.statusCode()).thenReturn(403);

    assertThatThrownBy(() -> accessor.decode(PACKAGE, "integrity-token"))
        .isInstanceOf(PlayIntegrityAccessorException.class)
        .hasMessageContaining("403")
        .hasMessageContaining(PACKAGE);
  }

  @Test
  @SuppressWarnings("unchecked")
  void decode_ioException_throwsAccessorException() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new IOException("network error"));

    assertThatThrownBy(() -> accessor.decode(PACKAGE, "integrity-token"))
        .isInstanceOf(PlayIntegrityAccessorException.class)
        .hasMessageContaining(PACKAGE)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void decode_interruptedException_throwsAccessorException() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new InterruptedException("interrupted"));

    assertThatThrownBy(() -> accessor.decode(PACKAGE, "integrity-token"))
        .isInstanceOf(PlayIntegrityAccessorException.class)
        .hasCauseInstanceOf(InterruptedException.class);

    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    Thread.interrupted();
  }
}
