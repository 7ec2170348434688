/*
 * どこで: Auth-Gateway state 層
 * 何を: ログイン state(returnTo と任意の呼び出し元データ)を base64url(JSON) 文字列へ変換する
 * なぜ: authorize リクエストの state パラメータと state Cookie に同じ値を載せるため
 */
package com.example.auth_gateway.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LoginStateCodec {

  private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE =
      new TypeReference<>() {};
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final ObjectMapper objectMapper;

  /**
   * @throws IllegalArgumentException when a value of the state cannot be written as JSON
   */
  public String encodeState(Map<String, Object> state) {
    if (state == null) {
      throw new IllegalArgumentException("state is required");
    }
    try {
      return ENCODER.encodeToString(objectMapper.writeValueAsBytes(state));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("state is not serializable", ex);
    }
  }

  /** Returns empty when {@code raw} is not base64url-encoded JSON object text. */
  public Optional<Map<String, Object>> decodeState(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      final byte[] json = DECODER.decode(raw);
      final Map<String, Object> state = objectMapper.readValue(json, STATE_TYPE);
      return Optional.ofNullable(state);
    } catch (IllegalArgumentException | IOException ex) {
      return Optional.empty();
    }
  }
}
