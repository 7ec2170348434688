/*
 * どこで: Auth-Gateway モデル
 * 何を: token endpoint の応答(id_token/access_token など)
 * なぜ: コールバック完了時にセッションへ保存し、ログアウト時の id_token_hint に使うため
 */
package com.example.auth_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenSet(
    @JsonProperty("id_token") String idToken,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("scope") String scope) {}
