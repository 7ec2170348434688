package com.example.auth_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

// .well-known/openid-configuration のうち利用する項目のみ。
@JsonIgnoreProperties(ignoreUnknown = true)
public record OidcProviderMetadata(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("end_session_endpoint") String endSessionEndpoint) {}
