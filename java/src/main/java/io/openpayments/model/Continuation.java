package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The {@code continue} element of a grant response. */
public class Continuation {
    @JsonProperty("access_token")
    public Token accessToken;

    /** Where to post the continuation request. */
    public String uri;

    /** Seconds the server asks the client to wait before continuing. */
    public Integer wait;

    /** Default constructor for Jackson. */
    public Continuation() {}

    public Continuation(String uri, String tokenValue, Integer wait) {
        this.uri = uri;
        this.accessToken = new Token(tokenValue);
        this.wait = wait;
    }

    @JsonIgnore
    public String tokenValue() {
        return accessToken == null ? null : accessToken.value;
    }

    /** Continuation access token; sent as {@code Authorization: GNAP <value>}. */
    public static class Token {
        public String value;

        public Token() {}

        public Token(String value) {
            this.value = value;
        }
    }
}
