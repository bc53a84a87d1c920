package io.openpayments.crypto;

import io.openpayments.exception.SigningException;

/** Minimal abstraction for producing authentication headers over one HTTP request.
 *  Headers are produced per send attempt and must never be reused.
 */
public interface RequestSigner {
    /**
     * Signs a request.
     *
     * @param method HTTP method, e.g. {@code POST}
     * @param url absolute request URL, exactly as it is sent
     * @param body request body, or {@code null} when the request has none
     * @return the {@code Signature} and {@code Signature-Input} headers
     * @throws SigningException if the key cannot produce a signature
     */
    SignatureHeaders sign(String method, String url, String body) throws SigningException;
}
