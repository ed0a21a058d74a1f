package io.apiary.core.http;

/** HTTP methods the brokers issue. */
public enum HttpMethod {
    GET,
    POST
}
