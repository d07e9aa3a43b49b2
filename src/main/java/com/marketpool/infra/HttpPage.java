package com.marketpool.infra;

import lombok.Value;

/**
 * Response body together with the URL it was finally served from (after redirects).
 */
@Value
public class HttpPage {
    String url;
    String body;
}
