package com.marketpool.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteArtifactFetcher {

    private final HttpSessionFactory sessionFactory;

    /**
     * Downloads the whole artifact into memory.
     *
     * @throws com.marketpool.error.TransientFetchException on any network or HTTP failure
     */
    public byte[] download(String url) {
        log.info("Downloading {}", url);
        try (HttpSession session = sessionFactory.open()) {
            return session.getBytes(url);
        }
    }
}
