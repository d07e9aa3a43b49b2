package com.marketpool.infra;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Published artifacts live under the repository's {@code latest} release.
 */
@Component
public class ReleaseArtifactLocator {

    private final String repoUrl;

    public ReleaseArtifactLocator(
            @Value("${marketpool.release.repo-url:https://github.com/vigji/mootlib}") String repoUrl) {
        this.repoUrl = repoUrl.endsWith("/") ? repoUrl.substring(0, repoUrl.length() - 1) : repoUrl;
    }

    public String releaseFileUrl(String fileName) {
        return repoUrl + "/releases/download/latest/" + fileName;
    }
}
