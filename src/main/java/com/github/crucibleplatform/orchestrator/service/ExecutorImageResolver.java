package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * @author crucible-platform
 */
@Component
@RequiredArgsConstructor
public class ExecutorImageResolver {

    private final SandboxProperties sandboxProperties;

    /**
     * Resolves a named image through the configured image map. Fully qualified references (containing {@code /}
     * or {@code :}) are used as they are.
     *
     * @return empty if the name is unknown
     */
    public Optional<String> resolve(final String requestedImage) {
        final String image = StringUtils.hasText(requestedImage) ? requestedImage.trim()
                : sandboxProperties.getDefaultImage();
        if (image.contains("/") || image.contains(":")) {
            return Optional.of(image);
        }
        return Optional.ofNullable(sandboxProperties.getImages().get(image));
    }

}
