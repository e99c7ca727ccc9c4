package com.reasonai.infrastructure.cache;

import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.StageType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Builds deterministic stage cache keys of the form {@code <stage>:<sha256>}.
 * The stage key namespaces entries so two stages never collide on the same input.
 */
@Component
public class CacheKeyBuilder {

    /**
     * Build a cache key for one stage invocation.
     *
     * @param stageType     the stage whose output is cached
     * @param request       the originating request (constraints are sorted for determinism)
     * @param upstreamTexts text of every upstream output the stage reads, in pipeline order
     * @param variant       stage-specific settings that change the output (e.g. perspective count)
     * @return namespaced hex-encoded SHA-256 key
     */
    public String buildKey(StageType stageType,
                           PipelineRequest request,
                           List<String> upstreamTexts,
                           String variant) {
        String sortedConstraints = String.join("\u001F", request.constraints().stream().sorted().toList());

        String raw = request.prompt() + "|"
                + (request.context() != null ? request.context() : "") + "|"
                + sortedConstraints + "|"
                + String.join("\u001E", upstreamTexts) + "|"
                + (variant != null ? variant : "");

        return stageType.key() + ":" + sha256(raw);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new CacheException("SHA-256 not available", e);
        }
    }
}
