package dev.workflow.engine;

import dev.workflow.compiler.CanonicalJson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Mints and checks the opaque tokens that bind a resume call to one paused checkpoint.
 * A token covers the execution id, the exact workflow content (by hash) and the approval step id.
 */
public final class ResumeTokens {

    public static final String PREFIX = "wrf_rt_";
    private static final int DIGEST_CHARS = 24;

    private ResumeTokens() {}

    public static String mint(String executionId, String workflowHash, String stepId) {
        String digest = CanonicalJson.sha256Hex(executionId + ":" + workflowHash + ":" + stepId);
        return PREFIX + digest.substring(0, DIGEST_CHARS);
    }

    /** Constant-time comparison of a presented token with the one minted for the checkpoint. */
    public static boolean matches(String presented, String executionId, String workflowHash, String stepId) {
        if (presented == null) {
            return false;
        }
        String expected = mint(executionId, workflowHash, stepId);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            presented.trim().getBytes(StandardCharsets.UTF_8));
    }
}
