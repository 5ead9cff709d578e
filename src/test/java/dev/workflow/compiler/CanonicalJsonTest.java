package dev.workflow.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void sortsKeysAtEveryDepthAndKeepsArrayOrder() throws Exception {
        var node = MAPPER.readTree("""
            {"b": 1, "a": {"z": [3, 1, {"y": true, "x": null}], "c": "s"}}
            """);

        assertThat(CanonicalJson.serialize(CanonicalJson.canonicalize(node)))
            .isEqualTo("{\"a\":{\"c\":\"s\",\"z\":[3,1,{\"x\":null,\"y\":true}]},\"b\":1}");
    }

    @Test
    void canonicalizeDoesNotMutateInput() throws Exception {
        var node = MAPPER.readTree("""
            {"b": 1, "a": 2}
            """);

        CanonicalJson.canonicalize(node);

        assertThat(node.fieldNames()).toIterable().containsExactly("b", "a");
    }

    @Test
    void hashIsPrefixedLowercaseSha256() throws Exception {
        String hash = CanonicalJson.hash(MAPPER.readTree("{}"));

        // sha256 of "{}"
        assertThat(hash).isEqualTo("sha256:44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a");
    }

    @Test
    void normalizeHashAddsMissingPrefix() {
        assertThat(CanonicalJson.normalizeHash("abc")).isEqualTo("sha256:abc");
        assertThat(CanonicalJson.normalizeHash(" sha256:abc ")).isEqualTo("sha256:abc");
        assertThat(CanonicalJson.normalizeHash("  ")).isEmpty();
        assertThat(CanonicalJson.normalizeHash(null)).isEmpty();
    }
}
