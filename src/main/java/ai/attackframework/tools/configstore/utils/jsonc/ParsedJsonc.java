package ai.attackframework.tools.configstore.utils.jsonc;

/**
 * Result of stripping a JSONC document.
 *
 * @param jsonPayload strict JSON text, trimmed; empty when nothing but comments remained
 * @param comments    comments recovered from the document
 */
public record ParsedJsonc(String jsonPayload, CommentIndex comments) {

    public ParsedJsonc {
        jsonPayload = jsonPayload == null ? "" : jsonPayload;
        comments    = comments == null ? CommentIndex.empty() : comments;
    }

    public boolean isEmpty() {
        return jsonPayload.isBlank();
    }
}
