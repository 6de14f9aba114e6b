package dev.smellscope.domain.valueobject;

/**
 * One validated analysis request. Immutable; owned by the orchestrator for
 * the duration of a single call.
 */
public record AnalysisRequest(String requestId, String code, String language,
                              String fileName, AnalysisOptions options) {

    public static final String DEFAULT_FILE_NAME = "input";

    public AnalysisRequest {
        if (requestId == null || requestId.isBlank()) throw new IllegalArgumentException("requestId required");
        if (code == null) throw new IllegalArgumentException("code required");
        if (language == null) throw new IllegalArgumentException("language required");
        if (fileName == null || fileName.isBlank()) fileName = DEFAULT_FILE_NAME;
        if (options == null) options = AnalysisOptions.defaults();
    }

    /**
     * Number of lines in the source. A trailing newline does not open a new line.
     */
    public int sourceLineCount() {
        if (code.isEmpty()) return 0;
        int lines = 1;
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '\n') lines++;
        }
        return code.endsWith("\n") ? lines - 1 : lines;
    }
}
