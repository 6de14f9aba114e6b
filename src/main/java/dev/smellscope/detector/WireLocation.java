package dev.smellscope.detector;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.smellscope.domain.valueobject.SourceLocation;

/**
 * Location as the detector backends send it. Only the start line is
 * mandatory; a missing end line means a single-line finding and a missing
 * column means the whole line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WireLocation(String file,
                           @JsonAlias("line") Integer startLine,
                           @JsonAlias("column") Integer startColumn,
                           Integer endLine,
                           Integer endColumn) {

    public SourceLocation toSourceLocation() {
        if (startLine == null) throw new MalformedResponseException("finding location has no start_line");
        int end = endLine != null ? endLine : startLine;
        return new SourceLocation(file, startLine,
                startColumn != null ? startColumn : 0, end,
                endColumn != null ? endColumn : 0);
    }
}
