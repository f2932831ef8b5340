package io.flowcheck.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.InvalidFlowchartException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads flowcharts from the editor's JSON export:
 * <pre>
 * {"nodes": [{"id": "n1", "value": "Start", "style": "ellipse;", ...}],
 *  "edges": [{"id": "e1", "sourceId": "n1", "targetId": "n2"}]}
 * </pre>
 * Unknown properties are ignored. Both arrays are required.
 */
public class FlowchartLoader {

    private final ObjectMapper mapper;

    public FlowchartLoader() {
        this.mapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads a flowchart from a file.
     *
     * @throws IOException               if the file cannot be read
     * @throws InvalidFlowchartException if the content is not a valid flowchart
     */
    public Flowchart load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Flowchart file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * Loads a flowchart from a stream. The stream is not closed.
     */
    public Flowchart load(InputStream in) throws IOException {
        try {
            return check(mapper.readValue(in, Flowchart.class));
        } catch (JsonProcessingException e) {
            throw invalid(e);
        }
    }

    /**
     * Parses a flowchart from a JSON string.
     */
    public Flowchart parse(String json) {
        try {
            return check(mapper.readValue(json, Flowchart.class));
        } catch (JsonProcessingException e) {
            throw invalid(e);
        }
    }

    private static Flowchart check(Flowchart flowchart) {
        if (flowchart == null) {
            throw new InvalidFlowchartException("Flowchart JSON is empty");
        }
        return flowchart;
    }

    private static InvalidFlowchartException invalid(JsonProcessingException e) {
        // Validation errors from the record constructors arrive wrapped by Jackson
        Throwable cause = e.getCause();
        if (cause instanceof InvalidFlowchartException invalid) {
            return invalid;
        }
        return new InvalidFlowchartException("Invalid flowchart JSON: " + e.getOriginalMessage(), e);
    }
}
