package com.iimsoft.jobqueue.app;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.jobqueue.api.dto.OptimizeRequest;
import com.iimsoft.jobqueue.api.dto.OptimizeResponse;
import com.iimsoft.jobqueue.service.JobQueueOptimizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * Usage:
 * - from a file:  mvn exec:java -Dexec.args=path/to/request.json
 * - from stdin:   mvn exec:java -Dexec.args=- < request.json
 * - no argument:  runs the bundled example_request.json
 *
 * Settings: -Djobqueue.settings='{"unassignablePolicy":"FALLBACK_TO_FIRST_MACHINE"}'
 */
public class JobQueueOptimizerApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobQueueOptimizerApp.class);

    static final String EXAMPLE_REQUEST = "example_request.json";

    public static void main(String[] args) throws Exception {
        ObjectMapper mapper = objectMapper();

        OptimizeRequest request;
        String input = args == null || args.length == 0 || args[0] == null ? "" : args[0].trim();
        if (input.isEmpty()) {
            LOGGER.info("No request given, running bundled {}", EXAMPLE_REQUEST);
            request = readExample(mapper);
        } else if ("-".equals(input)) {
            try (InputStream in = System.in) {
                request = mapper.readValue(in, OptimizeRequest.class);
            }
        } else {
            Path path = Path.of(input);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                System.err.println("Request file does not exist or is a directory: " + path.toAbsolutePath());
                System.exit(2);
                return;
            }
            request = mapper.readValue(path.toFile(), OptimizeRequest.class);
        }

        OptimizeResponse response;
        try {
            response = new JobQueueOptimizationService().optimize(request);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid request: " + e.getMessage());
            System.exit(2);
            return;
        }
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    static OptimizeRequest readExample(ObjectMapper mapper) throws IOException {
        try (InputStream in = JobQueueOptimizerApp.class.getClassLoader().getResourceAsStream(EXAMPLE_REQUEST)) {
            if (in == null) {
                throw new IOException("Classpath resource not found: " + EXAMPLE_REQUEST);
            }
            return mapper.readValue(in, OptimizeRequest.class);
        }
    }
}
