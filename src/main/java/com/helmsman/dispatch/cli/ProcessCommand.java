package com.helmsman.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.helmsman.core.config.ProcessingProperties;
import com.helmsman.core.engine.DocumentTriageService;
import com.helmsman.core.engine.InvalidDocumentException;
import com.helmsman.core.model.ProcessingResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: helmsman process "&lt;text&gt;" | --file report.txt
 * <p>
 * Runs one document through the triage pipeline and prints the result,
 * either as a colored report or as JSON.
 */
@Command(name = "process", mixinStandardHelpOptions = true, description = "Classify a maritime document")
@Component
public class ProcessCommand implements Callable<Integer> {

    static final int EXIT_INVALID_INPUT = 2;

    @Parameters(index = "0", arity = "0..1", description = "Document text (omit when using --file)")
    private String text;

    @Option(names = {"--file", "-f"}, description = "UTF-8 text file to process")
    private Path file;

    @Option(names = {"--type", "-t"},
            description = "Document type hint, e.g. SENSOR_ALERT or \"Incident Report\"")
    private String documentType;

    @Option(names = {"--vessel", "-v"}, description = "Vessel identifier")
    private String vesselId;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final DocumentTriageService triageService;
    private final ProcessingProperties properties;
    private final ObjectMapper objectMapper;

    public ProcessCommand(DocumentTriageService triageService, ProcessingProperties properties,
                          ObjectMapper objectMapper) {
        this.triageService = triageService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (text == null && file == null) {
            ConsoleOutput.error("No document given: pass the text or --file <path>");
            return EXIT_INVALID_INPUT;
        }
        if (text != null && file != null) {
            ConsoleOutput.error("Provide either document text or --file, not both");
            return EXIT_INVALID_INPUT;
        }

        String content;
        try {
            if (file != null && Files.size(file) > properties.getMaxTextLength()) {
                ConsoleOutput.error("File " + file + " exceeds the maximum size of "
                        + properties.getMaxTextLength() + " bytes");
                return EXIT_INVALID_INPUT;
            }
            content = file != null ? readUtf8(file) : text;
        } catch (CharacterCodingException e) {
            ConsoleOutput.error("Unable to decode " + file + ". Please ensure it is a UTF-8 text file");
            return EXIT_INVALID_INPUT;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        ProcessingResult result;
        try {
            result = triageService.triage(content, documentType, vesselId);
        } catch (InvalidDocumentException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        if (json) {
            try {
                System.out.println(objectMapper.copy()
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot serialize result: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.result(result);
        }
        return 0;
    }

    private static String readUtf8(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
