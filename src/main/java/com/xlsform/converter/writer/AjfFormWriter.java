package com.xlsform.converter.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.xlsform.converter.model.form.AjfForm;

/**
 * Serializes a converted form to JSON.
 */
public class AjfFormWriter {
    private static final Logger log = LoggerFactory.getLogger(AjfFormWriter.class);

    private final ObjectMapper objectMapper;

    public AjfFormWriter(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper();
        if (prettyPrint) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public String toJson(AjfForm form) throws JsonProcessingException {
        return objectMapper.writeValueAsString(form);
    }

    public void write(AjfForm form, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, toJson(form));
        log.info("Wrote {} slides to {}", form.getSlides().size(), output);
    }
}
