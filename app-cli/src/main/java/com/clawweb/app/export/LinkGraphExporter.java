package com.clawweb.app.export;

import com.clawweb.core.model.CrawlResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/** 크롤 결과의 링크 그래프를 JSON 으로 저장/로드 */
public final class LinkGraphExporter {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    private final Clock clock;

    public LinkGraphExporter() { this(Clock.systemUTC()); }

    public LinkGraphExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path export(CrawlResult result, Path file) throws IOException {
        if (result == null) throw new IllegalArgumentException("result is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter()
                .writeValue(file.toFile(), LinkGraphDocument.of(result, Instant.now(clock)));
        return file;
    }

    public LinkGraphDocument read(Path file) throws IOException {
        LinkGraphDocument d = om.readValue(file.toFile(), LinkGraphDocument.class);
        if (!"1".equals(d.v)) {
            throw new IllegalArgumentException("Unsupported link graph version: " + d.v);
        }
        return d;
    }
}
