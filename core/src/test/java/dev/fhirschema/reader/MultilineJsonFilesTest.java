/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.reader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.databind.JsonNode;

import static org.assertj.core.api.Assertions.assertThat;

public class MultilineJsonFilesTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        write("b-patients.ndjson", "{\"resourceType\": \"Patient\", \"id\": \"1\"}\n{\"resourceType\": \"Patient\", \"id\": \"2\"}");
        write("a-conditions.jsonl", "{\"resourceType\": \"Condition\", \"id\": \"c1\"}");
        write("broken.ndjson", "not json");
        write("notes.txt", "{\"resourceType\": \"Patient\"}");
        Files.createDirectories(tempDir.resolve("nested"));
        write("nested/more-patients.ndjson", "{\"resourceType\": \"Patient\", \"id\": \"3\"}");
    }

    @Test
    void testListByKind() {
        Map<Path, String> patients = MultilineJsonFiles.list(tempDir, Set.of("Patient"));

        assertThat(patients).containsOnlyKeys(tempDir.resolve("b-patients.ndjson"));
        assertThat(patients.get(tempDir.resolve("b-patients.ndjson"))).isEqualTo("Patient");
    }

    @Test
    void testListAll() {
        Map<Path, String> all = MultilineJsonFiles.list(tempDir, Set.of());

        assertThat(all.keySet()).containsExactly(
                tempDir.resolve("a-conditions.jsonl"),
                tempDir.resolve("b-patients.ndjson"),
                tempDir.resolve("broken.ndjson"));
        assertThat(all.get(tempDir.resolve("a-conditions.jsonl"))).isEqualTo("Condition");
        assertThat(all.get(tempDir.resolve("broken.ndjson"))).isNull();
    }

    @Test
    void testListRecursive() {
        Map<Path, String> patients = MultilineJsonFiles.list(tempDir, Set.of("Patient"), true);

        assertThat(patients).containsOnlyKeys(
                tempDir.resolve("b-patients.ndjson"),
                tempDir.resolve("nested/more-patients.ndjson"));
    }

    @Test
    void testListMissingDirectory() {
        assertThat(MultilineJsonFiles.list(tempDir.resolve("missing"), Set.of())).isEmpty();
    }

    @Test
    void testReadAll() {
        try (Stream<JsonNode> records = MultilineJsonFiles.readAll(tempDir, Set.of("Patient", "Condition"))) {
            assertThat(records.map(record -> record.get("id").asText())).containsExactly("c1", "1", "2");
        }
    }

    @Test
    void testReadAllRecursive() {
        try (Stream<JsonNode> records = MultilineJsonFiles.readAll(tempDir, Set.of("Patient"), true)) {
            assertThat(records.map(record -> record.get("id").asText())).containsExactly("1", "2", "3");
        }
    }

    @Test
    void testReadAllReadsFilesLazily() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("lazy"));
        Path file = dir.resolve("Patient.ndjson");
        Files.writeString(file, "{\"resourceType\": \"Patient\", \"id\": \"p1\"}\n"
                + "{\"resourceType\": \"Patient\", \"id\": \"p2\"}\n", StandardCharsets.UTF_8);

        try (Stream<JsonNode> records = MultilineJsonFiles.readAll(dir, Set.of("Patient"))) {
            Iterator<JsonNode> iterator = records.iterator();
            assertThat(iterator.next().get("id").asText()).isEqualTo("p1");

            // Lines appended after the first value was taken are still seen
            Files.writeString(file, "{\"resourceType\": \"Patient\", \"id\": \"p3\"}\n",
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            List<String> rest = new ArrayList<>();
            iterator.forEachRemaining(record -> rest.add(record.get("id").asText()));
            assertThat(rest).containsExactly("p2", "p3");
            assertThat(iterator.hasNext()).isFalse();
        }
    }

    @Test
    void testReadAllWithoutFiles() {
        try (Stream<JsonNode> records = MultilineJsonFiles.readAll(tempDir.resolve("missing"), Set.of())) {
            assertThat(records).isEmpty();
        }
    }

    @ParameterizedTest
    @CsvSource({
            "Patient.ndjson, true",
            "Patient.NDJSON, true",
            "Patient.jsonl, true",
            "Patient.ndjson.gz, true",
            "Patient.jsonl.GZ, true",
            "Patient.json, false",
            "Patient.gz, false",
            "ndjson, false"
    })
    void testExtensions(String fileName, boolean expected) {
        assertThat(MultilineJsonFiles.hasMultilineJsonExtension(Path.of(fileName))).isEqualTo(expected);
    }

    @Test
    void testDetectResourceType() {
        assertThat(MultilineJsonFiles.detectResourceType(tempDir.resolve("b-patients.ndjson"))).isEqualTo("Patient");
        assertThat(MultilineJsonFiles.detectResourceType(tempDir.resolve("broken.ndjson"))).isNull();
        assertThat(MultilineJsonFiles.detectResourceType(tempDir.resolve("missing.ndjson"))).isNull();
    }

    @Test
    void testDetectResourceTypeRejectsTrailingContent() throws Exception {
        write("trailing.ndjson", "{\"resourceType\": \"Patient\"} {\"resourceType\": \"Condition\"}");

        assertThat(MultilineJsonFiles.detectResourceType(tempDir.resolve("trailing.ndjson"))).isNull();
    }

    private void write(String name, String content) throws Exception {
        Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
