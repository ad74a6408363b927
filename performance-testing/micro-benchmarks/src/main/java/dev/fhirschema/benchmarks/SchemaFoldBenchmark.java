/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fhirschema.benchmarks;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.fhirschema.inference.ReferenceDefaults;
import dev.fhirschema.inference.SchemaBuilder;
import dev.fhirschema.reader.FhirSchema;
import dev.fhirschema.reader.InferenceContext;

/**
 * Benchmark comparing a sequential fold with the batched parallel fold of {@link FhirSchema}
 * over synthetic Patient records.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms2g", "-Xmx2g" })
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 1)
public class SchemaFoldBenchmark {

    private static final String KIND = "Patient";

    @Param("100000")
    private int recordCount;

    @Param("1024")
    private int batchSize;

    private List<JsonNode> records;
    private FhirSchema fhirSchema;

    @Setup
    public void setup() {
        ObjectMapper mapper = new ObjectMapper();
        Random random = new Random(42);
        records = new ArrayList<>(recordCount);
        for (int i = 0; i < recordCount; i++) {
            records.add(patient(mapper, random, i));
        }
        fhirSchema = FhirSchema.create(
                InferenceContext.create(Runtime.getRuntime().availableProcessors(), batchSize),
                ReferenceDefaults.bundled());
    }

    @TearDown
    public void tearDown() {
        fhirSchema.close();
    }

    @Benchmark
    public void a_sequentialFold(Blackhole blackhole) {
        blackhole.consume(SchemaBuilder.build(KIND, records, ReferenceDefaults.bundled()));
    }

    @Benchmark
    public void b_parallelFold(Blackhole blackhole) {
        blackhole.consume(fhirSchema.infer(KIND, records));
    }

    private static ObjectNode patient(ObjectMapper mapper, Random random, int index) {
        ObjectNode patient = mapper.createObjectNode();
        patient.put("resourceType", KIND);
        patient.put("id", "patient-" + index);
        patient.put("active", random.nextBoolean());
        patient.put("birthDate", "19" + (10 + random.nextInt(90)) + "-01-01");

        ArrayNode names = patient.putArray("name");
        ObjectNode name = names.addObject();
        name.put("family", "Family" + random.nextInt(1000));
        name.putArray("given").add("Given" + random.nextInt(1000));

        if (random.nextInt(4) == 0) {
            ArrayNode telecom = patient.putArray("telecom");
            ObjectNode phone = telecom.addObject();
            phone.put("system", "phone");
            phone.put("value", "555-" + random.nextInt(10000));
        }
        if (random.nextInt(10) == 0) {
            ObjectNode extension = patient.putArray("extension").addObject();
            extension.put("url", "http://example.org/ext");
            ObjectNode coding = extension.putObject("valueCoding");
            coding.put("system", "http://loinc.org");
            coding.put("code", Integer.toString(random.nextInt(100)));
        }
        if (random.nextBoolean()) {
            patient.put("multipleBirthInteger", random.nextInt(3));
        }
        else {
            patient.put("multipleBirthBoolean", false);
        }
        return patient;
    }
}
