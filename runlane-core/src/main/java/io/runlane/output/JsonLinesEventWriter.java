/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.runlane.output;

import io.runlane.core.RunEvent;
import io.runlane.core.RunEventType;
import io.runlane.core.RunListener;
import io.runlane.core.TestRunEvent;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RunListener} that streams events as JSON Lines, one envelope per event:
 * <pre>
 * {"type":"suite_started","timeStamp":1703500000000,"data":{"workerCount":4,...}}
 * {"type":"case_started","timeStamp":1703500000010,"data":{"caseId":"users",...}}
 * {"type":"test_started","timeStamp":1703500000020,"data":{"caseId":"users","testId":"create"}}
 * {"type":"test_finished","timeStamp":1703500000100,"threadName":"runlane-test-1","data":{...}}
 * {"type":"case_finished","timeStamp":1703500000200,"data":{...}}
 * {"type":"suite_finished","timeStamp":1703500010000,"data":{"total":2,"failures":0,...}}
 * </pre>
 * Subscribe it with {@code EventBus.subscribe(listener)} so that a slow disk never holds up the run.
 */
public class JsonLinesEventWriter implements RunListener, Closeable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String DEFAULT_FILENAME = "runlane-events.jsonl";

    private final Path jsonlPath;
    private Writer writer;
    private volatile boolean closed;

    /**
     * Write to {@link #DEFAULT_FILENAME} in the given directory, which is created if needed.
     */
    public static JsonLinesEventWriter open(Path outputDir) throws IOException {
        Path path = outputDir.resolve(DEFAULT_FILENAME);
        Files.createDirectories(outputDir);
        BufferedWriter writer = Files.newBufferedWriter(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        logger.debug("JSONL event stream started: {}", path);
        return new JsonLinesEventWriter(writer, path);
    }

    public JsonLinesEventWriter(Writer writer) {
        this(writer, null);
    }

    private JsonLinesEventWriter(Writer writer, Path jsonlPath) {
        this.writer = writer;
        this.jsonlPath = jsonlPath;
    }

    @Override
    public void onEvent(RunEvent event) {
        if (closed) {
            return;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", event.getKind());
        envelope.put("timeStamp", event.getTimeStamp());
        if (event instanceof TestRunEvent tre && tre.result() != null && tre.result().getThreadName() != null) {
            envelope.put("threadName", tre.result().getThreadName());
        }
        envelope.put("data", event.toJson());
        try {
            writeLine(JSONValue.toJSONString(envelope), event.getType() == RunEventType.SUITE_FINISHED);
        } catch (IOException e) {
            logger.warn("failed to write event to JSONL: {}", e.getMessage());
        }
    }

    private synchronized void writeLine(String json, boolean flush) throws IOException {
        if (writer != null && !closed) {
            writer.write(json);
            writer.write('\n');
            if (flush) {
                writer.flush();
            }
        }
    }

    @Override
    public synchronized void close() throws IOException {
        closed = true;
        if (writer != null) {
            writer.close();
            writer = null;
            if (jsonlPath != null) {
                logger.info("JSONL event stream written to: {}", jsonlPath);
            }
        }
    }

    /**
     * @return the file being written, or null when writing to a caller-supplied writer
     */
    public Path getJsonlPath() {
        return jsonlPath;
    }

}
