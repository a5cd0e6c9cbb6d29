package de.entwicklertraining.http.pipeline.multipart;

import okio.BufferedSink;
import okio.BufferedSource;
import okio.Okio;
import okio.Pipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@code multipart/form-data} request body that is encoded while it is being sent.
 * <p>
 * A background producer writes the parts into a bounded in-memory pipe and the transport
 * reads them from the other end, so at most {@link #PIPE_BUFFER_SIZE} bytes of encoded
 * payload are held in memory regardless of the file sizes. The producer starts on the
 * first read and never more than once. File sections are written first, in the order they
 * were added, followed by the form fields.
 * <p>
 * A file whose content cannot be copied is logged and skipped; the rest of the body is
 * still produced. The stream supports one sequential reader.
 *
 * <pre>
 * MultipartBody body = new MultipartBody()
 *     .withFile("avatar", MultipartFile.mustOpen(Path.of("avatar.png")))
 *     .withField("name", "Ada");
 * request.setFiles(body);
 * </pre>
 */
public class MultipartBody extends InputStream {
    private static final Logger logger = LoggerFactory.getLogger(MultipartBody.class);

    /** Capacity of the pipe between producer and reader */
    public static final long PIPE_BUFFER_SIZE = 64 * 1024;

    private static final String UNKNOWN_FILENAME = "???";
    private static final byte[] CRLF = {'\r', '\n'};
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final ExecutorService PRODUCER_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "http-pipeline-multipart");
        thread.setDaemon(true);
        return thread;
    });

    private final Map<String, MultipartFile> files = new LinkedHashMap<>();
    private final Map<String, List<String>> form = new LinkedHashMap<>();
    private final String boundary;
    private final Pipe pipe = new Pipe(PIPE_BUFFER_SIZE);
    private final InputStream source;
    private final AtomicBoolean started = new AtomicBoolean();

    /**
     * Creates an empty body with a random boundary.
     */
    public MultipartBody() {
        this(randomBoundary());
    }

    /**
     * Creates an empty body with the given boundary.
     *
     * @param boundary the part delimiter, 1 to 70 characters
     */
    public MultipartBody(String boundary) {
        if (boundary == null || boundary.isEmpty() || boundary.length() > 70) {
            throw new IllegalArgumentException("Boundary must be 1 to 70 characters");
        }
        this.boundary = boundary;
        BufferedSource bufferedSource = Okio.buffer(pipe.source());
        this.source = bufferedSource.inputStream();
    }

    /**
     * Adds a file section. Adding the same key twice replaces the earlier file, which is
     * closed without being read.
     *
     * @param key the form field name
     * @param file the file
     * @return this body
     */
    public MultipartBody withFile(String key, MultipartFile file) {
        checkNotStarted();
        MultipartFile replaced = files.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(file, "file"));
        if (replaced != null && replaced != file) {
            closeFile(key, replaced);
        }
        return this;
    }

    /**
     * Adds all given file sections in iteration order.
     *
     * @param files field names mapped to files
     * @return this body
     */
    public MultipartBody withFiles(Map<String, MultipartFile> files) {
        files.forEach(this::withFile);
        return this;
    }

    /**
     * Adds a form field value. Repeated keys keep every value.
     *
     * @param key the field name
     * @param value the field value
     * @return this body
     */
    public MultipartBody withField(String key, String value) {
        checkNotStarted();
        form.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new ArrayList<>())
                .add(Objects.requireNonNull(value, "value"));
        return this;
    }

    /**
     * Adds all given form fields.
     *
     * @param form field names mapped to their values
     * @return this body
     */
    public MultipartBody withForm(Map<String, List<String>> form) {
        form.forEach((key, values) -> values.forEach(value -> withField(key, value)));
        return this;
    }

    /**
     * Gets the Content-Type header value for this body.
     *
     * @return {@code multipart/form-data; boundary=...}
     */
    public String getContentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public String getBoundary() {
        return boundary;
    }

    @Override
    public int read() throws IOException {
        start();
        return source.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        start();
        return source.read(b, off, len);
    }

    @Override
    public int available() throws IOException {
        return started.get() ? source.available() : 0;
    }

    /**
     * Closes the reading end. A producer still running stops at its next write; files it
     * has not reached yet are closed without being read.
     */
    @Override
    public void close() throws IOException {
        if (started.compareAndSet(false, true)) {
            // the producer never ran, so nobody else will close the files
            files.forEach(this::closeFile);
        }
        source.close();
    }

    private void start() {
        if (started.compareAndSet(false, true)) {
            PRODUCER_EXECUTOR.execute(this::produce);
        }
    }

    private void checkNotStarted() {
        if (started.get()) {
            throw new IllegalStateException("Multipart body is already being read");
        }
    }

    private void produce() {
        BufferedSink sink = Okio.buffer(pipe.sink());
        OutputStream out = sink.outputStream();
        PartWriter writer = new PartWriter(out);
        try {
            writeFiles(writer);
            writeForm(writer);
        } finally {
            // the terminator must be written before the pipe is closed
            try {
                writer.close();
            } catch (IOException e) {
                logger.debug("Failed to finish multipart body: {}", e.getMessage());
            }
            try {
                out.close();
            } catch (IOException e) {
                logger.debug("Failed to close multipart pipe: {}", e.getMessage());
            }
        }
    }

    private void writeFiles(PartWriter writer) {
        for (Map.Entry<String, MultipartFile> entry : files.entrySet()) {
            String key = entry.getKey();
            MultipartFile file = entry.getValue();
            String filename = file.getFilename() == null || file.getFilename().isEmpty()
                    ? UNKNOWN_FILENAME : file.getFilename();
            try {
                PushbackInputStream in = new PushbackInputStream(file.getBody(), ContentTypeSniffer.SNIFF_LENGTH);
                String mime = file.getMime();
                if (mime == null || mime.isEmpty()) {
                    mime = sniff(in);
                }
                Map<String, String> headers = new LinkedHashMap<>();
                headers.put("Content-Disposition", "form-data; name=\"" + escapeQuotes(key)
                        + "\"; filename=\"" + escapeQuotes(filename) + "\"");
                headers.put("Content-Type", mime);
                writer.startPart(headers);
                in.transferTo(writer.out);
            } catch (IOException e) {
                logger.warn("Can't bind multipart section ({}=@{}): {}", key, filename, e.getMessage());
            } finally {
                closeFile(key, file);
            }
        }
    }

    private void writeForm(PartWriter writer) {
        try {
            for (Map.Entry<String, List<String>> entry : form.entrySet()) {
                for (String value : entry.getValue()) {
                    writer.startPart(Map.of("Content-Disposition",
                            "form-data; name=\"" + escapeQuotes(entry.getKey()) + "\""));
                    writer.out.write(value.getBytes(StandardCharsets.UTF_8));
                }
            }
        } catch (IOException e) {
            logger.warn("Can't bind multipart form fields: {}", e.getMessage());
        }
    }

    private static String sniff(PushbackInputStream in) throws IOException {
        byte[] peek = new byte[ContentTypeSniffer.SNIFF_LENGTH];
        int n = in.readNBytes(peek, 0, peek.length);
        if (n > 0) {
            in.unread(peek, 0, n);
        }
        return ContentTypeSniffer.detect(peek, n);
    }

    private void closeFile(String key, MultipartFile file) {
        try {
            file.close();
        } catch (IOException e) {
            logger.debug("Failed to close multipart file {}: {}", key, e.getMessage());
        }
    }

    static String escapeQuotes(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String randomBoundary() {
        byte[] bytes = new byte[30];
        RANDOM.nextBytes(bytes);
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Writes RFC 2046 part delimiters around the sections.
     */
    private final class PartWriter {
        private final OutputStream out;
        private boolean firstPart = true;

        PartWriter(OutputStream out) {
            this.out = out;
        }

        void startPart(Map<String, String> headers) throws IOException {
            StringBuilder sb = new StringBuilder();
            if (!firstPart) {
                sb.append("\r\n");
            }
            firstPart = false;
            sb.append("--").append(boundary).append("\r\n");
            headers.forEach((name, value) -> sb.append(name).append(": ").append(value).append("\r\n"));
            sb.append("\r\n");
            out.write(sb.toString().getBytes(StandardCharsets.UTF_8));
        }

        void close() throws IOException {
            if (!firstPart) {
                out.write(CRLF);
            }
            out.write(("--" + boundary + "--").getBytes(StandardCharsets.UTF_8));
            out.write(CRLF);
            out.flush();
        }
    }
}
