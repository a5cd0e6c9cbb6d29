package de.entwicklertraining.http.pipeline.multipart;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A file section of a {@link MultipartBody}.
 * <p>
 * The encoder reads the file's stream once and closes it exactly once, whether the copy
 * succeeded or not.
 */
public final class MultipartFile implements Closeable {
    private final InputStream body;
    private String filename;
    private String mime;

    private MultipartFile(InputStream body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Creates a file section from a stream. The filename is unset and the content type
     * will be detected from the first bytes.
     *
     * @param body the file content
     * @return a new file section
     */
    public static MultipartFile of(InputStream body) {
        return new MultipartFile(body);
    }

    /**
     * Opens a file from disk. The filename is set to the file's name.
     *
     * @param path the file to upload
     * @return a new file section
     * @throws IOException if the file cannot be opened
     */
    public static MultipartFile open(Path path) throws IOException {
        return of(Files.newInputStream(path)).withFilename(path.getFileName().toString());
    }

    /**
     * Like {@link #open(Path)}, but fails with an unchecked exception.
     *
     * @param path the file to upload
     * @return a new file section
     * @throws UncheckedIOException if the file cannot be opened
     */
    public static MultipartFile mustOpen(Path path) {
        try {
            return open(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't open " + path, e);
        }
    }

    /**
     * Sets the filename sent in the section's Content-Disposition header.
     *
     * @param filename the filename
     * @return this file
     */
    public MultipartFile withFilename(String filename) {
        this.filename = filename;
        return this;
    }

    /**
     * Sets the section's Content-Type instead of detecting it.
     *
     * @param mime the media type
     * @return this file
     */
    public MultipartFile withMime(String mime) {
        this.mime = mime;
        return this;
    }

    public String getFilename() {
        return filename;
    }

    public String getMime() {
        return mime;
    }

    InputStream getBody() {
        return body;
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
