package com.mpatric.id3tag;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

public class FileWrapper {

    protected Path path;
    protected long length;
    protected long lastModified;

    protected FileWrapper() {}

    public FileWrapper(String filename) throws IOException {
        this(Paths.get(filename));
    }

    public FileWrapper(File file) throws IOException {
        if (file == null) throw new NullPointerException();
        this.path = file.toPath();
        init();
    }

    public FileWrapper(Path path) throws IOException {
        if (path == null) throw new NullPointerException();
        this.path = path;
        init();
    }

    private void init() throws IOException {
        if (!Files.exists(path)) throw new FileNotFoundException("File not found " + path);
        if (!Files.isReadable(path)) throw new IOException("File not readable");
        refresh();
    }

    /** Re-reads length and modification time, e.g. after the file was rewritten. */
    protected void refresh() throws IOException {
        length = Files.size(path);
        lastModified = Files.getLastModifiedTime(path).to(TimeUnit.MILLISECONDS);
    }

    public Path getPath() {
        return path;
    }

    public String getFilename() {
        return path.toString();
    }

    public long getLength() {
        return length;
    }

    public long getLastModified() {
        return lastModified;
    }
}
