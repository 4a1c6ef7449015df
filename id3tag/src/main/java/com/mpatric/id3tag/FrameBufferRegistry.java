package com.mpatric.id3tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the tag regions that lazily stored frames point into. A frame refers to a region
 * by the integer handle returned from {@link #register(byte[])} plus an offset and
 * length, so the region lives exactly as long as the registry keeps it.
 */
public class FrameBufferRegistry {

    private final List<byte[]> buffers = new ArrayList<>();

    public int register(byte[] buffer) {
        if (buffer == null) throw new NullPointerException("buffer");
        buffers.add(buffer);
        return buffers.size() - 1;
    }

    /**
     * @throws IllegalStateException if the handle was never registered or has been released
     */
    public byte[] get(int handle) {
        byte[] buffer = handle >= 0 && handle < buffers.size() ? buffers.get(handle) : null;
        if (buffer == null) throw new IllegalStateException("No buffer registered for handle " + handle);
        return buffer;
    }

    public void release(int handle) {
        if (handle >= 0 && handle < buffers.size()) {
            buffers.set(handle, null);
        }
    }
}
