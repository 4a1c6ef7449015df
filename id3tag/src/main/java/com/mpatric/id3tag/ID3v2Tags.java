package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The frames of one ID3v2 tag, grouped into slots by {@link HashKey} in file order.
 * Frames read from a tag are stored undecoded and parsed on first access through one of
 * the decoding accessors ({@link #getAllDecoded}, {@link #getDecoded},
 * {@link #valuesDecoded}); the plain accessors only return frames that are already
 * decoded. Not thread-safe: decode every frame before sharing an instance.
 */
public class ID3v2Tags {

    private static final Logger log = LoggerFactory.getLogger(ID3v2Tags.class);

    private static final int V22_FRAME_HEADER_LENGTH = 6;
    private static final int V22_FRAME_ID_LENGTH = 3;
    private static final int FRAME_HEADER_LENGTH = 10;
    private static final int FRAME_ID_LENGTH = 4;
    private static final int DATA_LENGTH_INDICATOR_LENGTH = 4;

    private static final int V23_COMPRESSION_FLAG = 0x0080;
    private static final int V23_ENCRYPTION_FLAG = 0x0040;
    private static final int V24_COMPRESSION_FLAG = 0x0008;
    private static final int V24_ENCRYPTION_FLAG = 0x0004;
    private static final int V24_UNSYNCHRONISATION_FLAG = 0x0002;
    private static final int V24_DATA_LENGTH_INDICATOR_FLAG = 0x0001;

    private final Map<HashKey, List<LazyFrame>> frameSets = new LinkedHashMap<>();
    private final List<UnknownFrame> unknownFrames = new ArrayList<>();
    private final FrameBufferRegistry buffers = new FrameBufferRegistry();
    private final FrameDataParser parser;
    private int majorVersion = 4;
    private int revision = 0;

    public ID3v2Tags() {
        this(ID3v2FrameFactory.DEFAULT_PARSER);
    }

    public ID3v2Tags(FrameDataParser parser) {
        if (parser == null) throw new NullPointerException("parser");
        this.parser = parser;
    }

    public void add(AbstractID3v2FrameData frame) {
        addToSet(frame.getHashKey(), LazyFrame.decoded(frame));
    }

    /**
     * Stores a frame payload for decoding on first access. The slot key is taken from the
     * payload's leading fields without parsing the rest.
     */
    public void addRaw(String id, byte[] data) {
        addToSet(ID3v2FrameFactory.quickHashKey(id, data), LazyFrame.raw(id, data));
    }

    private void addToSet(HashKey key, LazyFrame frame) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null) {
            frames = new ArrayList<>();
            frameSets.put(key, frames);
        }
        frames.add(frame);
    }

    /** The already decoded frames of a slot; nothing is decoded by this call. */
    public List<AbstractID3v2FrameData> getAll(HashKey key) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null) return Collections.emptyList();
        List<AbstractID3v2FrameData> decoded = new ArrayList<>(frames.size());
        for (LazyFrame frame : frames) {
            if (frame.isDecoded()) decoded.add(frame.getDecoded());
        }
        return decoded;
    }

    public List<AbstractID3v2FrameData> getAll(String key) {
        HashKey hashKey = findKey(key);
        if (hashKey == null) return Collections.emptyList();
        return getAll(hashKey);
    }

    /** Decodes the frames of a slot if necessary and returns those that decoded. */
    public List<AbstractID3v2FrameData> getAllDecoded(HashKey key) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null) return Collections.emptyList();
        for (LazyFrame frame : frames) {
            decode(key, frame);
        }
        return getAll(key);
    }

    public List<AbstractID3v2FrameData> getAllDecoded(String key) {
        HashKey hashKey = findKey(key);
        if (hashKey == null) return Collections.emptyList();
        return getAllDecoded(hashKey);
    }

    /** @return the first frame of the slot if it is decoded, otherwise null */
    public AbstractID3v2FrameData get(HashKey key) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null) return null;
        for (LazyFrame frame : frames) {
            if (frame.isDecoded()) return frame.getDecoded();
        }
        return null;
    }

    public AbstractID3v2FrameData get(String key) {
        HashKey hashKey = findKey(key);
        if (hashKey == null) return null;
        return get(hashKey);
    }

    /** Decodes the first frame of the slot if necessary and returns the first decoded frame. */
    public AbstractID3v2FrameData getDecoded(HashKey key) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null || frames.isEmpty()) return null;
        decode(key, frames.get(0));
        return get(key);
    }

    public AbstractID3v2FrameData getDecoded(String key) {
        HashKey hashKey = findKey(key);
        if (hashKey == null) return null;
        return getDecoded(hashKey);
    }

    /** Replaces the content of a slot, creating the slot at the end if it does not exist. */
    public void setAll(HashKey key, List<? extends AbstractID3v2FrameData> frames) {
        List<LazyFrame> lazyFrames = new ArrayList<>(frames.size());
        for (AbstractID3v2FrameData frame : frames) {
            lazyFrames.add(LazyFrame.decoded(frame));
        }
        frameSets.put(key, lazyFrames);
    }

    public void setAll(String key, List<? extends AbstractID3v2FrameData> frames) {
        HashKey hashKey = findKey(key);
        setAll(hashKey != null ? hashKey : HashKey.parse(key), frames);
    }

    public void deleteAll(HashKey key) {
        frameSets.remove(key);
    }

    public void deleteAll(String key) {
        HashKey hashKey = findKey(key);
        if (hashKey != null) deleteAll(hashKey);
    }

    /** The rendered slot keys in insertion order, e.g. {@code TIT2}, {@code COMM:d1:eng}. */
    public List<String> keys() {
        List<String> keys = new ArrayList<>(frameSets.size());
        for (HashKey key : frameSets.keySet()) {
            keys.add(key.toString());
        }
        return keys;
    }

    public Set<HashKey> hashKeys() {
        return Collections.unmodifiableSet(frameSets.keySet());
    }

    /** All decoded frames in slot order; undecoded frames are skipped. */
    public List<AbstractID3v2FrameData> values() {
        List<AbstractID3v2FrameData> values = new ArrayList<>();
        for (List<LazyFrame> frames : frameSets.values()) {
            for (LazyFrame frame : frames) {
                if (frame.isDecoded()) values.add(frame.getDecoded());
            }
        }
        return values;
    }

    /** Decodes every frame and returns all that decoded, in slot order. */
    public List<AbstractID3v2FrameData> valuesDecoded() {
        for (Map.Entry<HashKey, List<LazyFrame>> entry : frameSets.entrySet()) {
            for (LazyFrame frame : entry.getValue()) {
                decode(entry.getKey(), frame);
            }
        }
        return values();
    }

    public boolean containsKey(HashKey key) {
        return frameSets.containsKey(key);
    }

    public boolean containsKey(String key) {
        return findKey(key) != null;
    }

    /** Number of slots. */
    public int size() {
        return frameSets.size();
    }

    public boolean isEmpty() {
        return frameSets.isEmpty();
    }

    public int getMajorVersion() {
        return majorVersion;
    }

    public int getRevision() {
        return revision;
    }

    public List<UnknownFrame> getUnknownFrames() {
        return Collections.unmodifiableList(unknownFrames);
    }

    List<LazyFrame> getLazyFrames(HashKey key) {
        List<LazyFrame> frames = frameSets.get(key);
        if (frames == null) return Collections.emptyList();
        return Collections.unmodifiableList(frames);
    }

    private HashKey findKey(String key) {
        for (HashKey hashKey : frameSets.keySet()) {
            if (hashKey.toString().equals(key)) return hashKey;
        }
        return null;
    }

    private void decode(HashKey key, LazyFrame frame) {
        if (frame.isDecoded()) return;
        try {
            frame.decode(buffers, parser);
        } catch (InvalidDataException e) {
            log.warn("Could not decode frame {} in slot {}: {}", frame.getFrameId(), key, e.getMessage());
        }
    }

    /**
     * Populates this container from a tag's frame region.
     *
     * @param data the tag data following the ten-byte header, already synchronised if
     *     the header requested whole-tag unsynchronisation
     * @param header the parsed tag header
     */
    public void readFrames(byte[] data, ID3v2Header header) {
        int version = header.getMajorVersion();
        majorVersion = version;
        revision = header.getRevision();
        int offset = 0;
        if (header.hasExtendedHeader() && version >= 3) {
            if (data.length < 4) return;
            if (version == 4) {
                offset = BufferTools.unpackSynchsafeInteger(data, 0);
            } else {
                offset = (int) Math.min(BufferTools.unpackInteger(data, 0) + 4, Integer.MAX_VALUE);
            }
            if (offset < 0 || offset >= data.length) {
                log.debug("Extended header of {} bytes leaves no frame data", offset);
                return;
            }
        }

        byte[] buffer = BufferTools.copyBuffer(data, 0, data.length);
        int handle = buffers.register(buffer);
        if (version == 2) {
            readV22Frames(buffer, offset);
        } else {
            int bits = BufferTools.NORMAL_BITS;
            if (version == 4) {
                bits = FrameSizeHeuristic.determineBitsPerInteger(buffer, offset, buffer.length);
                if (bits == BufferTools.NORMAL_BITS) {
                    log.debug("ID3v2.4 frame sizes are plain integers, not syncsafe");
                }
            }
            readV23V24Frames(buffer, handle, offset, version, bits);
        }
    }

    private void readV22Frames(byte[] data, int offset) {
        while (offset + V22_FRAME_HEADER_LENGTH <= data.length) {
            if (data[offset] == 0) break;
            if (!BufferTools.isValidFrameId(data, offset, V22_FRAME_ID_LENGTH)) {
                log.debug("Invalid frame ID at offset {}, treating rest as padding", offset);
                break;
            }
            String id = new String(data, offset, V22_FRAME_ID_LENGTH, StandardCharsets.US_ASCII);
            int size = (int) BufferTools.unpackBitPaddedInteger(data, offset + V22_FRAME_ID_LENGTH, 3, BufferTools.NORMAL_BITS);
            offset += V22_FRAME_HEADER_LENGTH;
            if (size == 0 || offset + size > data.length) {
                log.debug("Frame {} of {} bytes does not fit the tag", id, size);
                break;
            }
            byte[] frameData = BufferTools.copyBuffer(data, offset, size);
            offset += size;

            if (ID3v2ObseletePictureFrameData.V22_ID.equals(id)) {
                try {
                    add(new ID3v2ObseletePictureFrameData(frameData));
                } catch (InvalidDataException e) {
                    log.debug("Keeping malformed PIC frame as unknown: {}", e.getMessage());
                    unknownFrames.add(new UnknownFrame(id, frameData));
                }
                continue;
            }

            String mappedId = ID3v22FrameIds.toV24(id);
            if (mappedId == null) {
                unknownFrames.add(new UnknownFrame(id, frameData));
                continue;
            }
            addRaw(mappedId, frameData);
        }
    }

    private void readV23V24Frames(byte[] data, int handle, int offset, int version, int bits) {
        while (offset + FRAME_HEADER_LENGTH <= data.length) {
            if (data[offset] == 0) break;
            if (!BufferTools.isValidFrameId(data, offset, FRAME_ID_LENGTH)) {
                log.debug("Invalid frame ID at offset {}, treating rest as padding", offset);
                break;
            }
            int idOffset = offset;
            long size = BufferTools.unpackBitPaddedInteger(data, offset + FRAME_ID_LENGTH, 4, bits);
            int flags = (int) BufferTools.unpackBitPaddedInteger(data, offset + 8, 2, BufferTools.NORMAL_BITS);
            offset += FRAME_HEADER_LENGTH;
            if (size == 0 || offset + size > data.length) {
                log.debug("Frame at offset {} of {} bytes does not fit the tag", idOffset, size);
                break;
            }
            int frameSize = (int) size;

            boolean compressed;
            boolean encrypted;
            boolean unsynchronised;
            boolean dataLengthIndicator;
            if (version == 4) {
                compressed = (flags & V24_COMPRESSION_FLAG) != 0;
                encrypted = (flags & V24_ENCRYPTION_FLAG) != 0;
                unsynchronised = (flags & V24_UNSYNCHRONISATION_FLAG) != 0;
                dataLengthIndicator = (flags & V24_DATA_LENGTH_INDICATOR_FLAG) != 0;
            } else {
                compressed = (flags & V23_COMPRESSION_FLAG) != 0;
                encrypted = (flags & V23_ENCRYPTION_FLAG) != 0;
                unsynchronised = false;
                // a compressed v2.3 frame starts with its four-byte decompressed size
                dataLengthIndicator = compressed;
            }

            if (!compressed && !encrypted && !unsynchronised && !dataLengthIndicator) {
                HashKey key = ID3v2FrameFactory.quickHashKey(
                        new String(data, idOffset, FRAME_ID_LENGTH, StandardCharsets.US_ASCII), data, offset, frameSize);
                addToSet(key, LazyFrame.slice(data, idOffset, handle, offset, frameSize));
                offset += frameSize;
                continue;
            }

            String id = new String(data, idOffset, FRAME_ID_LENGTH, StandardCharsets.US_ASCII);
            byte[] frameData = BufferTools.copyBuffer(data, offset, frameSize);
            offset += frameSize;

            if (encrypted) {
                unknownFrames.add(new UnknownFrame(id, frameData));
                continue;
            }
            if (dataLengthIndicator && frameData.length >= DATA_LENGTH_INDICATOR_LENGTH) {
                frameData = BufferTools.copyBuffer(frameData, DATA_LENGTH_INDICATOR_LENGTH,
                        frameData.length - DATA_LENGTH_INDICATOR_LENGTH);
            }
            if (unsynchronised) {
                frameData = BufferTools.synchroniseBuffer(frameData);
            }
            if (compressed) {
                try {
                    frameData = inflate(frameData);
                } catch (BadCompressedDataException e) {
                    log.debug("Keeping frame {} as unknown: {}", id, e.getDetailedMessage());
                    unknownFrames.add(new UnknownFrame(id, frameData));
                    continue;
                }
            }
            addRaw(id, frameData);
        }
    }

    static byte[] inflate(byte[] bytes) throws BadCompressedDataException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(bytes);
            ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length * 2);
            byte[] chunk = new byte[4096];
            while (!inflater.finished()) {
                int inflated = inflater.inflate(chunk);
                if (inflated == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new BadCompressedDataException("Truncated compressed frame");
                }
                out.write(chunk, 0, inflated);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new BadCompressedDataException("Bad compressed frame", e);
        } finally {
            inflater.end();
        }
    }

    /**
     * Renders all frames in slot order, each with a ten-byte frame header carrying no
     * flags. Undecoded frames are written back verbatim. Unknown frames are not written.
     *
     * @param majorVersion 3 (plain frame sizes) or 4 (syncsafe frame sizes)
     * @return the concatenated frames
     */
    public byte[] render(int majorVersion) {
        if (majorVersion != 3 && majorVersion != 4) {
            throw new IllegalArgumentException("Cannot write ID3v2." + majorVersion + " frames");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(4096);
        for (List<LazyFrame> frames : frameSets.values()) {
            for (LazyFrame frame : frames) {
                byte[] id = frame.getFrameId().getBytes(StandardCharsets.ISO_8859_1);
                byte[] payload = frame.payload(buffers, majorVersion);
                byte[] size = majorVersion == 4
                        ? BufferTools.packSynchsafeInteger(payload.length)
                        : BufferTools.packInteger(payload.length);
                out.write(id, 0, id.length);
                out.write(size, 0, size.length);
                out.write(0);
                out.write(0);
                out.write(payload, 0, payload.length);
            }
        }
        return out.toByteArray();
    }
}
