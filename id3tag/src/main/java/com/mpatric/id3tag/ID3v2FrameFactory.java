package com.mpatric.id3tag;

/**
 * Dispatches a frame payload to the codec for its frame ID, and computes slot keys
 * straight from payload bytes without decoding the whole frame.
 */
public final class ID3v2FrameFactory {

    public static final FrameDataParser DEFAULT_PARSER = new FrameDataParser() {
        @Override
        public AbstractID3v2FrameData parse(String id, byte[] bytes, int offset, int length) throws InvalidDataException {
            return createFrameData(id, BufferTools.copyBuffer(bytes, offset, length));
        }
    };

    private ID3v2FrameFactory() {}

    public static AbstractID3v2FrameData createFrameData(String id, byte[] bytes) throws InvalidDataException {
        if (isPairedTextFrame(id)) {
            return new ID3v2PairedTextFrameData(id, bytes);
        }
        if (ID3v2UserTextFrameData.ID.equals(id)) {
            return new ID3v2UserTextFrameData(bytes);
        }
        if (id.startsWith("T")) {
            return new ID3v2TextFrameData(id, bytes);
        }
        if (ID3v2UserUrlFrameData.ID.equals(id)) {
            return new ID3v2UserUrlFrameData(bytes);
        }
        if (id.startsWith("W")) {
            return new ID3v2UrlFrameData(id, bytes);
        }
        switch (id) {
            case ID3v2CommentFrameData.ID:
                return new ID3v2CommentFrameData(bytes);
            case ID3v2LyricsFrameData.ID:
                return new ID3v2LyricsFrameData(bytes);
            case ID3v2PictureFrameData.ID:
                return new ID3v2PictureFrameData(bytes);
            case ID3v2PopmFrameData.ID:
                return new ID3v2PopmFrameData(bytes);
            default:
                return new ID3v2BinaryFrameData(id, bytes);
        }
    }

    static boolean isPairedTextFrame(String id) {
        return "TIPL".equals(id) || "TMCL".equals(id) || "IPLS".equals(id);
    }

    /**
     * Computes the slot key of a frame from its raw payload, reading only the leading
     * fields that make up the key: encoding and description for {@code TXXX}/{@code WXXX},
     * encoding, language and description for {@code COMM}/{@code USLT}, the description
     * after MIME type and picture type for {@code APIC}, the e-mail for {@code POPM}.
     * Falls back to the bare frame ID when those fields are malformed. For well-formed
     * payloads the result equals {@code createFrameData(id, payload).getHashKey()}.
     */
    public static HashKey quickHashKey(String id, byte[] bytes, int offset, int length) {
        int end = offset + length;
        switch (id) {
            case ID3v2UserTextFrameData.ID:
            case ID3v2UserUrlFrameData.ID: {
                if (length == 0) return HashKey.of(id);
                TextEncoding encoding = encodingOrNull(bytes[offset]);
                if (encoding == null) return HashKey.of(id);
                return HashKey.of(id, readTerminated(encoding, bytes, offset + 1, end));
            }
            case ID3v2CommentFrameData.ID:
            case ID3v2LyricsFrameData.ID: {
                if (length < 4) return HashKey.of(id);
                TextEncoding encoding = encodingOrNull(bytes[offset]);
                if (encoding == null) return HashKey.of(id);
                String language = ID3v2CommentFrameData.readLanguage(bytes, offset + 1);
                return HashKey.of(id, readTerminated(encoding, bytes, offset + 4, end), language);
            }
            case ID3v2PictureFrameData.ID: {
                if (length == 0) return HashKey.of(id);
                TextEncoding encoding = encodingOrNull(bytes[offset]);
                if (encoding == null) return HashKey.of(id);
                int mimeEnd = BufferTools.indexOfTerminator(bytes, offset + 1, end, 1);
                if (mimeEnd < 0 || mimeEnd + 1 >= end) return HashKey.of(id);
                return HashKey.of(id, readTerminated(encoding, bytes, mimeEnd + 2, end));
            }
            case ID3v2PopmFrameData.ID:
                return HashKey.of(id, readTerminated(TextEncoding.ISO_8859_1, bytes, offset, end));
            default:
                return HashKey.of(id);
        }
    }

    private static TextEncoding encodingOrNull(byte b) {
        try {
            return TextEncoding.fromByte(b);
        } catch (InvalidDataException e) {
            return null;
        }
    }

    private static String readTerminated(TextEncoding encoding, byte[] bytes, int from, int to) {
        int marker = encoding.indexOfTerminator(bytes, from, to);
        if (marker < 0) marker = to;
        return encoding.decode(bytes, from, marker - from);
    }

    /** Same as {@link #quickHashKey(String, byte[], int, int)} over a whole payload. */
    public static HashKey quickHashKey(String id, byte[] bytes) {
        return quickHashKey(id, bytes, 0, bytes.length);
    }
}
