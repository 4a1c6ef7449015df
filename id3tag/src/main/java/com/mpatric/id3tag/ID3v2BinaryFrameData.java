package com.mpatric.id3tag;

import java.util.Arrays;

/**
 * Any frame without a dedicated codec. The payload is kept and written back verbatim.
 */
public class ID3v2BinaryFrameData extends AbstractID3v2FrameData {

    protected byte[] data;

    public ID3v2BinaryFrameData(String id, byte[] data) {
        super(id);
        this.data = data;
    }

    @Override
    protected void unpackFrameData(byte[] bytes) {
        data = bytes;
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        return data;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public String pprint() {
        return "[" + data.length + " bytes]";
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        return Arrays.equals(data, ((ID3v2BinaryFrameData) obj).data);
    }
}
