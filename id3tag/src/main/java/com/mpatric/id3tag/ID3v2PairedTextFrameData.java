package com.mpatric.id3tag;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code TIPL}, {@code TMCL} and {@code IPLS}: a flat, terminator-separated list of
 * alternating role and name values.
 */
public class ID3v2PairedTextFrameData extends AbstractID3v2FrameData {

    protected TextEncoding encoding;
    protected List<Credit> credits;

    public ID3v2PairedTextFrameData(String id, TextEncoding encoding, List<Credit> credits) {
        super(id);
        this.encoding = encoding;
        this.credits = new ArrayList<>(credits);
    }

    public ID3v2PairedTextFrameData(String id, byte[] bytes) throws InvalidDataException {
        super(id);
        unpackFrameData(bytes);
    }

    @Override
    protected void unpackFrameData(byte[] bytes) throws InvalidDataException {
        credits = new ArrayList<>();
        if (bytes.length == 0) {
            encoding = TextEncoding.ISO_8859_1;
            return;
        }
        encoding = TextEncoding.fromByte(bytes[0]);
        List<String> values = encoding.splitAndDecode(bytes, 1, bytes.length - 1);
        // an odd trailing value has no partner and is dropped
        for (int i = 0; i + 1 < values.size(); i += 2) {
            credits.add(new Credit(values.get(i), values.get(i + 1)));
        }
    }

    @Override
    protected byte[] packFrameData(int majorVersion) {
        TextEncoding writeEncoding = encoding.forWriting(majorVersion);
        List<String> values = new ArrayList<>(credits.size() * 2);
        for (Credit credit : credits) {
            values.add(credit.getRole());
            values.add(credit.getName());
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(writeEncoding.getCode());
        write(out, writeEncoding.encodeList(values));
        return out.toByteArray();
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    public List<Credit> getCredits() {
        return Collections.unmodifiableList(credits);
    }

    @Override
    public String pprint() {
        StringBuilder s = new StringBuilder();
        for (Credit credit : credits) {
            if (s.length() > 0) s.append('/');
            s.append(credit.getRole()).append('=').append(credit.getName());
        }
        return s.toString();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + encoding.hashCode();
        result = prime * result + credits.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        ID3v2PairedTextFrameData other = (ID3v2PairedTextFrameData) obj;
        return encoding == other.encoding && credits.equals(other.credits);
    }

    /** One role/name pair, e.g. {@code producer} / {@code Jane Doe}. */
    public static final class Credit {

        private final String role;
        private final String name;

        public Credit(String role, String name) {
            this.role = role;
            this.name = name;
        }

        public String getRole() {
            return role;
        }

        public String getName() {
            return name;
        }

        @Override
        public int hashCode() {
            return 31 * role.hashCode() + name.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Credit)) return false;
            Credit other = (Credit) obj;
            return role.equals(other.role) && name.equals(other.name);
        }

        @Override
        public String toString() {
            return role + "=" + name;
        }
    }
}
