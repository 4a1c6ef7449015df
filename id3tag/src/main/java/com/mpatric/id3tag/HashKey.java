package com.mpatric.id3tag;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Key of a slot in {@link ID3v2Tags}. Simple keys are just the frame ID ({@code TIT2});
 * composite keys add the fields that let a frame repeat, e.g. description and language
 * for {@code COMM}. Equality compares the parts, not the rendered string, so a
 * description containing {@code ':'} cannot collide with another key.
 */
public final class HashKey {

    private final String frameId;
    private final List<String> discriminators;

    private HashKey(String frameId, List<String> discriminators) {
        if (frameId == null) throw new NullPointerException("frameId");
        this.frameId = frameId;
        this.discriminators = discriminators;
    }

    public static HashKey of(String frameId) {
        return new HashKey(frameId, Collections.<String>emptyList());
    }

    public static HashKey of(String frameId, String... discriminators) {
        for (String d : discriminators) {
            if (d == null) throw new NullPointerException("discriminator");
        }
        return new HashKey(frameId, Collections.unmodifiableList(Arrays.asList(discriminators.clone())));
    }

    /**
     * Best-effort inverse of {@link #toString()}: the text before the first colon is the
     * frame ID, the rest is split on colons. Only used when a caller names a slot that
     * does not exist yet.
     */
    public static HashKey parse(String key) {
        int colon = key.indexOf(':');
        if (colon < 0) return of(key);
        return of(key.substring(0, colon), key.substring(colon + 1).split(":", -1));
    }

    public String getFrameId() {
        return frameId;
    }

    public List<String> getDiscriminators() {
        return discriminators;
    }

    public boolean isComposite() {
        return !discriminators.isEmpty();
    }

    @Override
    public int hashCode() {
        return 31 * frameId.hashCode() + discriminators.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (getClass() != obj.getClass()) return false;
        HashKey other = (HashKey) obj;
        return frameId.equals(other.frameId) && discriminators.equals(other.discriminators);
    }

    /** {@code ID[:part]...}, e.g. {@code COMM:d1:eng}. */
    @Override
    public String toString() {
        if (discriminators.isEmpty()) return frameId;
        StringBuilder s = new StringBuilder(frameId);
        for (String d : discriminators) {
            s.append(':').append(d);
        }
        return s.toString();
    }
}
